// file: src/main/java/io/objledger/core/ownership/ObjectTable.java
package io.objledger.core.ownership;

import io.objledger.core.ObjectID;
import io.objledger.core.object.LedgerObject;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of live objects by id. Parent chains are followed by id
 * through this table; objects hold no references to each other.
 */
@FunctionalInterface
public interface ObjectTable {
    Optional<LedgerObject> get(ObjectID id);

    static ObjectTable of(Map<ObjectID, LedgerObject> objects) {
        Map<ObjectID, LedgerObject> copy = Map.copyOf(objects);
        return id -> Optional.ofNullable(copy.get(id));
    }
}
