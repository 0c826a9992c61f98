// file: src/main/java/io/objledger/core/exec/ChildObjectLoader.java
package io.objledger.core.exec;

import io.objledger.core.ObjectID;
import io.objledger.core.object.LedgerObject;

import java.util.Optional;

/** Reads the latest live version of an object that was not a transaction input. */
@FunctionalInterface
public interface ChildObjectLoader {
    Optional<LedgerObject> load(ObjectID id);

    ChildObjectLoader NONE = id -> Optional.empty();
}
