// file: src/main/java/io/objledger/core/effects/TransactionOutputs.java
package io.objledger.core.effects;

import io.objledger.core.ObjectID;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a store persists for one transaction, atomically.
 *
 * @param written    new live object versions
 * @param tombstones wrapped markers and deletion tombstones
 */
public record TransactionOutputs(TransactionEffects effects, List<LedgerObject> written,
                                 Map<ObjectID, ObjectEntry> tombstones) {
    public TransactionOutputs {
        Objects.requireNonNull(effects, "effects");
        written = List.copyOf(written);
        tombstones = Map.copyOf(tombstones);
        for (ObjectEntry e : tombstones.values()) {
            if (e instanceof ObjectEntry.Live) throw new IllegalArgumentException("tombstones cannot be live");
        }
    }
}
