// file: src/main/java/io/objledger/storage/ObjectStore.java
package io.objledger.storage;

import io.objledger.core.ObjectID;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.effects.TransactionEffects;
import io.objledger.core.effects.TransactionOutputs;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;
import io.objledger.core.tx.TransactionData;

import java.util.List;
import java.util.Optional;

/**
 * Object set of one validator, as seen by the transaction pipeline.
 * <p>
 * Semantics:
 *  - every id has at most one latest entry: live, wrapped or deleted,
 *  - older live versions stay readable by (id, version),
 *  - commit() applies all outputs of one transaction at once and must be
 *    durable before returning,
 *  - commit() of a digest that is already stored is a no-op.
 */
public interface ObjectStore {

    /** Latest entry of {@code id}, whatever its state. */
    Optional<ObjectEntry> getLatestEntry(ObjectID id);

    /** Latest version of {@code id} if it is live; empty for wrapped, deleted or unknown ids. */
    default Optional<LedgerObject> getObject(ObjectID id) {
        return getLatestEntry(id)
                .filter(e -> e instanceof ObjectEntry.Live)
                .map(e -> ((ObjectEntry.Live) e).object());
    }

    /** A specific live version of {@code id}, if it was ever stored. */
    Optional<LedgerObject> getObject(ObjectID id, SequenceNumber version);

    /**
     * Latest entries whose parent is {@code parent}: live objects with an
     * object owner of {@code parent} and objects wrapped in it.
     */
    List<ObjectEntry> scanOwnedBy(ObjectID parent);

    Optional<TransactionEffects> getEffects(TransactionDigest digest);

    Optional<TransactionData> getTransaction(TransactionDigest digest);

    /** Seed an object before any transaction runs. */
    void insertGenesisObject(LedgerObject object);

    /** Apply the outputs of {@code tx}. */
    void commit(TransactionData tx, TransactionOutputs outputs);
}
