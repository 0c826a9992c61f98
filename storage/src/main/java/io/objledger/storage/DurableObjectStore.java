// file: src/main/java/io/objledger/storage/DurableObjectStore.java
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
import java.util.logging.Logger;

/**
 * Durable object store: an {@link InMemoryObjectStore} fronted by a
 * {@link CommitLog}.
 * <p>
 * Responsibilities:
 *  - On commit:
 *      1) Encode the transaction and its outputs as one log record.
 *      2) Append+fsync the record.
 *      3) Apply the outputs to memory.
 *      4) Rotate the log segment if needed.
 * <p>
 *  - On startup: replay every valid record in order. Commits are
 *    idempotent by transaction digest, so a record applied twice has no
 *    further effect.
 */
public class DurableObjectStore implements ObjectStore, AutoCloseable {
    private static final Logger log = Logger.getLogger(DurableObjectStore.class.getName());

    private final InMemoryObjectStore mem = new InMemoryObjectStore();
    private final CommitLog commitLog;

    public DurableObjectStore(CommitLog commitLog) {
        this.commitLog = commitLog;
        recover();
    }

    @Override
    public Optional<ObjectEntry> getLatestEntry(ObjectID id) {
        return mem.getLatestEntry(id);
    }

    @Override
    public Optional<LedgerObject> getObject(ObjectID id, SequenceNumber version) {
        return mem.getObject(id, version);
    }

    @Override
    public List<ObjectEntry> scanOwnedBy(ObjectID parent) {
        return mem.scanOwnedBy(parent);
    }

    @Override
    public Optional<TransactionEffects> getEffects(TransactionDigest digest) {
        return mem.getEffects(digest);
    }

    @Override
    public Optional<TransactionData> getTransaction(TransactionDigest digest) {
        return mem.getTransaction(digest);
    }

    @Override
    public synchronized void insertGenesisObject(LedgerObject object) {
        if (mem.getLatestEntry(object.id()).isPresent()) {
            throw new IllegalStateException("genesis object " + object.id() + " already exists");
        }
        commitLog.append(CommitRecordCodec.encodeGenesis(object));
        mem.insertGenesisObject(object);
        commitLog.rotateIfNeeded();
    }

    @Override
    public synchronized void commit(TransactionData tx, TransactionOutputs outputs) {
        if (mem.getEffects(outputs.effects().transactionDigest()).isPresent()) return;
        // durable before visible: a crash after append is recovered by replay
        commitLog.append(CommitRecordCodec.encodeTransaction(tx, outputs));
        mem.commit(tx, outputs);
        commitLog.rotateIfNeeded();
    }

    /** True once at least one object exists, that is, genesis has run. */
    public boolean isInitialized() {
        return mem.size() > 0;
    }

    @Override
    public void close() throws Exception {
        commitLog.close();
    }

    private void recover() {
        int genesis = 0;
        int transactions = 0;
        try (CommitLog.LogReader r = commitLog.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                CommitRecordCodec.CommitRecord rec = CommitRecordCodec.decode(payload);
                if (rec instanceof CommitRecordCodec.GenesisRecord g) {
                    mem.insertGenesisObject(g.object());
                    genesis++;
                } else {
                    CommitRecordCodec.TransactionRecord t = (CommitRecordCodec.TransactionRecord) rec;
                    mem.commit(t.transaction(), t.outputs());
                    transactions++;
                }
            }
        } catch (RuntimeException e) {
            throw new RuntimeException("Recovery failed", e);
        }
        log.info("recovered " + genesis + " genesis objects and " + transactions + " transactions");
    }
}
