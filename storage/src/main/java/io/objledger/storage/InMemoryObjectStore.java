// file: src/main/java/io/objledger/storage/InMemoryObjectStore.java
package io.objledger.storage;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.effects.TransactionEffects;
import io.objledger.core.effects.TransactionOutputs;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;
import io.objledger.core.tx.TransactionData;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Object store held entirely in memory.
 * <p>
 * Reads go straight to concurrent maps; commits are serialized so readers
 * see either none or all of a transaction's outputs for any single id.
 * A parent index (parent id to child ids) backs {@link #scanOwnedBy}.
 */
public class InMemoryObjectStore implements ObjectStore {
    private static final Logger log = Logger.getLogger(InMemoryObjectStore.class.getName());

    private final Map<ObjectID, ObjectEntry> latest = new ConcurrentHashMap<>();
    private final Map<ObjectID, Map<SequenceNumber, LedgerObject>> versions = new ConcurrentHashMap<>();
    private final Map<ObjectID, Set<ObjectID>> children = new ConcurrentHashMap<>();
    private final Map<TransactionDigest, TransactionEffects> effects = new ConcurrentHashMap<>();
    private final Map<TransactionDigest, TransactionData> transactions = new ConcurrentHashMap<>();

    @Override
    public Optional<ObjectEntry> getLatestEntry(ObjectID id) {
        return Optional.ofNullable(latest.get(id));
    }

    @Override
    public Optional<LedgerObject> getObject(ObjectID id, SequenceNumber version) {
        Map<SequenceNumber, LedgerObject> byVersion = versions.get(id);
        return byVersion == null ? Optional.empty() : Optional.ofNullable(byVersion.get(version));
    }

    @Override
    public List<ObjectEntry> scanOwnedBy(ObjectID parent) {
        Set<ObjectID> ids = children.get(parent);
        if (ids == null) return List.of();
        List<ObjectEntry> out = new ArrayList<>(ids.size());
        for (ObjectID id : ids) {
            ObjectEntry e = latest.get(id);
            if (e != null && parentOf(e) != null && parentOf(e).equals(parent)) out.add(e);
        }
        return out;
    }

    @Override
    public Optional<TransactionEffects> getEffects(TransactionDigest digest) {
        return Optional.ofNullable(effects.get(digest));
    }

    @Override
    public Optional<TransactionData> getTransaction(TransactionDigest digest) {
        return Optional.ofNullable(transactions.get(digest));
    }

    @Override
    public synchronized void insertGenesisObject(LedgerObject object) {
        if (latest.containsKey(object.id())) {
            throw new IllegalStateException("genesis object " + object.id() + " already exists");
        }
        put(new ObjectEntry.Live(object));
    }

    @Override
    public synchronized void commit(TransactionData tx, TransactionOutputs outputs) {
        TransactionDigest digest = outputs.effects().transactionDigest();
        if (effects.containsKey(digest)) {
            log.fine(() -> "tx " + digest + " already committed");
            return;
        }
        for (LedgerObject o : outputs.written()) put(new ObjectEntry.Live(o));
        for (ObjectEntry e : outputs.tombstones().values()) put(e);
        transactions.put(digest, tx);
        effects.put(digest, outputs.effects());
    }

    /** Number of ids with a latest entry, in any state. */
    public int size() {
        return latest.size();
    }

    // ----------------- helpers -----------------

    private void put(ObjectEntry entry) {
        ObjectEntry previous = latest.put(entry.id(), entry);
        if (previous != null) {
            ObjectID oldParent = parentOf(previous);
            if (oldParent != null && !oldParent.equals(parentOf(entry))) {
                Set<ObjectID> siblings = children.get(oldParent);
                if (siblings != null) siblings.remove(entry.id());
            }
        }
        ObjectID parent = parentOf(entry);
        if (parent != null) {
            children.computeIfAbsent(parent, k -> ConcurrentHashMap.newKeySet()).add(entry.id());
        }
        if (entry instanceof ObjectEntry.Live live) {
            versions.computeIfAbsent(entry.id(), k -> new ConcurrentHashMap<>())
                    .put(live.object().version(), live.object());
        }
    }

    private static ObjectID parentOf(ObjectEntry e) {
        if (e instanceof ObjectEntry.Live l && l.object().owner() instanceof Owner.ObjectOwner o) {
            return o.parent();
        }
        if (e instanceof ObjectEntry.Wrapped w) {
            return w.container();
        }
        return null;
    }
}
