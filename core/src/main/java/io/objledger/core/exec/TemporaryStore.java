// file: src/main/java/io/objledger/core/exec/TemporaryStore.java
package io.objledger.core.exec;

import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.TransactionDigest;
import io.objledger.core.effects.ObjectWrite;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectData;
import io.objledger.core.ownership.OwnershipTransitions;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Transaction-scoped view of the object set.
 * <p>
 * Reads see inputs, runtime-loaded children and this transaction's own
 * writes. Writes are buffered as {@link ObjectWrite}s and only become ledger
 * state through the effects reducer and a store commit.
 * <p>
 * Not thread-safe; one instance per transaction.
 */
public final class TemporaryStore {
    private final TransactionDigest digest;
    private final AccountAddress sender;
    private final Map<ObjectID, LedgerObject> inputs;
    private final ChildObjectLoader childLoader;

    private final Map<ObjectID, LedgerObject> loaded = new LinkedHashMap<>();
    private final Map<ObjectID, ObjectWrite> writes = new LinkedHashMap<>();
    private final Set<ObjectID> liveDuringTx = new HashSet<>();
    private long creations;

    public TemporaryStore(TransactionDigest digest, AccountAddress sender,
                          Collection<LedgerObject> inputObjects, ChildObjectLoader childLoader) {
        this.digest = digest;
        this.sender = sender;
        this.inputs = new LinkedHashMap<>();
        for (LedgerObject o : inputObjects) inputs.put(o.id(), o);
        this.childLoader = childLoader;
    }

    public TransactionDigest digest() {
        return digest;
    }

    public AccountAddress sender() {
        return sender;
    }

    /** Deterministic id for a new object: sha256(tx digest, creation counter). */
    public ObjectID freshId() {
        return ObjectID.derive(digest, creations++);
    }

    public Optional<ObjectView> read(ObjectID id) {
        ObjectWrite w = writes.get(id);
        if (w != null) {
            return w instanceof ObjectWrite.Write live
                    ? Optional.of(new ObjectView(id, live.data(), live.owner()))
                    : Optional.empty();
        }
        LedgerObject o = inputs.containsKey(id) ? inputs.get(id) : loaded.get(id);
        return o == null ? Optional.empty() : Optional.of(new ObjectView(id, o.data(), o.owner()));
    }

    /**
     * Loads a child object that was not a transaction input. Only objects
     * owned by an object already visible to this transaction can be loaded.
     */
    public Optional<ObjectView> loadChild(ObjectID id) {
        if (inputs.containsKey(id) || loaded.containsKey(id) || writes.containsKey(id)) {
            return read(id);
        }
        Optional<LedgerObject> found = childLoader.load(id);
        if (found.isEmpty() || !(found.get().owner() instanceof Owner.ObjectOwner o) || read(o.parent()).isEmpty()) {
            return Optional.empty();
        }
        loaded.put(id, found.get());
        return read(id);
    }

    /** Creates an independent object with a fresh id. */
    public ObjectID create(ObjectData data, Owner owner) {
        ObjectID id = freshId();
        write(id, data, owner);
        return id;
    }

    /**
     * Sets the content and owner of {@code id}. Existing objects must respect
     * the allowed owner transitions.
     */
    public void write(ObjectID id, ObjectData data, Owner owner) {
        Owner prior = priorOwner(id);
        if (prior != null) {
            OwnershipTransitions.check(id, prior, owner);
        }
        writes.put(id, new ObjectWrite.Write(data, owner));
        liveDuringTx.add(id);
    }

    public void mutate(ObjectID id, byte[] contents) {
        ObjectView v = require(id);
        write(id, v.moveData().withContents(contents), v.owner());
    }

    public void transfer(ObjectID id, Owner newOwner) {
        ObjectView v = require(id);
        write(id, v.data(), newOwner);
    }

    /** Embeds {@code id} in {@code container}; it stops being addressable. */
    public void wrap(ObjectID id, ObjectID container) {
        Owner prior = priorOwner(id);
        if (prior != null) OwnershipTransitions.checkRemoval(id, prior);
        writes.put(id, new ObjectWrite.Wrap(container));
    }

    public void delete(ObjectID id) {
        Owner prior = priorOwner(id);
        if (prior != null) OwnershipTransitions.checkRemoval(id, prior);
        writes.put(id, ObjectWrite.DELETE);
    }

    /** Records an unchanged write for objects that must get a new version anyway. */
    public void touch(ObjectID id) {
        if (writes.containsKey(id)) return;
        LedgerObject o = inputs.get(id);
        if (o == null) throw new IllegalArgumentException(id + " is not an input");
        writes.put(id, new ObjectWrite.Write(o.data(), o.owner()));
    }

    /** Drops every effect of execution; used when execution fails. */
    public void discardWrites() {
        writes.clear();
        loaded.clear();
        liveDuringTx.clear();
    }

    public Map<ObjectID, ObjectWrite> writes() {
        return Collections.unmodifiableMap(writes);
    }

    public Map<ObjectID, LedgerObject> loadedChildren() {
        return Collections.unmodifiableMap(loaded);
    }

    public Set<ObjectID> liveDuringTx() {
        return Collections.unmodifiableSet(liveDuringTx);
    }

    public Map<ObjectID, LedgerObject> inputs() {
        return Collections.unmodifiableMap(inputs);
    }

    /** Sum of content sizes of objects written live. */
    public long writtenBytes() {
        long n = 0;
        for (ObjectWrite w : writes.values()) {
            if (w instanceof ObjectWrite.Write live) n += live.data().sizeInBytes();
        }
        return n;
    }

    // ----------------- helpers -----------------

    private ObjectView require(ObjectID id) {
        return read(id).orElseThrow(() -> new IllegalStateException(id + " is not visible to this transaction"));
    }

    /** Owner in the ledger before this transaction, or null for objects it did not load. */
    private Owner priorOwner(ObjectID id) {
        LedgerObject o = inputs.containsKey(id) ? inputs.get(id) : loaded.get(id);
        return o == null ? null : o.owner();
    }
}
