// file: src/main/java/io/objledger/core/effects/EffectsBuilder.java
package io.objledger.core.effects;

import io.objledger.core.ExecutionLimits;
import io.objledger.core.ObjectDigest;
import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.VersionAssigner;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces (prior state, final writes) into effects and the outputs to persist.
 * <p>
 * Classification of every written id:
 * <pre>
 *   prior \ final   live          wrap                 delete
 *   none            created       wrapped*             deleted*
 *   live            mutated       wrapped              deleted
 *   wrapped         unwrapped     (still wrapped)      unwrapped_then_deleted
 * </pre>
 * (*) only if the id existed independently during the transaction; ids that
 * were only ever embedded in another object are reported nowhere.
 * <p>
 * Deleting an object also deletes, transitively, every object still owned by
 * it or wrapped in it at the end of execution, including objects created
 * during the transaction.
 * <p>
 * Pure: no I/O, no shared state. The same input always yields the same output.
 */
public final class EffectsBuilder {
    private final ExecutionLimits limits;

    public EffectsBuilder(ExecutionLimits limits) {
        this.limits = limits;
    }

    public TransactionOutputs build(EffectsInput in) {
        List<SequenceNumber> causal = new ArrayList<>(in.causalVersions());
        for (PriorState p : in.pre().values()) causal.add(p.version());
        VersionAssigner versions = VersionAssigner.assign(causal);
        SequenceNumber lamport = versions.lamportVersion();

        Map<ObjectID, ObjectWrite> writes = new TreeMap<>(in.writes());
        cascadeDeletes(in.pre(), writes);

        List<OwnedObjectRef> created = new ArrayList<>();
        List<OwnedObjectRef> mutated = new ArrayList<>();
        List<OwnedObjectRef> unwrapped = new ArrayList<>();
        List<ObjectRef> deleted = new ArrayList<>();
        List<ObjectRef> wrapped = new ArrayList<>();
        List<ObjectRef> unwrappedThenDeleted = new ArrayList<>();
        TreeMap<ObjectID, SequenceNumber> modifiedAt = new TreeMap<>();
        List<LedgerObject> written = new ArrayList<>();
        Map<ObjectID, ObjectEntry> tombstones = new HashMap<>();
        OwnedObjectRef gas = null;

        for (Map.Entry<ObjectID, ObjectWrite> e : writes.entrySet()) {
            ObjectID id = e.getKey();
            ObjectWrite write = e.getValue();
            PriorState prior = in.pre().get(id);
            boolean wasLive = prior instanceof PriorState.Live;
            boolean wasWrapped = prior instanceof PriorState.Wrapped;
            boolean independent = wasLive || in.liveDuringTx().contains(id);

            if (write instanceof ObjectWrite.Write w) {
                SequenceNumber v = versions.stamp(id, prior == null ? null : prior.version());
                Owner owner = w.owner();
                if (prior == null && owner instanceof Owner.Shared) {
                    owner = Owner.shared(lamport); // shared at creation: initial version is this one
                }
                LedgerObject obj = new LedgerObject(id, v, owner, in.transaction(), w.data());
                written.add(obj);
                OwnedObjectRef ref = new OwnedObjectRef(obj.reference(), owner);
                if (prior == null) {
                    created.add(ref);
                } else if (wasLive) {
                    mutated.add(ref);
                    modifiedAt.put(id, prior.version());
                } else {
                    unwrapped.add(ref);
                }
                if (id.equals(in.gasObject())) gas = ref;
            } else if (write instanceof ObjectWrite.Wrap wrap) {
                if (wasWrapped) {
                    // moved between containers without surfacing; keep the marker current
                    tombstones.put(id, new ObjectEntry.Wrapped(id, prior.version(), wrap.container()));
                } else if (independent) {
                    SequenceNumber v = versions.stamp(id, prior == null ? null : prior.version());
                    wrapped.add(new ObjectRef(id, v, ObjectDigest.WRAPPED));
                    tombstones.put(id, new ObjectEntry.Wrapped(id, v, wrap.container()));
                    if (wasLive) modifiedAt.put(id, prior.version());
                }
            } else {
                if (wasWrapped) {
                    SequenceNumber v = versions.stamp(id, prior.version());
                    unwrappedThenDeleted.add(new ObjectRef(id, v, ObjectDigest.DELETED));
                    tombstones.put(id, new ObjectEntry.Deleted(id, v));
                } else if (independent) {
                    SequenceNumber v = versions.stamp(id, prior == null ? null : prior.version());
                    deleted.add(new ObjectRef(id, v, ObjectDigest.DELETED));
                    tombstones.put(id, new ObjectEntry.Deleted(id, v));
                    if (wasLive) modifiedAt.put(id, prior.version());
                }
            }
        }

        if (gas == null) {
            throw new IllegalStateException("gas object " + in.gasObject() + " was not written live");
        }
        if (!in.pre().containsKey(in.gasObject())) {
            throw new IllegalStateException("gas object " + in.gasObject() + " has no prior state");
        }

        List<ObjectRef> shared = new ArrayList<>(in.sharedInputs());
        Collections.sort(shared);
        var deps = new ArrayList<>(in.dependencies());
        Collections.sort(deps);

        TransactionEffects effects = new TransactionEffects(
                in.status(), in.transaction(), lamport,
                created, mutated, unwrapped, deleted, wrapped, unwrappedThenDeleted,
                gas, modifiedAt, shared, deps, in.gasUsed());
        return new TransactionOutputs(effects, written, tombstones);
    }

    /**
     * Adds a Delete for every descendant of a deleted object. Ownership is
     * taken from the final writes where an object was written and from the
     * prior state otherwise, so children created or attached during the
     * transaction are removed along with their parent.
     *
     * @throws IllegalStateException if more than {@code maxCascadeObjects} objects would be deleted
     */
    private void cascadeDeletes(Map<ObjectID, PriorState> pre, Map<ObjectID, ObjectWrite> writes) {
        Map<ObjectID, List<ObjectID>> childrenOf = new HashMap<>();
        for (PriorState p : pre.values()) {
            if (writes.containsKey(p.id())) continue;
            ObjectID parent = null;
            if (p instanceof PriorState.Live l && l.object().owner() instanceof Owner.ObjectOwner o) {
                parent = o.parent();
            } else if (p instanceof PriorState.Wrapped w) {
                parent = w.container();
            }
            if (parent != null) {
                childrenOf.computeIfAbsent(parent, k -> new ArrayList<>()).add(p.id());
            }
        }
        for (Map.Entry<ObjectID, ObjectWrite> e : writes.entrySet()) {
            ObjectID parent = null;
            if (e.getValue() instanceof ObjectWrite.Write w && w.owner() instanceof Owner.ObjectOwner o) {
                parent = o.parent();
            } else if (e.getValue() instanceof ObjectWrite.Wrap wrap) {
                parent = wrap.container();
            }
            if (parent != null) {
                childrenOf.computeIfAbsent(parent, k -> new ArrayList<>()).add(e.getKey());
            }
        }
        if (childrenOf.isEmpty()) return;

        Deque<ObjectID> queue = new ArrayDeque<>();
        for (Map.Entry<ObjectID, ObjectWrite> e : writes.entrySet()) {
            if (e.getValue() instanceof ObjectWrite.Delete) queue.add(e.getKey());
        }
        int cascaded = 0;
        while (!queue.isEmpty()) {
            ObjectID parent = queue.poll();
            for (ObjectID child : childrenOf.getOrDefault(parent, List.of())) {
                if (writes.get(child) instanceof ObjectWrite.Delete) continue;
                if (++cascaded > limits.maxCascadeObjects()) {
                    throw new IllegalStateException(
                            "cascading delete exceeds " + limits.maxCascadeObjects() + " objects");
                }
                writes.put(child, ObjectWrite.DELETE);
                queue.add(child);
            }
        }
    }
}
