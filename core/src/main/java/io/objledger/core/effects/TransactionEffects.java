// file: src/main/java/io/objledger/core/effects/TransactionEffects.java
package io.objledger.core.effects;

import io.objledger.core.Digests;
import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.gas.GasCostSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Verifiable record of what one transaction did to the object set.
 * <p>
 * Invariants:
 *  - every id appears in at most one of created, mutated, unwrapped,
 *    deleted, wrapped and unwrappedThenDeleted,
 *  - every ref in those lists carries {@link #lamportVersion()},
 *  - the gas object is in mutated,
 *  - lists are sorted by id so the encoding, and the digest, is deterministic.
 */
public record TransactionEffects(
        ExecutionStatus status,
        TransactionDigest transactionDigest,
        SequenceNumber lamportVersion,
        List<OwnedObjectRef> created,
        List<OwnedObjectRef> mutated,
        List<OwnedObjectRef> unwrapped,
        List<ObjectRef> deleted,
        List<ObjectRef> wrapped,
        List<ObjectRef> unwrappedThenDeleted,
        OwnedObjectRef gasObject,
        SortedMap<ObjectID, SequenceNumber> modifiedAtVersions,
        List<ObjectRef> sharedObjects,
        List<TransactionDigest> dependencies,
        GasCostSummary gasUsed) {

    public TransactionEffects {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(transactionDigest, "transactionDigest");
        Objects.requireNonNull(lamportVersion, "lamportVersion");
        created = List.copyOf(created);
        mutated = List.copyOf(mutated);
        unwrapped = List.copyOf(unwrapped);
        deleted = List.copyOf(deleted);
        wrapped = List.copyOf(wrapped);
        unwrappedThenDeleted = List.copyOf(unwrappedThenDeleted);
        Objects.requireNonNull(gasObject, "gasObject");
        modifiedAtVersions = Collections.unmodifiableSortedMap(new TreeMap<>(modifiedAtVersions));
        sharedObjects = List.copyOf(sharedObjects);
        dependencies = List.copyOf(dependencies);
        Objects.requireNonNull(gasUsed, "gasUsed");
    }

    /** Every object this transaction wrote live (created, mutated or unwrapped). */
    public List<OwnedObjectRef> allChangedObjects() {
        List<OwnedObjectRef> out = new ArrayList<>(created.size() + mutated.size() + unwrapped.size());
        out.addAll(created);
        out.addAll(mutated);
        out.addAll(unwrapped);
        return out;
    }

    /** Mutated objects other than the gas object. */
    public List<OwnedObjectRef> mutatedExcludingGas() {
        return mutated.stream().filter(o -> !o.ref().id().equals(gasObject.ref().id())).toList();
    }

    public byte[] encode() {
        BcsWriter w = new BcsWriter();
        ExecutionStatus.encode(w, status);
        transactionDigest.encode(w);
        lamportVersion.encode(w);
        w.writeVector(created, (ww, o) -> o.encode(ww));
        w.writeVector(mutated, (ww, o) -> o.encode(ww));
        w.writeVector(unwrapped, (ww, o) -> o.encode(ww));
        w.writeVector(deleted, (ww, r) -> r.encode(ww));
        w.writeVector(wrapped, (ww, r) -> r.encode(ww));
        w.writeVector(unwrappedThenDeleted, (ww, r) -> r.encode(ww));
        gasObject.encode(w);
        w.writeVector(modifiedAtVersions.entrySet(), (ww, e) -> {
            e.getKey().encode(ww);
            e.getValue().encode(ww);
        });
        w.writeVector(sharedObjects, (ww, r) -> r.encode(ww));
        w.writeVector(dependencies, (ww, d) -> d.encode(ww));
        gasUsed.encode(w);
        return w.toByteArray();
    }

    public static TransactionEffects decode(BcsReader r) {
        ExecutionStatus status = ExecutionStatus.decode(r);
        TransactionDigest tx = TransactionDigest.decode(r);
        SequenceNumber lamport = SequenceNumber.decode(r);
        List<OwnedObjectRef> created = r.readVector(OwnedObjectRef::decode);
        List<OwnedObjectRef> mutated = r.readVector(OwnedObjectRef::decode);
        List<OwnedObjectRef> unwrapped = r.readVector(OwnedObjectRef::decode);
        List<ObjectRef> deleted = r.readVector(ObjectRef::decode);
        List<ObjectRef> wrapped = r.readVector(ObjectRef::decode);
        List<ObjectRef> utd = r.readVector(ObjectRef::decode);
        OwnedObjectRef gas = OwnedObjectRef.decode(r);
        TreeMap<ObjectID, SequenceNumber> modified = new TreeMap<>();
        int n = r.readLength();
        for (int i = 0; i < n; i++) {
            modified.put(ObjectID.decode(r), SequenceNumber.decode(r));
        }
        List<ObjectRef> shared = r.readVector(ObjectRef::decode);
        List<TransactionDigest> deps = r.readVector(TransactionDigest::decode);
        GasCostSummary gasUsed = GasCostSummary.decode(r);
        return new TransactionEffects(status, tx, lamport, created, mutated, unwrapped, deleted, wrapped, utd,
                gas, modified, shared, deps, gasUsed);
    }

    /** sha256 of {@link #encode()}. */
    public byte[] digest() {
        return Digests.sha256(encode());
    }
}
