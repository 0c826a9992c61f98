// file: src/main/java/io/objledger/core/object/LedgerObject.java
package io.objledger.core.object;

import io.objledger.core.Digests;
import io.objledger.core.ObjectDigest;
import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.types.StructTag;

import java.util.Objects;
import java.util.Optional;

/**
 * One immutable version of a ledger object.
 * <p>
 * Invariants:
 *  - (id, version) identifies exactly one content, so the digest is a pure
 *    function of this value,
 *  - a package is always {@link Owner.Immutable}.
 */
public final class LedgerObject {
    private final ObjectID id;
    private final SequenceNumber version;
    private final Owner owner;
    private final TransactionDigest previousTransaction;
    private final ObjectData data;

    public LedgerObject(ObjectID id, SequenceNumber version, Owner owner,
                        TransactionDigest previousTransaction, ObjectData data) {
        this.id = Objects.requireNonNull(id, "id");
        this.version = Objects.requireNonNull(version, "version");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.previousTransaction = Objects.requireNonNull(previousTransaction, "previousTransaction");
        this.data = Objects.requireNonNull(data, "data");
        if (data instanceof PackageData && owner.kind() != Owner.Kind.IMMUTABLE) {
            throw new IllegalArgumentException("package " + id + " must be immutable");
        }
    }

    public ObjectID id() { return id; }
    public SequenceNumber version() { return version; }
    public Owner owner() { return owner; }
    public TransactionDigest previousTransaction() { return previousTransaction; }
    public ObjectData data() { return data; }

    public boolean isPackage() {
        return data instanceof PackageData;
    }

    public Optional<StructTag> moveType() {
        return data instanceof MoveObjectData m ? Optional.of(m.type()) : Optional.empty();
    }

    public boolean isShared() {
        return owner.kind() == Owner.Kind.SHARED;
    }

    public boolean isImmutable() {
        return owner.kind() == Owner.Kind.IMMUTABLE;
    }

    /** sha256 of the canonical encoding. */
    public ObjectDigest digest() {
        return new ObjectDigest(Digests.sha256(encode()));
    }

    public ObjectRef reference() {
        return new ObjectRef(id, version, digest());
    }

    public byte[] encode() {
        BcsWriter w = new BcsWriter();
        encode(w);
        return w.toByteArray();
    }

    public void encode(BcsWriter w) {
        id.encode(w);
        version.encode(w);
        owner.encode(w);
        previousTransaction.encode(w);
        ObjectData.encode(w, data);
    }

    public static LedgerObject decode(BcsReader r) {
        return new LedgerObject(
                ObjectID.decode(r),
                SequenceNumber.decode(r),
                Owner.decode(r),
                TransactionDigest.decode(r),
                ObjectData.decode(r));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LedgerObject other)) return false;
        return id.equals(other.id) && version.equals(other.version) && owner.equals(other.owner)
                && previousTransaction.equals(other.previousTransaction) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, owner, previousTransaction, data);
    }

    @Override
    public String toString() {
        return "LedgerObject{" + id + "@" + version + ", owner=" + owner + ", " + data + "}";
    }
}
