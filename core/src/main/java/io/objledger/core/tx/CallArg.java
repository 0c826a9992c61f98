// file: src/main/java/io/objledger/core/tx/CallArg.java
package io.objledger.core.tx;

import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.SequenceNumber;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/** One transaction input: pure bytes, an owned/immutable object, or a shared object. */
public sealed interface CallArg permits CallArg.Pure, CallArg.ImmOrOwnedObject, CallArg.SharedObject {

    /** Id of the referenced object, empty for pure inputs. */
    Optional<ObjectID> objectId();

    record Pure(byte[] bytes) implements CallArg {
        public Pure {
            bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public Optional<ObjectID> objectId() {
            return Optional.empty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pure other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            return "Pure(" + HexFormat.of().formatHex(bytes) + ")";
        }
    }

    record ImmOrOwnedObject(ObjectRef ref) implements CallArg {
        public ImmOrOwnedObject {
            Objects.requireNonNull(ref, "ref");
        }

        @Override
        public Optional<ObjectID> objectId() {
            return Optional.of(ref.id());
        }
    }

    record SharedObject(ObjectID id, SequenceNumber initialSharedVersion, boolean mutable) implements CallArg {
        public SharedObject {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(initialSharedVersion, "initialSharedVersion");
        }

        @Override
        public Optional<ObjectID> objectId() {
            return Optional.of(id);
        }
    }

    static void encode(BcsWriter w, CallArg arg) {
        if (arg instanceof Pure p) {
            w.writeUleb128(0);
            w.writeBytes(p.bytes);
        } else if (arg instanceof ImmOrOwnedObject o) {
            w.writeUleb128(1);
            o.ref().encode(w);
        } else {
            SharedObject s = (SharedObject) arg;
            w.writeUleb128(2);
            s.id().encode(w);
            s.initialSharedVersion().encode(w);
            w.writeBool(s.mutable());
        }
    }

    static CallArg decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == 0) return new Pure(r.readBytes());
        if (tag == 1) return new ImmOrOwnedObject(ObjectRef.decode(r));
        if (tag == 2) return new SharedObject(ObjectID.decode(r), SequenceNumber.decode(r), r.readBool());
        throw new BcsException("unknown call arg tag: " + tag);
    }
}
