// file: src/main/java/io/objledger/core/object/ObjectEntry.java
package io.objledger.core.object;

import io.objledger.core.ObjectDigest;
import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.SequenceNumber;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Objects;

/**
 * Latest state of an id as the store tracks it: a live object, a marker for
 * an object wrapped inside another, or a deletion tombstone.
 */
public sealed interface ObjectEntry permits ObjectEntry.Live, ObjectEntry.Wrapped, ObjectEntry.Deleted {

    ObjectID id();

    SequenceNumber version();

    /** Live entries carry the content digest, the others a sentinel. */
    ObjectRef reference();

    record Live(LedgerObject object) implements ObjectEntry {
        public Live {
            Objects.requireNonNull(object, "object");
        }

        @Override public ObjectID id() { return object.id(); }
        @Override public SequenceNumber version() { return object.version(); }
        @Override public ObjectRef reference() { return object.reference(); }
    }

    record Wrapped(ObjectID id, SequenceNumber version, ObjectID container) implements ObjectEntry {
        public Wrapped {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(version, "version");
            Objects.requireNonNull(container, "container");
        }

        @Override
        public ObjectRef reference() {
            return new ObjectRef(id, version, ObjectDigest.WRAPPED);
        }
    }

    record Deleted(ObjectID id, SequenceNumber version) implements ObjectEntry {
        public Deleted {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(version, "version");
        }

        @Override
        public ObjectRef reference() {
            return new ObjectRef(id, version, ObjectDigest.DELETED);
        }
    }

    static void encode(BcsWriter w, ObjectEntry e) {
        if (e instanceof Live l) {
            w.writeUleb128(0);
            l.object().encode(w);
        } else if (e instanceof Wrapped wr) {
            w.writeUleb128(1);
            wr.id().encode(w);
            wr.version().encode(w);
            wr.container().encode(w);
        } else {
            Deleted d = (Deleted) e;
            w.writeUleb128(2);
            d.id().encode(w);
            d.version().encode(w);
        }
    }

    static ObjectEntry decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == 0) return new Live(LedgerObject.decode(r));
        if (tag == 1) return new Wrapped(ObjectID.decode(r), SequenceNumber.decode(r), ObjectID.decode(r));
        if (tag == 2) return new Deleted(ObjectID.decode(r), SequenceNumber.decode(r));
        throw new BcsException("unknown object entry tag: " + tag);
    }
}
