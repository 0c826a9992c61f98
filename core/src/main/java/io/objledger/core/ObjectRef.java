// file: src/main/java/io/objledger/core/ObjectRef.java
package io.objledger.core;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Objects;

/** (id, version, digest) naming exactly one object version. */
public record ObjectRef(ObjectID id, SequenceNumber version, ObjectDigest digest) implements Comparable<ObjectRef> {
    public ObjectRef {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(digest, "digest");
    }

    public void encode(BcsWriter w) {
        id.encode(w);
        version.encode(w);
        digest.encode(w);
    }

    public static ObjectRef decode(BcsReader r) {
        return new ObjectRef(ObjectID.decode(r), SequenceNumber.decode(r), ObjectDigest.decode(r));
    }

    /** Orders by id, then version. Used to keep effect lists deterministic. */
    @Override
    public int compareTo(ObjectRef o) {
        int c = id.compareTo(o.id);
        return c != 0 ? c : version.compareTo(o.version);
    }

    @Override
    public String toString() {
        return "(" + id + ", " + version + ", " + digest + ")";
    }
}
