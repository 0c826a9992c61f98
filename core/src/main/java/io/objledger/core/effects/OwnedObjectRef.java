// file: src/main/java/io/objledger/core/effects/OwnedObjectRef.java
package io.objledger.core.effects;

import io.objledger.core.ObjectRef;
import io.objledger.core.Owner;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Objects;

public record OwnedObjectRef(ObjectRef ref, Owner owner) implements Comparable<OwnedObjectRef> {
    public OwnedObjectRef {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(owner, "owner");
    }

    public void encode(BcsWriter w) {
        ref.encode(w);
        owner.encode(w);
    }

    public static OwnedObjectRef decode(BcsReader r) {
        return new OwnedObjectRef(ObjectRef.decode(r), Owner.decode(r));
    }

    @Override
    public int compareTo(OwnedObjectRef o) {
        return ref.compareTo(o.ref);
    }
}
