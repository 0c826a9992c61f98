// file: src/main/java/io/objledger/server/dto/ObjectRefView.java
package io.objledger.server.dto;

import io.objledger.core.ObjectRef;
import io.objledger.core.effects.OwnedObjectRef;

/** An object reference, with its owner when the object is live. */
public class ObjectRefView {
    public String objectId;
    public long version;
    public String digest;
    public OwnerView owner; // null for wrapped and deleted refs

    public static ObjectRefView from(ObjectRef ref) {
        ObjectRefView v = new ObjectRefView();
        v.objectId = ref.id().toString();
        v.version = ref.version().value();
        v.digest = ref.digest().toString();
        return v;
    }

    public static ObjectRefView from(OwnedObjectRef ref) {
        ObjectRefView v = from(ref.ref());
        v.owner = OwnerView.from(ref.owner());
        return v;
    }
}
