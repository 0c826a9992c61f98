// file: src/main/java/io/objledger/core/exec/ObjectView.java
package io.objledger.core.exec;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.object.ObjectData;

import java.util.Objects;

/** Current content and owner of an object as seen inside a running transaction. */
public record ObjectView(ObjectID id, ObjectData data, Owner owner) {
    public ObjectView {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(owner, "owner");
    }

    public MoveObjectData moveData() {
        if (!(data instanceof MoveObjectData m)) {
            throw new IllegalStateException(id + " is a package");
        }
        return m;
    }
}
