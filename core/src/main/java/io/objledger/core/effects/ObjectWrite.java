// file: src/main/java/io/objledger/core/effects/ObjectWrite.java
package io.objledger.core.effects;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.object.ObjectData;

import java.util.Objects;

/** Final state of an object after execution, before versions are assigned. */
public sealed interface ObjectWrite permits ObjectWrite.Write, ObjectWrite.Wrap, ObjectWrite.Delete {

    ObjectWrite DELETE = new Delete();

    /** The object exists independently with this content and owner. */
    record Write(ObjectData data, Owner owner) implements ObjectWrite {
        public Write {
            Objects.requireNonNull(data, "data");
            Objects.requireNonNull(owner, "owner");
        }
    }

    /** The object is embedded in {@code container} and no longer addressable. */
    record Wrap(ObjectID container) implements ObjectWrite {
        public Wrap {
            Objects.requireNonNull(container, "container");
        }
    }

    record Delete() implements ObjectWrite {}
}
