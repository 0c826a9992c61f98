// file: src/main/java/io/objledger/core/effects/PriorState.java
package io.objledger.core.effects;

import io.objledger.core.ObjectID;
import io.objledger.core.SequenceNumber;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.ObjectEntry;

import java.util.Objects;
import java.util.Optional;

/** State of an object before the transaction: live, or wrapped inside a container. */
public sealed interface PriorState permits PriorState.Live, PriorState.Wrapped {

    ObjectID id();

    SequenceNumber version();

    record Live(LedgerObject object) implements PriorState {
        public Live {
            Objects.requireNonNull(object, "object");
        }

        @Override public ObjectID id() { return object.id(); }
        @Override public SequenceNumber version() { return object.version(); }
    }

    record Wrapped(ObjectID id, SequenceNumber version, ObjectID container) implements PriorState {
        public Wrapped {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(version, "version");
            Objects.requireNonNull(container, "container");
        }
    }

    /** Deleted entries have no prior state. */
    static Optional<PriorState> of(ObjectEntry entry) {
        if (entry instanceof ObjectEntry.Live l) return Optional.of(new Live(l.object()));
        if (entry instanceof ObjectEntry.Wrapped w) return Optional.of(new Wrapped(w.id(), w.version(), w.container()));
        return Optional.empty();
    }
}
