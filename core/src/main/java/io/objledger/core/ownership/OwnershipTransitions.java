// file: src/main/java/io/objledger/core/ownership/OwnershipTransitions.java
package io.objledger.core.ownership;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;

/** Owner changes a write may make to an existing object. */
public final class OwnershipTransitions {
    private OwnershipTransitions() {}

    /**
     * Shared objects stay shared with the same initial version; immutable
     * objects are never written.
     *
     * @throws ExecutionError with {@code InvalidOwnershipTransition}
     */
    public static void check(ObjectID id, Owner prior, Owner next) {
        String reason = switch (prior.kind()) {
            case IMMUTABLE -> "immutable object cannot be written";
            case SHARED -> prior.equals(next) ? null : "shared object cannot change owner to " + next;
            case ADDRESS, OBJECT -> null;
        };
        if (reason != null) {
            throw violation(id, reason);
        }
    }

    /** Wrapping or deleting: everything but immutable objects. */
    public static void checkRemoval(ObjectID id, Owner prior) {
        if (prior.kind() == Owner.Kind.IMMUTABLE) {
            throw violation(id, "immutable object cannot be wrapped or deleted");
        }
    }

    private static ExecutionError violation(ObjectID id, String why) {
        return new ExecutionError(ExecutionFailureStatus.INVALID_OWNERSHIP_TRANSITION, id + ": " + why);
    }
}
