// file: src/main/java/io/objledger/core/ownership/AuthDecision.java
package io.objledger.core.ownership;

import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;

import java.util.Objects;

public sealed interface AuthDecision permits AuthDecision.Allowed, AuthDecision.Denied {

    AuthDecision ALLOWED = new Allowed();

    record Allowed() implements AuthDecision {}

    record Denied(UserInputError reason) implements AuthDecision {
        public Denied {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static AuthDecision deny(UserInputError.Kind kind, String detail) {
        return new Denied(UserInputError.of(kind, detail));
    }

    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    /** Throws the denial reason as a {@link UserInputException}. */
    default void orThrow() {
        if (this instanceof Denied d) {
            throw new UserInputException(d.reason());
        }
    }
}
