// file: src/main/java/io/objledger/core/error/UserInputError.java
package io.objledger.core.error;

import java.util.Objects;

/**
 * Reason a transaction was rejected before execution. Rejected transactions
 * change no state and charge no gas.
 */
public record UserInputError(Kind kind, String detail) {

    public enum Kind {
        EMPTY_COMMAND_INPUT("EmptyCommandInput"),
        OBJECT_NOT_FOUND("ObjectNotFound"),
        INVALID_CHILD_OBJECT_ARGUMENT("InvalidChildObjectArgument"),
        INCORRECT_USER_SIGNATURE("IncorrectUserSignature"),
        NOT_OWNED_OBJECT("NotOwnedObject"),
        NOT_SHARED_OBJECT("NotSharedObject"),
        SHARED_INITIAL_VERSION_MISMATCH("SharedInitialVersionMismatch"),
        OBJECT_VERSION_UNAVAILABLE_FOR_CONSUMPTION("ObjectVersionUnavailableForConsumption"),
        INVALID_OBJECT_DIGEST("InvalidObjectDigest"),
        DUPLICATE_OBJECT_REF_INPUT("DuplicateObjectRefInput"),
        INVALID_ARGUMENT_REFERENCE("InvalidArgumentReference"),
        GAS_BALANCE_TOO_LOW("GasBalanceTooLow"),
        GAS_BUDGET_TOO_LOW("GasBudgetTooLow"),
        INVALID_GAS_OBJECT("InvalidGasObject"),
        TRANSACTION_DESERIALIZATION("TransactionDeserialization");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        /** Name used in API responses. */
        public String wireName() {
            return wireName;
        }
    }

    public UserInputError {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }

    public static UserInputError of(Kind kind, String detail) {
        return new UserInputError(kind, detail);
    }

    @Override
    public String toString() {
        return detail.isEmpty() ? kind.wireName() : kind.wireName() + ": " + detail;
    }
}
