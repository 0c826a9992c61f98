// file: src/main/java/io/objledger/core/error/ExecutionFailureStatus.java
package io.objledger.core.error;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Objects;

/**
 * Why an executed transaction failed. Recorded in effects; the transaction
 * is still committed and charged.
 */
public sealed interface ExecutionFailureStatus
        permits ExecutionFailureStatus.CommandArgumentError, ExecutionFailureStatus.ContractAbort,
                ExecutionFailureStatus.Plain {

    enum Kind {
        COMMAND_ARGUMENT_ERROR("CommandArgumentError"),
        VM_VERIFICATION_OR_DESERIALIZATION_ERROR("VMVerificationOrDeserializationError"),
        FUNCTION_NOT_FOUND("FunctionNotFound"),
        TYPE_ARITY_MISMATCH("TypeArityMismatch"),
        ARITY_MISMATCH("ArityMismatch"),
        PACKAGE_NOT_FOUND("PackageNotFound"),
        INSUFFICIENT_GAS("InsufficientGas"),
        INVALID_OWNERSHIP_TRANSITION("InvalidOwnershipTransition"),
        CONTRACT_ABORT("ContractAbort");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    Plain VM_VERIFICATION_OR_DESERIALIZATION_ERROR = new Plain(Kind.VM_VERIFICATION_OR_DESERIALIZATION_ERROR);
    Plain FUNCTION_NOT_FOUND = new Plain(Kind.FUNCTION_NOT_FOUND);
    Plain TYPE_ARITY_MISMATCH = new Plain(Kind.TYPE_ARITY_MISMATCH);
    Plain ARITY_MISMATCH = new Plain(Kind.ARITY_MISMATCH);
    Plain PACKAGE_NOT_FOUND = new Plain(Kind.PACKAGE_NOT_FOUND);
    Plain INSUFFICIENT_GAS = new Plain(Kind.INSUFFICIENT_GAS);
    Plain INVALID_OWNERSHIP_TRANSITION = new Plain(Kind.INVALID_OWNERSHIP_TRANSITION);

    Kind kind();

    record CommandArgumentError(int argIdx, CommandArgumentErrorKind error) implements ExecutionFailureStatus {
        public CommandArgumentError {
            if (argIdx < 0) throw new IllegalArgumentException("argIdx must be >= 0");
            Objects.requireNonNull(error, "error");
        }

        @Override
        public Kind kind() {
            return Kind.COMMAND_ARGUMENT_ERROR;
        }

        @Override
        public String toString() {
            return "CommandArgumentError { arg_idx: " + argIdx + ", kind: " + error.wireName() + " }";
        }
    }

    record ContractAbort(long code) implements ExecutionFailureStatus {
        @Override
        public Kind kind() {
            return Kind.CONTRACT_ABORT;
        }

        @Override
        public String toString() {
            return "ContractAbort { code: " + code + " }";
        }
    }

    /** Failure kinds that carry no payload. */
    record Plain(Kind kind) implements ExecutionFailureStatus {
        public Plain {
            if (kind == Kind.COMMAND_ARGUMENT_ERROR || kind == Kind.CONTRACT_ABORT) {
                throw new IllegalArgumentException(kind + " carries a payload");
            }
        }

        @Override
        public String toString() {
            return kind.wireName();
        }
    }

    static void encode(BcsWriter w, ExecutionFailureStatus s) {
        w.writeUleb128(s.kind().ordinal());
        if (s instanceof CommandArgumentError c) {
            w.writeUleb128(c.argIdx());
            w.writeUleb128(c.error().ordinal());
        } else if (s instanceof ContractAbort a) {
            w.writeU64(a.code());
        }
    }

    static ExecutionFailureStatus decode(BcsReader r) {
        Kind[] kinds = Kind.values();
        long tag = r.readUleb128();
        if (tag >= kinds.length) throw new BcsException("unknown failure tag: " + tag);
        Kind k = kinds[(int) tag];
        if (k == Kind.COMMAND_ARGUMENT_ERROR) {
            int arg = r.readLength();
            long e = r.readUleb128();
            CommandArgumentErrorKind[] errs = CommandArgumentErrorKind.values();
            if (e >= errs.length) throw new BcsException("unknown argument error tag: " + e);
            return new CommandArgumentError(arg, errs[(int) e]);
        }
        if (k == Kind.CONTRACT_ABORT) return new ContractAbort(r.readU64());
        return new Plain(k);
    }
}
