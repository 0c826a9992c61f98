// file: src/main/java/io/objledger/core/error/ExecutionError.java
package io.objledger.core.error;

import java.util.Objects;

/**
 * Failure during execution, attributed to a command index once known.
 * Caught by the executor and turned into failed effects.
 */
public class ExecutionError extends RuntimeException {
    private final ExecutionFailureStatus status;
    private final Integer command;

    public ExecutionError(ExecutionFailureStatus status, Integer command, String message) {
        super(message == null ? String.valueOf(status) : status + ": " + message);
        this.status = Objects.requireNonNull(status, "status");
        this.command = command;
    }

    public ExecutionError(ExecutionFailureStatus status, String message) {
        this(status, null, message);
    }

    public static ExecutionError argument(int argIdx, CommandArgumentErrorKind kind, String message) {
        return new ExecutionError(new ExecutionFailureStatus.CommandArgumentError(argIdx, kind), message);
    }

    public ExecutionFailureStatus status() {
        return status;
    }

    /** Index of the failing command, or null when not tied to one. */
    public Integer command() {
        return command;
    }

    /** This error attributed to {@code index} unless it already names a command. */
    public ExecutionError atCommand(int index) {
        if (command != null) return this;
        ExecutionError e = new ExecutionError(status, index, null);
        e.initCause(this);
        return e;
    }
}
