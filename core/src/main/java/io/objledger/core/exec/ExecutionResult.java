// file: src/main/java/io/objledger/core/exec/ExecutionResult.java
package io.objledger.core.exec;

import io.objledger.core.effects.ExecutionStatus;
import io.objledger.core.gas.GasCostSummary;

import java.util.Objects;

/** Outcome of running a transaction; the writes stay in the {@link TemporaryStore}. */
public record ExecutionResult(ExecutionStatus status, GasCostSummary gasUsed, int executedCommands) {
    public ExecutionResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(gasUsed, "gasUsed");
    }
}
