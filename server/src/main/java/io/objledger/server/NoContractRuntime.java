// file: server/src/main/java/io/objledger/server/NoContractRuntime.java
package io.objledger.server;

import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.exec.ArgValue;
import io.objledger.core.exec.ContractRuntime;
import io.objledger.core.exec.TemporaryStore;

import java.util.List;

/** Runtime used when no implementation is installed: every call fails. */
final class NoContractRuntime implements ContractRuntime {

    @Override
    public List<ArgValue> call(Call call, TemporaryStore store) {
        throw new ExecutionError(ExecutionFailureStatus.FUNCTION_NOT_FOUND,
                "no contract runtime installed for " + call.packageId() + "::" + call.module() + "::" + call.function());
    }
}
