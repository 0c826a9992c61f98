// file: src/main/java/io/objledger/core/exec/ContractRuntime.java
package io.objledger.core.exec;

import io.objledger.core.ObjectID;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.publish.FunctionDef;
import io.objledger.core.types.TypeTag;

import java.util.List;
import java.util.Objects;

/**
 * Executes contract functions. The bytecode interpreter lives behind this
 * interface; the validator core only sees its effect on the
 * {@link TemporaryStore} and the values it returns.
 * <p>
 * Implementations report contract-level failures (aborts, missing
 * functions) as {@link ExecutionError}; any other exception is treated as a
 * validator bug and aborts the transaction without commit.
 */
public interface ContractRuntime {

    List<ArgValue> call(Call call, TemporaryStore store);

    /** A resolved, type-checked invocation. */
    record Call(ObjectID packageId, String module, String function, FunctionDef signature,
                List<TypeTag> typeArguments, List<ArgValue> arguments) {
        public Call {
            Objects.requireNonNull(packageId, "packageId");
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(signature, "signature");
            typeArguments = List.copyOf(typeArguments);
            arguments = List.copyOf(arguments);
        }
    }
}
