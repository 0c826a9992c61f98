// file: src/main/java/io/objledger/core/publish/FunctionDef.java
package io.objledger.core.publish;

import io.objledger.core.types.SignatureToken;

import java.util.List;
import java.util.Objects;

/**
 * Callable function signature. Only entry or public functions may be the
 * target of a {@code MoveCall}.
 */
public record FunctionDef(String name, boolean callable, int typeParameterCount,
                          List<SignatureToken> parameters, List<SignatureToken> returns) {
    public FunctionDef {
        Objects.requireNonNull(name, "name");
        if (typeParameterCount < 0) throw new IllegalArgumentException("typeParameterCount must be >= 0");
        parameters = List.copyOf(parameters);
        returns = List.copyOf(returns);
    }
}
