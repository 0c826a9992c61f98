// file: src/main/java/io/objledger/core/publish/ModuleDescriptor.java
package io.objledger.core.publish;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Deserialized module: its name, struct layouts and function signatures.
 * Enough to verify object layouts and type-check calls; function bodies are
 * opaque to the validator core.
 */
public record ModuleDescriptor(String name, List<StructDef> structs, List<FunctionDef> functions) {
    public ModuleDescriptor {
        Objects.requireNonNull(name, "name");
        structs = List.copyOf(structs);
        functions = List.copyOf(functions);
    }

    public Optional<FunctionDef> function(String functionName) {
        return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
    }

    public Optional<StructDef> struct(String structName) {
        return structs.stream().filter(s -> s.name().equals(structName)).findFirst();
    }
}
