// file: src/main/java/io/objledger/core/publish/StructDef.java
package io.objledger.core.publish;

import java.util.List;
import java.util.Objects;
import java.util.Set;

public record StructDef(String name, Set<Ability> abilities, int typeParameterCount, List<FieldDef> fields) {
    public StructDef {
        Objects.requireNonNull(name, "name");
        abilities = Set.copyOf(abilities);
        if (typeParameterCount < 0) throw new IllegalArgumentException("typeParameterCount must be >= 0");
        fields = List.copyOf(fields);
    }

    public boolean hasKey() {
        return abilities.contains(Ability.KEY);
    }
}
