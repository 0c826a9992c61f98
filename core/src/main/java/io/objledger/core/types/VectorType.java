// file: src/main/java/io/objledger/core/types/VectorType.java
package io.objledger.core.types;

import java.util.Objects;

public record VectorType(TypeTag element) implements TypeTag {
    static final int TAG = 6;

    public VectorType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public String toCanonicalString() {
        return "vector<" + element.toCanonicalString() + ">";
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
