// file: src/main/java/io/objledger/core/publish/FieldDef.java
package io.objledger.core.publish;

import io.objledger.core.types.SignatureToken;

import java.util.Objects;

public record FieldDef(String name, SignatureToken type) {
    public FieldDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
