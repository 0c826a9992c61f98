// file: src/main/java/io/objledger/core/types/StructTag.java
package io.objledger.core.types;

import io.objledger.core.AccountAddress;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** {@code address::module::Name<T...>}. */
public record StructTag(AccountAddress address, String module, String name, List<TypeTag> typeParams)
        implements TypeTag {
    static final int TAG = 7;

    public StructTag {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(name, "name");
        typeParams = List.copyOf(typeParams);
    }

    public StructTag(AccountAddress address, String module, String name) {
        this(address, module, name, List.of());
    }

    public static StructTag parseStruct(String text) {
        TypeTag t = TypeTag.parse(text);
        if (!(t instanceof StructTag s)) {
            throw new IllegalArgumentException("not a struct type: " + text);
        }
        return s;
    }

    /** Same address, module and name, ignoring type parameters. */
    public boolean isSameStruct(AccountAddress addr, String mod, String nm) {
        return address.equals(addr) && module.equals(mod) && name.equals(nm);
    }

    @Override
    public String toCanonicalString() {
        StringBuilder sb = new StringBuilder()
                .append(address.toShortHex()).append("::").append(module).append("::").append(name);
        if (!typeParams.isEmpty()) {
            sb.append('<')
              .append(typeParams.stream().map(TypeTag::toCanonicalString).collect(Collectors.joining(", ")))
              .append('>');
        }
        return sb.toString();
    }

    void encodeBody(BcsWriter w) {
        address.encode(w);
        w.writeString(module);
        w.writeString(name);
        w.writeVector(typeParams, TypeTag::encode);
    }

    static StructTag decodeBody(BcsReader r) {
        AccountAddress addr = AccountAddress.decode(r);
        String mod = r.readString();
        String nm = r.readString();
        List<TypeTag> params = r.readVector(TypeTag::decode);
        return new StructTag(addr, mod, nm, params);
    }

    @Override
    public String toString() {
        return toCanonicalString();
    }
}
