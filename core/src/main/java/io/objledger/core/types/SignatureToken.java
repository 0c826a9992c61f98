// file: src/main/java/io/objledger/core/types/SignatureToken.java
package io.objledger.core.types;

import io.objledger.core.AccountAddress;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declared (uninstantiated) type in a module signature.
 * <p>
 * A {@link Struct} whose address is {@link AccountAddress#ZERO} refers to the
 * declaring package itself; {@link #instantiate} substitutes the package
 * address once it is known.
 */
public sealed interface SignatureToken
        permits SignatureToken.Primitive, SignatureToken.Vector, SignatureToken.Struct,
                SignatureToken.TypeParameter, SignatureToken.Reference, SignatureToken.MutableReference {

    record Primitive(PrimitiveType type) implements SignatureToken {
        public Primitive {
            Objects.requireNonNull(type, "type");
        }
    }

    record Vector(SignatureToken element) implements SignatureToken {
        public Vector {
            Objects.requireNonNull(element, "element");
        }
    }

    record Struct(AccountAddress address, String module, String name, List<SignatureToken> typeArgs)
            implements SignatureToken {
        public Struct {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(module, "module");
            Objects.requireNonNull(name, "name");
            typeArgs = List.copyOf(typeArgs);
        }

        public Struct(AccountAddress address, String module, String name) {
            this(address, module, name, List.of());
        }
    }

    record TypeParameter(int index) implements SignatureToken {
        public TypeParameter {
            if (index < 0) throw new IllegalArgumentException("negative type parameter index");
        }
    }

    record Reference(SignatureToken inner) implements SignatureToken {
        public Reference {
            Objects.requireNonNull(inner, "inner");
        }
    }

    record MutableReference(SignatureToken inner) implements SignatureToken {
        public MutableReference {
            Objects.requireNonNull(inner, "inner");
        }
    }

    static SignatureToken of(TypeTag tag) {
        if (tag instanceof PrimitiveType p) return new Primitive(p);
        if (tag instanceof VectorType v) return new Vector(of(v.element()));
        StructTag s = (StructTag) tag;
        List<SignatureToken> args = new ArrayList<>();
        for (TypeTag t : s.typeParams()) args.add(of(t));
        return new Struct(s.address(), s.module(), s.name(), args);
    }

    /** The token without its outer reference, if any. */
    default SignatureToken dereferenced() {
        if (this instanceof Reference r) return r.inner();
        if (this instanceof MutableReference m) return m.inner();
        return this;
    }

    /**
     * Substitute type arguments and the declaring package address.
     *
     * @throws IllegalArgumentException for references (only valid at the top of a parameter)
     *         or an out-of-range type parameter
     */
    default TypeTag instantiate(List<TypeTag> typeArgs, AccountAddress selfPackage) {
        if (this instanceof Primitive p) return p.type();
        if (this instanceof Vector v) return new VectorType(v.element().instantiate(typeArgs, selfPackage));
        if (this instanceof TypeParameter tp) {
            if (tp.index() >= typeArgs.size()) {
                throw new IllegalArgumentException("type parameter " + tp.index() + " out of range");
            }
            return typeArgs.get(tp.index());
        }
        if (this instanceof Struct s) {
            List<TypeTag> params = new ArrayList<>(s.typeArgs().size());
            for (SignatureToken t : s.typeArgs()) params.add(t.instantiate(typeArgs, selfPackage));
            AccountAddress addr = s.address().equals(AccountAddress.ZERO) ? selfPackage : s.address();
            return new StructTag(addr, s.module(), s.name(), params);
        }
        throw new IllegalArgumentException("references cannot be instantiated as values: " + this);
    }
}
