// file: src/main/java/io/objledger/core/args/PureArgumentChecker.java
package io.objledger.core.args;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.types.KnownTypes;
import io.objledger.core.types.PrimitiveType;
import io.objledger.core.types.StructTag;
import io.objledger.core.types.TypeTag;
import io.objledger.core.types.VectorType;

/**
 * Checks that pure bytes are the canonical encoding of a value of a given type.
 * <p>
 * Pure types: primitives other than signer, vectors of pure types,
 * {@code 0x1::string::String} (UTF-8), {@code 0x1::ascii::String} (bytes below 0x80),
 * {@code 0x1::option::Option<T>} (a vector of length at most one) and
 * {@code 0x2::object::ID}.
 */
public final class PureArgumentChecker {
    private PureArgumentChecker() {}

    public static boolean isPureType(TypeTag type) {
        if (type instanceof PrimitiveType p) return p != PrimitiveType.SIGNER;
        if (type instanceof VectorType v) return isPureType(v.element());
        StructTag s = (StructTag) type;
        if (s.equals(KnownTypes.UTF8_STRING) || s.equals(KnownTypes.ASCII_STRING) || s.equals(KnownTypes.ID)) {
            return true;
        }
        return KnownTypes.isOption(s) && isPureType(s.typeParams().get(0));
    }

    /** @throws BcsException if {@code bytes} do not encode exactly one value of {@code type} */
    public static void check(byte[] bytes, TypeTag type) {
        if (!isPureType(type)) {
            throw new IllegalArgumentException(type.toCanonicalString() + " is not a pure type");
        }
        BcsReader.decode(bytes, r -> {
            readValue(r, type);
            return null;
        });
    }

    private static void readValue(BcsReader r, TypeTag type) {
        if (type instanceof PrimitiveType p) {
            if (p == PrimitiveType.BOOL) {
                r.readBool();
            } else {
                r.readFixed(p.width());
            }
            return;
        }
        if (type instanceof VectorType v) {
            if (v.element() == PrimitiveType.U8) {
                r.readBytes();
                return;
            }
            int n = r.readLength();
            for (int i = 0; i < n; i++) readValue(r, v.element());
            return;
        }
        StructTag s = (StructTag) type;
        if (s.equals(KnownTypes.UTF8_STRING)) {
            r.readString();
        } else if (s.equals(KnownTypes.ASCII_STRING)) {
            for (byte b : r.readBytes()) {
                if ((b & 0x80) != 0) throw new BcsException("non-ASCII byte in ascii string");
            }
        } else if (s.equals(KnownTypes.ID)) {
            r.readFixed(32);
        } else {
            int n = r.readLength();
            if (n > 1) throw new BcsException("option encoded with " + n + " elements");
            if (n == 1) readValue(r, s.typeParams().get(0));
        }
    }
}
