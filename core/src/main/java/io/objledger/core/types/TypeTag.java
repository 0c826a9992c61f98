// file: src/main/java/io/objledger/core/types/TypeTag.java
package io.objledger.core.types;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

/**
 * Fully instantiated runtime type: a primitive, a vector or a struct.
 * Canonical string form is what {@link #parse(String)} accepts, e.g.
 * {@code vector<0x2::coin::Coin<0x2::gas::GAS>>}.
 */
public sealed interface TypeTag permits PrimitiveType, VectorType, StructTag {

    String toCanonicalString();

    static TypeTag parse(String text) {
        return new TypeTagParser(text).parseComplete();
    }

    static void encode(BcsWriter w, TypeTag tag) {
        if (tag instanceof PrimitiveType p) {
            w.writeUleb128(p.tag());
        } else if (tag instanceof VectorType v) {
            w.writeUleb128(VectorType.TAG);
            encode(w, v.element());
        } else {
            w.writeUleb128(StructTag.TAG);
            ((StructTag) tag).encodeBody(w);
        }
    }

    static TypeTag decode(BcsReader r) {
        long tag = r.readUleb128();
        if (tag == VectorType.TAG) return new VectorType(decode(r));
        if (tag == StructTag.TAG) return StructTag.decodeBody(r);
        PrimitiveType p = PrimitiveType.fromTag((int) tag);
        if (p == null) throw new BcsException("unknown type tag: " + tag);
        return p;
    }
}
