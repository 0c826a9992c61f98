// file: src/main/java/io/objledger/core/publish/ModuleCodec.java
package io.objledger.core.publish;

import io.objledger.core.AccountAddress;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.types.PrimitiveType;
import io.objledger.core.types.SignatureToken;

/**
 * Binary layout of a compiled module blob.
 * <p>
 * Layout (canonical encoding throughout):
 *   - magic   u32 = 0x4D4F444C
 *   - version u8  = 1
 *   - name    string
 *   - structs vector of { name, abilities u8 mask, typeParamCount uleb, fields vector of { name, token } }
 *   - functions vector of { name, callable bool, typeParamCount uleb, params vector of token, returns vector of token }
 * <p>
 * Tokens are a uleb tag: 0 primitive (wire tag u8), 1 vector, 2 struct
 * (address, module, name, type args), 3 type parameter (uleb), 4 reference,
 * 5 mutable reference.
 */
public final class ModuleCodec {
    static final long MAGIC = 0x4D4F444CL;
    static final int VERSION = 1;
    private static final int MAX_TOKEN_DEPTH = 64;

    private ModuleCodec() {}

    public static byte[] encode(ModuleDescriptor m) {
        BcsWriter w = new BcsWriter();
        w.writeU32(MAGIC);
        w.writeU8(VERSION);
        w.writeString(m.name());
        w.writeVector(m.structs(), (ww, s) -> {
            ww.writeString(s.name());
            ww.writeU8(Ability.toMask(s.abilities()));
            ww.writeUleb128(s.typeParameterCount());
            ww.writeVector(s.fields(), (www, f) -> {
                www.writeString(f.name());
                encodeToken(www, f.type());
            });
        });
        w.writeVector(m.functions(), (ww, f) -> {
            ww.writeString(f.name());
            ww.writeBool(f.callable());
            ww.writeUleb128(f.typeParameterCount());
            ww.writeVector(f.parameters(), ModuleCodec::encodeToken);
            ww.writeVector(f.returns(), ModuleCodec::encodeToken);
        });
        return w.toByteArray();
    }

    /** @throws BcsException if {@code blob} is not a well-formed module */
    public static ModuleDescriptor decode(byte[] blob) {
        return BcsReader.decode(blob, r -> {
            long magic = r.readU32();
            if (magic != MAGIC) throw new BcsException("bad module magic: 0x" + Long.toHexString(magic));
            int version = r.readU8();
            if (version != VERSION) throw new BcsException("unsupported module version: " + version);
            String name = r.readString();
            var structs = r.readVector(ModuleCodec::decodeStruct);
            var functions = r.readVector(ModuleCodec::decodeFunction);
            return new ModuleDescriptor(name, structs, functions);
        });
    }

    // ----------------- helpers -----------------

    private static StructDef decodeStruct(BcsReader r) {
        String name = r.readString();
        int mask = r.readU8();
        if ((mask & ~Ability.allBits()) != 0) throw new BcsException("invalid ability mask: " + mask);
        int typeParams = r.readLength();
        var fields = r.readVector(rr -> new FieldDef(rr.readString(), decodeToken(rr, 0)));
        return new StructDef(name, Ability.fromMask(mask), typeParams, fields);
    }

    private static FunctionDef decodeFunction(BcsReader r) {
        String name = r.readString();
        boolean callable = r.readBool();
        int typeParams = r.readLength();
        var params = r.readVector(rr -> decodeToken(rr, 0));
        var returns = r.readVector(rr -> decodeToken(rr, 0));
        return new FunctionDef(name, callable, typeParams, params, returns);
    }

    static void encodeToken(BcsWriter w, SignatureToken t) {
        if (t instanceof SignatureToken.Primitive p) {
            w.writeUleb128(0);
            w.writeU8(p.type().tag());
        } else if (t instanceof SignatureToken.Vector v) {
            w.writeUleb128(1);
            encodeToken(w, v.element());
        } else if (t instanceof SignatureToken.Struct s) {
            w.writeUleb128(2);
            s.address().encode(w);
            w.writeString(s.module());
            w.writeString(s.name());
            w.writeVector(s.typeArgs(), ModuleCodec::encodeToken);
        } else if (t instanceof SignatureToken.TypeParameter tp) {
            w.writeUleb128(3);
            w.writeUleb128(tp.index());
        } else if (t instanceof SignatureToken.Reference ref) {
            w.writeUleb128(4);
            encodeToken(w, ref.inner());
        } else {
            w.writeUleb128(5);
            encodeToken(w, ((SignatureToken.MutableReference) t).inner());
        }
    }

    private static SignatureToken decodeToken(BcsReader r, int depth) {
        if (depth > MAX_TOKEN_DEPTH) throw new BcsException("type nesting too deep");
        long tag = r.readUleb128();
        switch ((int) tag) {
            case 0: {
                int wire = r.readU8();
                PrimitiveType p = PrimitiveType.fromTag(wire);
                if (p == null) throw new BcsException("unknown primitive tag: " + wire);
                return new SignatureToken.Primitive(p);
            }
            case 1:
                return new SignatureToken.Vector(decodeToken(r, depth + 1));
            case 2: {
                AccountAddress addr = AccountAddress.decode(r);
                String module = r.readString();
                String name = r.readString();
                var args = r.readVector(rr -> decodeToken(rr, depth + 1));
                return new SignatureToken.Struct(addr, module, name, args);
            }
            case 3:
                return new SignatureToken.TypeParameter(r.readLength());
            case 4:
                return new SignatureToken.Reference(decodeToken(r, depth + 1));
            case 5:
                return new SignatureToken.MutableReference(decodeToken(r, depth + 1));
            default:
                throw new BcsException("unknown signature token tag: " + tag);
        }
    }
}
