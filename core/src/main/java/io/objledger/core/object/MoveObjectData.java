// file: src/main/java/io/objledger/core/object/MoveObjectData.java
package io.objledger.core.object;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.types.StructTag;
import io.objledger.core.types.TypeTag;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Typed contract value. {@code contents} is the value's canonical encoding;
 * its first 32 bytes are the object's own id.
 */
public record MoveObjectData(StructTag type, byte[] contents) implements ObjectData {
    public MoveObjectData {
        Objects.requireNonNull(type, "type");
        contents = Objects.requireNonNull(contents, "contents").clone();
    }

    @Override
    public byte[] contents() {
        return contents.clone();
    }

    @Override
    public int sizeInBytes() {
        return contents.length;
    }

    public MoveObjectData withContents(byte[] newContents) {
        return new MoveObjectData(type, newContents);
    }

    void encodeBody(BcsWriter w) {
        TypeTag.encode(w, type);
        w.writeBytes(contents);
    }

    static MoveObjectData decodeBody(BcsReader r) {
        TypeTag t = TypeTag.decode(r);
        if (!(t instanceof StructTag s)) {
            throw new BcsException("object type must be a struct: " + t.toCanonicalString());
        }
        return new MoveObjectData(s, r.readBytes());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MoveObjectData other
                && type.equals(other.type)
                && Arrays.equals(contents, other.contents);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(contents);
    }

    @Override
    public String toString() {
        return "MoveObjectData{" + type.toCanonicalString() + ", " + HexFormat.of().formatHex(contents) + "}";
    }
}
