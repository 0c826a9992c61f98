// file: src/main/java/io/objledger/core/ObjectDigest.java
package io.objledger.core;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Arrays;

/**
 * Content digest of one object version.
 * <p>
 * Two reserved values never collide with a real sha256 in practice:
 *  - {@link #WRAPPED}: all bytes 0x00 except the last, which is 0x01,
 *  - {@link #DELETED}: all bytes 0x63.
 * They appear in references to objects that were wrapped or deleted.
 */
public final class ObjectDigest {
    public static final ObjectDigest WRAPPED = sentinel((byte) 0x00, (byte) 0x01);
    public static final ObjectDigest DELETED = sentinel((byte) 0x63, (byte) 0x63);

    private final byte[] bytes;

    public ObjectDigest(byte[] bytes) {
        this.bytes = Bytes32.checked(bytes, "ObjectDigest");
    }

    public static ObjectDigest fromHex(String hex) {
        return new ObjectDigest(Bytes32.parseHex(hex, "object digest"));
    }

    public boolean isWrapped() {
        return equals(WRAPPED);
    }

    public boolean isDeleted() {
        return equals(DELETED);
    }

    /** True for a digest of real object contents. */
    public boolean isAlive() {
        return !isWrapped() && !isDeleted();
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Bytes32.toHex(bytes);
    }

    public void encode(BcsWriter w) {
        w.writeFixed(bytes);
    }

    public static ObjectDigest decode(BcsReader r) {
        return new ObjectDigest(r.readFixed(Bytes32.LENGTH));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ObjectDigest other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        if (isWrapped()) return "WRAPPED";
        if (isDeleted()) return "DELETED";
        return toHex();
    }

    private static ObjectDigest sentinel(byte fill, byte last) {
        byte[] b = new byte[Bytes32.LENGTH];
        Arrays.fill(b, fill);
        b[Bytes32.LENGTH - 1] = last;
        return new ObjectDigest(b);
    }
}
