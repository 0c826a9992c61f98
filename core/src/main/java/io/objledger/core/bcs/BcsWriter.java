// file: src/main/java/io/objledger/core/bcs/BcsWriter.java
package io.objledger.core.bcs;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.function.BiConsumer;

/**
 * Append-only writer for the canonical binary encoding used on the wire,
 * in digests and in the commit log.
 * <p>
 * Rules:
 *  - fixed-width integers are little-endian,
 *  - sequence lengths and enum tags are ULEB128,
 *  - an option is a one byte tag (0 = none, 1 = some) followed by the value,
 *  - strings are length-prefixed UTF-8.
 */
public final class BcsWriter {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public BcsWriter writeBool(boolean v) {
        out.write(v ? 1 : 0);
        return this;
    }

    public BcsWriter writeU8(int v) {
        if (v < 0 || v > 0xFF) throw new IllegalArgumentException("u8 out of range: " + v);
        out.write(v);
        return this;
    }

    public BcsWriter writeU16(int v) {
        if (v < 0 || v > 0xFFFF) throw new IllegalArgumentException("u16 out of range: " + v);
        return writeLittleEndian(v, 2);
    }

    public BcsWriter writeU32(long v) {
        if (v < 0 || v > 0xFFFF_FFFFL) throw new IllegalArgumentException("u32 out of range: " + v);
        return writeLittleEndian(v, 4);
    }

    /** Writes the two's complement bits of {@code v}; callers treat it as unsigned. */
    public BcsWriter writeU64(long v) {
        return writeLittleEndian(v, 8);
    }

    public BcsWriter writeU128(BigInteger v) {
        return writeUnsignedBig(v, 16);
    }

    public BcsWriter writeU256(BigInteger v) {
        return writeUnsignedBig(v, 32);
    }

    public BcsWriter writeUleb128(long v) {
        if (v < 0) throw new IllegalArgumentException("negative length: " + v);
        long rest = v;
        while ((rest & ~0x7FL) != 0) {
            out.write((int) ((rest & 0x7F) | 0x80));
            rest >>>= 7;
        }
        out.write((int) rest);
        return this;
    }

    /** Raw bytes, no length prefix. */
    public BcsWriter writeFixed(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    /** Length-prefixed bytes ({@code vector<u8>}). */
    public BcsWriter writeBytes(byte[] bytes) {
        writeUleb128(bytes.length);
        return writeFixed(bytes);
    }

    public BcsWriter writeString(String s) {
        return writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    public <T> BcsWriter writeVector(Collection<T> items, BiConsumer<BcsWriter, T> element) {
        writeUleb128(items.size());
        for (T item : items) {
            element.accept(this, item);
        }
        return this;
    }

    public <T> BcsWriter writeOption(T value, BiConsumer<BcsWriter, T> element) {
        if (value == null) {
            out.write(0);
        } else {
            out.write(1);
            element.accept(this, value);
        }
        return this;
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }

    // ----------------- helpers -----------------

    private BcsWriter writeLittleEndian(long v, int width) {
        for (int i = 0; i < width; i++) {
            out.write((int) (v >>> (8 * i)) & 0xFF);
        }
        return this;
    }

    private BcsWriter writeUnsignedBig(BigInteger v, int width) {
        if (v.signum() < 0 || v.bitLength() > width * 8) {
            throw new IllegalArgumentException("value does not fit in " + (width * 8) + " bits: " + v);
        }
        byte[] be = v.toByteArray(); // big-endian, possibly with a leading sign byte
        byte[] le = new byte[width];
        for (int i = 0; i < be.length && i < width; i++) {
            le[i] = be[be.length - 1 - i];
        }
        return writeFixed(le);
    }
}
