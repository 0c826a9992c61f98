// file: src/main/java/io/objledger/core/bcs/BcsReader.java
package io.objledger.core.bcs;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Strict reader for the canonical binary encoding. Every malformed input
 * surfaces as {@link BcsException}; callers decide how to classify it.
 * <p>
 * Use {@link #decode(byte[], Function)} for whole-buffer decodes: it rejects
 * trailing bytes.
 */
public final class BcsReader {
    /** Upper bound on any sequence length accepted from untrusted input. */
    public static final long MAX_SEQUENCE_LENGTH = 0xFFFF_FFFFL;

    private final ByteBuffer buf;

    public BcsReader(byte[] bytes) {
        this.buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    /** Decode {@code bytes} completely with {@code body}; trailing bytes are an error. */
    public static <T> T decode(byte[] bytes, Function<BcsReader, T> body) {
        BcsReader r = new BcsReader(bytes);
        T value = body.apply(r);
        r.ensureFullyConsumed();
        return value;
    }

    public boolean readBool() {
        int b = readU8();
        if (b > 1) throw new BcsException("invalid bool byte: " + b);
        return b == 1;
    }

    public int readU8() {
        require(1);
        return buf.get() & 0xFF;
    }

    public int readU16() {
        require(2);
        return buf.getShort() & 0xFFFF;
    }

    public long readU32() {
        require(4);
        return buf.getInt() & 0xFFFF_FFFFL;
    }

    public long readU64() {
        require(8);
        return buf.getLong();
    }

    public BigInteger readU128() {
        return readUnsignedBig(16);
    }

    public BigInteger readU256() {
        return readUnsignedBig(32);
    }

    /** Reads a canonical (minimal) ULEB128 value no larger than {@link #MAX_SEQUENCE_LENGTH}. */
    public long readUleb128() {
        long value = 0;
        int shift = 0;
        while (true) {
            int b = readU8();
            long digit = b & 0x7F;
            value |= digit << shift;
            if ((b & 0x80) == 0) {
                if (shift > 0 && digit == 0) {
                    throw new BcsException("non-canonical ULEB128 encoding");
                }
                break;
            }
            shift += 7;
            if (shift > 32) throw new BcsException("ULEB128 value overflows u32");
        }
        if (value > MAX_SEQUENCE_LENGTH) throw new BcsException("ULEB128 value overflows u32");
        return value;
    }

    public byte[] readFixed(int length) {
        require(length);
        byte[] out = new byte[length];
        buf.get(out);
        return out;
    }

    public byte[] readBytes() {
        return readFixed(readLength());
    }

    /** Reads length-prefixed bytes and decodes them as strict UTF-8. */
    public String readString() {
        byte[] raw = readBytes();
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new BcsException("invalid UTF-8 string", e);
        }
    }

    public <T> List<T> readVector(Function<BcsReader, T> element) {
        int n = readLength();
        List<T> out = new ArrayList<>(Math.min(n, 1024));
        for (int i = 0; i < n; i++) {
            out.add(element.apply(this));
        }
        return out;
    }

    /** Returns null for none. */
    public <T> T readOption(Function<BcsReader, T> element) {
        int tag = readU8();
        if (tag == 0) return null;
        if (tag == 1) return element.apply(this);
        throw new BcsException("invalid option tag: " + tag);
    }

    /** Reads a ULEB128 length and checks there are at least that many bytes left. */
    public int readLength() {
        long n = readUleb128();
        if (n > Integer.MAX_VALUE) throw new BcsException("length too large: " + n);
        return (int) n;
    }

    public int remaining() {
        return buf.remaining();
    }

    public void ensureFullyConsumed() {
        if (buf.hasRemaining()) {
            throw new BcsException(buf.remaining() + " trailing bytes");
        }
    }

    // ----------------- helpers -----------------

    private void require(int n) {
        if (n < 0 || buf.remaining() < n) {
            throw new BcsException("unexpected end of input: need " + n + " bytes, have " + buf.remaining());
        }
    }

    private BigInteger readUnsignedBig(int width) {
        byte[] le = readFixed(width);
        byte[] be = new byte[width];
        for (int i = 0; i < width; i++) {
            be[i] = le[width - 1 - i];
        }
        return new BigInteger(1, be);
    }
}
