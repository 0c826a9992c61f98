// file: src/main/java/io/objledger/core/Bytes32.java
package io.objledger.core;

import java.util.Arrays;
import java.util.HexFormat;

/** Shared helpers for the 32-byte identifier types. */
final class Bytes32 {
    static final int LENGTH = 32;
    private static final HexFormat HEX = HexFormat.of();

    private Bytes32() {}

    static byte[] checked(byte[] bytes, String what) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException(what + " must be " + LENGTH + " bytes");
        }
        return bytes.clone();
    }

    /**
     * Parse "0x"-prefixed or bare hex. Short forms ("0x2") are left-padded
     * with zeros, as addresses are conventionally written.
     */
    static byte[] parseHex(String text, String what) {
        if (text == null) throw new IllegalArgumentException(what + " is null");
        String s = text.startsWith("0x") || text.startsWith("0X") ? text.substring(2) : text;
        if (s.isEmpty() || s.length() > LENGTH * 2) {
            throw new IllegalArgumentException("invalid " + what + ": " + text);
        }
        if ((s.length() & 1) == 1) s = "0" + s;
        byte[] raw;
        try {
            raw = HEX.parseHex(s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid " + what + ": " + text, e);
        }
        byte[] out = new byte[LENGTH];
        System.arraycopy(raw, 0, out, LENGTH - raw.length, raw.length);
        return out;
    }

    static String toHex(byte[] bytes) {
        return "0x" + HEX.formatHex(bytes);
    }

    static int compare(byte[] a, byte[] b) {
        return Arrays.compareUnsigned(a, b);
    }
}
