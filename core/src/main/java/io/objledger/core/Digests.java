// file: src/main/java/io/objledger/core/Digests.java
package io.objledger.core;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** sha256 over concatenated byte arrays. */
public final class Digests {
    private Digests() {}

    public static byte[] sha256(byte[]... parts) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (byte[] p : parts) {
            md.update(p);
        }
        return md.digest();
    }
}
