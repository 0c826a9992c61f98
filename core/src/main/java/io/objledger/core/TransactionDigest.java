// file: src/main/java/io/objledger/core/TransactionDigest.java
package io.objledger.core;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Arrays;

/** sha256 of a transaction's canonical encoding. */
public final class TransactionDigest implements Comparable<TransactionDigest> {
    /** Previous-transaction marker for objects that exist from genesis. */
    public static final TransactionDigest GENESIS = new TransactionDigest(new byte[Bytes32.LENGTH]);

    private final byte[] bytes;

    public TransactionDigest(byte[] bytes) {
        this.bytes = Bytes32.checked(bytes, "TransactionDigest");
    }

    public static TransactionDigest fromHex(String hex) {
        return new TransactionDigest(Bytes32.parseHex(hex, "transaction digest"));
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

    public static TransactionDigest decode(BcsReader r) {
        return new TransactionDigest(r.readFixed(Bytes32.LENGTH));
    }

    @Override
    public int compareTo(TransactionDigest o) {
        return Bytes32.compare(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TransactionDigest other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
