// file: src/main/java/io/objledger/core/ObjectID.java
package io.objledger.core;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * 32-byte globally unique object identifier.
 * <p>
 * Identifiers of objects created by a transaction are derived from the
 * transaction digest and a per-transaction creation counter, so re-executing
 * the same transaction yields the same ids.
 */
public final class ObjectID implements Comparable<ObjectID> {
    public static final ObjectID ZERO = new ObjectID(new byte[Bytes32.LENGTH]);

    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] bytes;

    public ObjectID(byte[] bytes) {
        this.bytes = Bytes32.checked(bytes, "ObjectID");
    }

    public static ObjectID fromHex(String hex) {
        return new ObjectID(Bytes32.parseHex(hex, "object id"));
    }

    public static ObjectID fromAddress(AccountAddress address) {
        return new ObjectID(address.bytes());
    }

    /** Random id, used for genesis objects that no transaction created. */
    public static ObjectID random() {
        byte[] b = new byte[Bytes32.LENGTH];
        RANDOM.nextBytes(b);
        return new ObjectID(b);
    }

    /** sha256(txDigest || u64 little-endian creation index). */
    public static ObjectID derive(TransactionDigest tx, long creationIndex) {
        byte[] idx = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(creationIndex).array();
        return new ObjectID(Digests.sha256(tx.bytes(), idx));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public AccountAddress toAddress() {
        return new AccountAddress(bytes);
    }

    public String toHex() {
        return Bytes32.toHex(bytes);
    }

    public void encode(BcsWriter w) {
        w.writeFixed(bytes);
    }

    public static ObjectID decode(BcsReader r) {
        return new ObjectID(r.readFixed(Bytes32.LENGTH));
    }

    @Override
    public int compareTo(ObjectID o) {
        return Bytes32.compare(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ObjectID other && Arrays.equals(bytes, other.bytes);
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
