// file: src/main/java/io/objledger/core/AccountAddress.java
package io.objledger.core;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Arrays;

/** 32-byte account (and package) address. */
public final class AccountAddress implements Comparable<AccountAddress> {
    public static final AccountAddress ZERO = new AccountAddress(new byte[Bytes32.LENGTH]);
    /** Standard library ("0x1"). */
    public static final AccountAddress STD = fromHex("0x1");
    /** Framework ("0x2"). */
    public static final AccountAddress FRAMEWORK = fromHex("0x2");

    private final byte[] bytes;

    public AccountAddress(byte[] bytes) {
        this.bytes = Bytes32.checked(bytes, "AccountAddress");
    }

    public static AccountAddress fromHex(String hex) {
        return new AccountAddress(Bytes32.parseHex(hex, "address"));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public ObjectID toObjectId() {
        return new ObjectID(bytes);
    }

    public String toHex() {
        return Bytes32.toHex(bytes);
    }

    /** Shortest hex form ("0x2" rather than sixty-three zeros and a two). */
    public String toShortHex() {
        String full = Bytes32.toHex(bytes).substring(2);
        int i = 0;
        while (i < full.length() - 1 && full.charAt(i) == '0') i++;
        return "0x" + full.substring(i);
    }

    public void encode(BcsWriter w) {
        w.writeFixed(bytes);
    }

    public static AccountAddress decode(BcsReader r) {
        return new AccountAddress(r.readFixed(Bytes32.LENGTH));
    }

    @Override
    public int compareTo(AccountAddress o) {
        return Bytes32.compare(bytes, o.bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AccountAddress other && Arrays.equals(bytes, other.bytes);
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
