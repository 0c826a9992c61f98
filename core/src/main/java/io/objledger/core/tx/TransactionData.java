// file: src/main/java/io/objledger/core/tx/TransactionData.java
package io.objledger.core.tx;

import io.objledger.core.AccountAddress;
import io.objledger.core.Digests;
import io.objledger.core.ObjectRef;
import io.objledger.core.TransactionDigest;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Objects;

/**
 * A signed-over transaction: what to run, who sends it and how it pays.
 * The digest is sha256 of {@link #toBytes()}.
 */
public record TransactionData(ProgrammableTransaction kind, AccountAddress sender,
                              ObjectRef gasPayment, long gasBudget, long gasPrice) {
    public TransactionData {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(gasPayment, "gasPayment");
        if (gasBudget < 0) throw new IllegalArgumentException("gasBudget must be >= 0");
        if (gasPrice < 0) throw new IllegalArgumentException("gasPrice must be >= 0");
    }

    public TransactionDigest digest() {
        return new TransactionDigest(Digests.sha256(toBytes()));
    }

    public byte[] toBytes() {
        BcsWriter w = new BcsWriter();
        kind.encode(w);
        sender.encode(w);
        gasPayment.encode(w);
        w.writeU64(gasBudget);
        w.writeU64(gasPrice);
        return w.toByteArray();
    }

    /** @throws io.objledger.core.bcs.BcsException if the bytes are not a canonical transaction */
    public static TransactionData fromBytes(byte[] bytes) {
        return BcsReader.decode(bytes, r -> new TransactionData(
                ProgrammableTransaction.decode(r),
                AccountAddress.decode(r),
                ObjectRef.decode(r),
                r.readU64(),
                r.readU64()));
    }
}
