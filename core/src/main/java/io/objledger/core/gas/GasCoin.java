// file: src/main/java/io/objledger/core/gas/GasCoin.java
package io.objledger.core.gas;

import io.objledger.core.ObjectID;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.types.KnownTypes;

/** Layout of {@code 0x2::coin::Coin<0x2::gas::GAS>}: the coin's id followed by a u64 balance. */
public final class GasCoin {
    private GasCoin() {}

    public static MoveObjectData create(ObjectID id, long balance) {
        if (balance < 0) throw new IllegalArgumentException("negative balance");
        BcsWriter w = new BcsWriter();
        id.encode(w);
        w.writeU64(balance);
        return new MoveObjectData(KnownTypes.GAS_COIN, w.toByteArray());
    }

    public static boolean isGasCoin(LedgerObject object) {
        return object.moveType().map(KnownTypes.GAS_COIN::equals).orElse(false);
    }

    /** @throws BcsException if the contents are not a gas coin layout */
    public static long balance(MoveObjectData data) {
        if (!data.type().equals(KnownTypes.GAS_COIN)) {
            throw new IllegalArgumentException("not a gas coin: " + data.type().toCanonicalString());
        }
        return BcsReader.decode(data.contents(), r -> {
            ObjectID.decode(r);
            long v = r.readU64();
            if (v < 0) throw new BcsException("balance out of range");
            return v;
        });
    }

    public static MoveObjectData withBalance(MoveObjectData data, long balance) {
        BcsReader r = new BcsReader(data.contents());
        ObjectID id = ObjectID.decode(r);
        return create(id, balance);
    }
}
