package io.objledger.core;

import io.objledger.core.gas.GasCoin;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.types.StructTag;

/** Shared fixtures for core tests. */
public final class TestObjects {
    public static final AccountAddress ALICE = AccountAddress.fromHex("0xa11ce");
    public static final AccountAddress BOB = AccountAddress.fromHex("0xb0b");
    public static final ObjectID PACKAGE = ObjectID.fromHex("0x5");
    public static final StructTag OBJ = new StructTag(PACKAGE.toAddress(), "m", "Obj");
    public static final StructTag OTHER = new StructTag(PACKAGE.toAddress(), "m", "Other");

    private TestObjects() {}

    public static ObjectID id(int n) {
        return ObjectID.fromHex(Integer.toHexString(0x1000 + n));
    }

    public static LedgerObject object(ObjectID id, long version, Owner owner) {
        return object(id, version, owner, OBJ);
    }

    public static LedgerObject object(ObjectID id, long version, Owner owner, StructTag type) {
        return new LedgerObject(id, SequenceNumber.of(version), owner, TransactionDigest.GENESIS,
                new MoveObjectData(type, id.bytes()));
    }

    public static LedgerObject gas(ObjectID id, long version, AccountAddress owner, long balance) {
        return new LedgerObject(id, SequenceNumber.of(version), Owner.address(owner), TransactionDigest.GENESIS,
                GasCoin.create(id, balance));
    }

    public static TransactionDigest digest(int n) {
        byte[] b = new byte[32];
        b[31] = (byte) n;
        b[0] = (byte) 0x7d;
        return new TransactionDigest(b);
    }
}
