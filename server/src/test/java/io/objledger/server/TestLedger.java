package io.objledger.server;

import io.objledger.core.AccountAddress;
import io.objledger.core.ExecutionLimits;
import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.effects.TransactionEffects;
import io.objledger.core.gas.GasCoin;
import io.objledger.core.gas.GasSchedule;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.object.PackageData;
import io.objledger.core.publish.Ability;
import io.objledger.core.publish.FieldDef;
import io.objledger.core.publish.FunctionDef;
import io.objledger.core.publish.ModuleCodec;
import io.objledger.core.publish.ModuleDescriptor;
import io.objledger.core.publish.StructDef;
import io.objledger.core.tx.CallArg;
import io.objledger.core.tx.ProgrammableTransactionBuilder;
import io.objledger.core.tx.TransactionData;
import io.objledger.core.types.KnownTypes;
import io.objledger.core.types.PrimitiveType;
import io.objledger.core.types.SignatureToken;
import io.objledger.core.types.StructTag;
import io.objledger.storage.InMemoryObjectStore;
import io.objledger.storage.ObjectStore;

import java.util.EnumSet;
import java.util.List;
import java.util.TreeMap;

/** A ledger holding package {@link #PACKAGE} and whatever a test adds at genesis. */
final class TestLedger {
    static final AccountAddress ALICE = AccountAddress.fromHex("0xa11ce");
    static final AccountAddress BOB = AccountAddress.fromHex("0xb0b");
    static final ObjectID PACKAGE = ObjectID.fromHex("0x5");
    static final StructTag OBJ = new StructTag(PACKAGE.toAddress(), "m", "Obj");
    static final long BUDGET = 10_000;

    private static final SignatureToken SELF_OBJ = new SignatureToken.Struct(AccountAddress.ZERO, "m", "Obj");

    static final ModuleDescriptor MODULE = new ModuleDescriptor("m",
            List.of(new StructDef("Obj", EnumSet.of(Ability.KEY, Ability.STORE), 0,
                    List.of(new FieldDef("id", SignatureToken.of(KnownTypes.UID)),
                            new FieldDef("value", new SignatureToken.Primitive(PrimitiveType.U64))))),
            List.of(
                    fn("make", List.of(), List.of(SELF_OBJ)),
                    fn("take", List.of(SELF_OBJ), List.of()),
                    fn("take_vec", List.of(new SignatureToken.Vector(SELF_OBJ)), List.of()),
                    fn("borrow", List.of(new SignatureToken.Reference(SELF_OBJ)), List.of()),
                    fn("borrow_mut", List.of(new SignatureToken.MutableReference(SELF_OBJ)), List.of()),
                    fn("make_child", List.of(new SignatureToken.MutableReference(SELF_OBJ)), List.of()),
                    fn("delete_child", List.of(new SignatureToken.MutableReference(SELF_OBJ),
                            new SignatureToken.Primitive(PrimitiveType.ADDRESS)), List.of()),
                    fn("wrap", List.of(new SignatureToken.MutableReference(SELF_OBJ), SELF_OBJ), List.of()),
                    fn("unwrap", List.of(new SignatureToken.MutableReference(SELF_OBJ)), List.of()),
                    fn("take_string", List.of(SignatureToken.of(KnownTypes.UTF8_STRING)), List.of()),
                    fn("abort", List.of(), List.of())));

    final ObjectStore store;
    final AuthorityState authority;
    private int next;

    TestLedger() {
        this(new InMemoryObjectStore(), ExecutionLimits.DEFAULT);
    }

    TestLedger(ObjectStore store, ExecutionLimits limits) {
        this.store = store;
        if (store.getObject(PACKAGE).isEmpty()) {
            TreeMap<String, byte[]> modules = new TreeMap<>();
            modules.put("m", ModuleCodec.encode(MODULE));
            store.insertGenesisObject(new LedgerObject(PACKAGE, SequenceNumber.of(1), Owner.IMMUTABLE,
                    TransactionDigest.GENESIS, new PackageData(modules)));
        }
        this.authority = new AuthorityState(store, new ScriptedRuntime(), limits, GasSchedule.DEFAULT);
    }

    private static FunctionDef fn(String name, List<SignatureToken> params, List<SignatureToken> returns) {
        return new FunctionDef(name, true, 0, params, returns);
    }

    // ---- genesis objects ----

    LedgerObject object(Owner owner) {
        ObjectID id = ObjectID.fromHex(Integer.toHexString(0x3000 + next++));
        LedgerObject o = new LedgerObject(id, SequenceNumber.of(1), owner, TransactionDigest.GENESIS,
                new MoveObjectData(OBJ, id.bytes()));
        store.insertGenesisObject(o);
        return o;
    }

    LedgerObject gas(AccountAddress owner, long balance) {
        ObjectID id = ObjectID.fromHex(Integer.toHexString(0x9000 + next++));
        LedgerObject o = new LedgerObject(id, SequenceNumber.of(1), Owner.address(owner), TransactionDigest.GENESIS,
                GasCoin.create(id, balance));
        store.insertGenesisObject(o);
        return o;
    }

    // ---- transactions ----

    LedgerObject latest(ObjectID id) {
        return store.getObject(id).orElseThrow();
    }

    CallArg owned(ObjectID id) {
        return new CallArg.ImmOrOwnedObject(latest(id).reference());
    }

    TransactionData tx(ProgrammableTransactionBuilder b, ObjectID gas) {
        LedgerObject g = latest(gas);
        return new TransactionData(b.finish(), ((Owner.AddressOwner) g.owner()).address(), g.reference(), BUDGET, 1);
    }

    TransactionEffects run(ProgrammableTransactionBuilder b, ObjectID gas) {
        return authority.executeTransaction(tx(b, gas));
    }

    static long balance(LedgerObject gas) {
        return GasCoin.balance((MoveObjectData) gas.data());
    }
}
