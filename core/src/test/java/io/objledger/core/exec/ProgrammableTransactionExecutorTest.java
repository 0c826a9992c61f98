package io.objledger.core.exec;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.TestPackages;
import io.objledger.core.args.ResolvedInput;
import io.objledger.core.effects.ExecutionStatus;
import io.objledger.core.effects.ObjectWrite;
import io.objledger.core.error.CommandArgumentErrorKind;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.gas.GasCoin;
import io.objledger.core.gas.GasSchedule;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.tx.Argument;
import io.objledger.core.tx.CallArg;
import io.objledger.core.tx.ProgrammableTransaction;
import io.objledger.core.tx.ProgrammableTransactionBuilder;
import io.objledger.core.tx.TransactionData;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.objledger.core.TestObjects.ALICE;
import static io.objledger.core.TestObjects.BOB;
import static io.objledger.core.TestObjects.PACKAGE;
import static io.objledger.core.TestObjects.gas;
import static io.objledger.core.TestObjects.id;
import static io.objledger.core.TestObjects.object;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Commands run in order against a transaction-local store; any
 * execution error rolls back everything except the gas charge.
 */
class ProgrammableTransactionExecutorTest {

    private static final long BALANCE = 10_000;

    private final LedgerObject gasCoin = gas(id(100), 3, ALICE, BALANCE);
    private final ProgrammableTransactionExecutor executor =
            new ProgrammableTransactionExecutor(new ScriptedRuntime(), TestPackages.RESOLVER, GasSchedule.DEFAULT);

    private TemporaryStore store;

    private ExecutionResult run(ProgrammableTransaction pt, long budget, LedgerObject... objects) {
        var tx = new TransactionData(pt, ALICE, gasCoin.reference(), budget, 1);
        List<LedgerObject> loaded = new ArrayList<>(List.of(objects));
        loaded.add(gasCoin);
        store = new TemporaryStore(tx.digest(), ALICE, loaded, ChildObjectLoader.NONE);
        List<ResolvedInput> inputs = new ArrayList<>();
        for (CallArg arg : pt.inputs()) {
            if (arg instanceof CallArg.Pure p) {
                inputs.add(ResolvedInput.pure(p));
            } else {
                ObjectID want = arg.objectId().orElseThrow();
                inputs.add(new ResolvedInput(arg, loaded.stream().filter(o -> o.id().equals(want)).findFirst().orElseThrow()));
            }
        }
        return executor.execute(tx, inputs, gasCoin, store);
    }

    private long gasBalance() {
        var w = (ObjectWrite.Write) store.writes().get(gasCoin.id());
        return GasCoin.balance((MoveObjectData) w.data());
    }

    @Test
    void created_object_is_transferred_and_gas_is_charged() {
        var b = new ProgrammableTransactionBuilder();
        var made = b.moveCall(PACKAGE, "m", "make", List.of(), List.of());
        b.transferObjects(List.of(made), BOB);

        var result = run(b.finish(), 5_000);
        assertEquals(ExecutionStatus.SUCCESS, result.status());
        assertEquals(2, result.executedCommands());
        assertEquals(GasSchedule.DEFAULT.computationCost(2, 1), result.gasUsed().computationCost());
        assertTrue(result.gasUsed().storageCost() > 0);
        assertEquals(BALANCE - result.gasUsed().total(), gasBalance());

        var created = store.writes().entrySet().stream()
                .filter(e -> !e.getKey().equals(gasCoin.id())).findFirst().orElseThrow();
        assertEquals(Owner.address(BOB), ((ObjectWrite.Write) created.getValue()).owner());
        assertTrue(store.liveDuringTx().contains(created.getKey()));
    }

    @Test
    void untouched_owned_inputs_still_get_written() {
        var owned = object(id(1), 2, Owner.address(ALICE));
        var b = new ProgrammableTransactionBuilder();
        b.moveCall(PACKAGE, "m", "borrow", List.of(), List.of(b.object(new CallArg.ImmOrOwnedObject(owned.reference()))));

        assertTrue(run(b.finish(), 5_000, owned).status().isSuccess());
        var w = (ObjectWrite.Write) store.writes().get(owned.id());
        assertEquals(owned.data(), w.data());
    }

    @Test
    void abort_rolls_back_all_but_gas() {
        var owned = object(id(1), 2, Owner.address(ALICE));
        var b = new ProgrammableTransactionBuilder();
        b.moveCall(PACKAGE, "m", "borrow_mut", List.of(), List.of(b.object(new CallArg.ImmOrOwnedObject(owned.reference()))));
        b.moveCall(PACKAGE, "m", "abort", List.of(), List.of());

        var result = run(b.finish(), 5_000, owned);
        assertEquals(new ExecutionStatus.Failure(new ExecutionFailureStatus.ContractAbort(7), 1), result.status());
        assertEquals(List.of(gasCoin.id()), new ArrayList<>(store.writes().keySet()));
        assertEquals(0, result.gasUsed().storageCost());
        assertEquals(GasSchedule.DEFAULT.computationCost(1, 1), result.gasUsed().computationCost());
        assertEquals(BALANCE - result.gasUsed().total(), gasBalance());
    }

    @Test
    void bad_argument_use_fails_before_anything_runs() {
        var b = new ProgrammableTransactionBuilder();
        b.moveCall(PACKAGE, "m", "make", List.of(), List.of());
        b.moveCall(PACKAGE, "m", "take", List.of(), List.of(Argument.GAS_COIN));

        var result = run(b.finish(), 5_000);
        assertEquals(new ExecutionStatus.Failure(
                new ExecutionFailureStatus.CommandArgumentError(0, CommandArgumentErrorKind.TYPE_MISMATCH), 1),
                result.status());
        assertEquals(0, result.executedCommands());
        assertEquals(1, store.writes().size());
    }

    @Test
    void budget_below_cost_is_insufficient_gas() {
        var b = new ProgrammableTransactionBuilder();
        b.transferObjects(List.of(b.moveCall(PACKAGE, "m", "make", List.of(), List.of())), BOB);

        var result = run(b.finish(), 120);
        assertEquals(new ExecutionStatus.Failure(ExecutionFailureStatus.INSUFFICIENT_GAS, null), result.status());
        assertEquals(120, result.gasUsed().computationCost());
        assertEquals(BALANCE - 120, gasBalance());
    }
}
