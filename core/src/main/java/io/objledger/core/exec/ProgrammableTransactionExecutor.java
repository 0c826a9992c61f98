// file: src/main/java/io/objledger/core/exec/ProgrammableTransactionExecutor.java
package io.objledger.core.exec;

import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.args.ArgumentUsageValidator;
import io.objledger.core.args.PackageResolver;
import io.objledger.core.args.ResolvedInput;
import io.objledger.core.effects.ExecutionStatus;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.gas.GasCoin;
import io.objledger.core.gas.GasCostSummary;
import io.objledger.core.gas.GasSchedule;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.publish.FunctionDef;
import io.objledger.core.publish.PublicationGate;
import io.objledger.core.tx.Argument;
import io.objledger.core.tx.CallArg;
import io.objledger.core.tx.Command;
import io.objledger.core.tx.TransactionData;
import io.objledger.core.types.KnownTypes;
import io.objledger.core.types.StructTag;
import io.objledger.core.types.TypeTag;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs the commands of a programmable transaction against a {@link TemporaryStore}.
 * <p>
 * Steps:
 *  1) argument usage walk ({@link ArgumentUsageValidator}),
 *  2) commands in order: builtins here, {@code MoveCall} through the {@link ContractRuntime},
 *  3) every owned or mutable shared input gets a new version even if untouched,
 *  4) gas: cost from the {@link GasSchedule}, deducted from the gas coin.
 * <p>
 * An {@link ExecutionError} anywhere discards all writes except the gas
 * charge and yields a failed status. Any other exception propagates.
 */
public final class ProgrammableTransactionExecutor {
    private static final Logger log = Logger.getLogger(ProgrammableTransactionExecutor.class.getName());

    private final ContractRuntime runtime;
    private final PackageResolver resolver;
    private final GasSchedule gasSchedule;

    public ProgrammableTransactionExecutor(ContractRuntime runtime, PackageResolver resolver, GasSchedule gasSchedule) {
        this.runtime = runtime;
        this.resolver = resolver;
        this.gasSchedule = gasSchedule;
    }

    public ExecutionResult execute(TransactionData tx, List<ResolvedInput> inputs, LedgerObject gasCoin,
                                   TemporaryStore store) {
        int[] executed = {0};
        try {
            new ArgumentUsageValidator(resolver).validate(tx.kind(), inputs);
            runCommands(tx, inputs, gasCoin.id(), store, executed);
            for (ResolvedInput in : inputs) {
                if (!in.isPure() && !in.isReadOnly() && store.read(in.object().id()).isPresent()) {
                    store.touch(in.object().id());
                }
            }
            GasCostSummary cost = new GasCostSummary(
                    gasSchedule.computationCost(executed[0], tx.gasPrice()),
                    gasSchedule.storageCost(store.writtenBytes(), tx.gasPrice()));
            if (cost.total() > tx.gasBudget()) {
                throw new ExecutionError(ExecutionFailureStatus.INSUFFICIENT_GAS,
                        "cost " + cost.total() + " exceeds budget " + tx.gasBudget());
            }
            if (!deduct(store, gasCoin, cost.total())) {
                throw new ExecutionError(ExecutionFailureStatus.INSUFFICIENT_GAS, "gas coin balance below cost");
            }
            return new ExecutionResult(ExecutionStatus.SUCCESS, cost, executed[0]);
        } catch (ExecutionError e) {
            log.fine(() -> "tx " + store.digest() + " failed: " + e.getMessage());
            store.discardWrites();
            long computation = Math.min(gasSchedule.computationCost(executed[0], tx.gasPrice()), tx.gasBudget());
            GasCostSummary cost = new GasCostSummary(computation, 0);
            if (!deduct(store, gasCoin, cost.total())) {
                throw new IllegalStateException("gas coin " + gasCoin.id() + " cannot cover a checked budget");
            }
            return new ExecutionResult(ExecutionStatus.Failure.of(e), cost, executed[0]);
        }
    }

    private void runCommands(TransactionData tx, List<ResolvedInput> inputs, ObjectID gasId,
                             TemporaryStore store, int[] executed) {
        List<List<ArgValue>> results = new ArrayList<>();
        List<Command> commands = tx.kind().commands();
        for (int c = 0; c < commands.size(); c++) {
            try {
                results.add(run(commands.get(c), inputs, results, gasId, store));
            } catch (ExecutionError e) {
                throw e.atCommand(c);
            }
            executed[0]++;
        }
    }

    private List<ArgValue> run(Command cmd, List<ResolvedInput> inputs, List<List<ArgValue>> results,
                               ObjectID gasId, TemporaryStore store) {
        if (cmd instanceof Command.MoveCall call) {
            FunctionDef fn = resolver.resolve(call.packageId())
                    .flatMap(p -> p.module(call.module()))
                    .flatMap(m -> m.function(call.function()))
                    .orElseThrow(() -> new ExecutionError(ExecutionFailureStatus.FUNCTION_NOT_FOUND,
                            call.module() + "::" + call.function()));
            List<ArgValue> args = values(call.arguments(), inputs, results, gasId);
            return runtime.call(new ContractRuntime.Call(call.packageId(), call.module(), call.function(), fn,
                    call.typeArguments(), args), store);
        }
        if (cmd instanceof Command.MakeMoveVec vec) {
            List<ArgValue> elements = values(vec.elements(), inputs, results, gasId);
            TypeTag type = vec.elementType().orElseGet(() -> ((ArgValue.ObjectValue) elements.get(0)).type());
            return List.of(new ArgValue.VectorValue(type, elements));
        }
        if (cmd instanceof Command.TransferObjects t) {
            ArgValue to = value(t.recipient(), inputs, results, gasId);
            AccountAddress recipient = new AccountAddress(((ArgValue.PureValue) to).bytes());
            for (ArgValue v : values(t.objects(), inputs, results, gasId)) {
                store.transfer(((ArgValue.ObjectValue) v).id(), Owner.address(recipient));
            }
            return List.of();
        }
        PublicationGate.execute((Command.Publish) cmd, store, resolver);
        return List.of();
    }

    private static List<ArgValue> values(List<Argument> args, List<ResolvedInput> inputs,
                                         List<List<ArgValue>> results, ObjectID gasId) {
        List<ArgValue> out = new ArrayList<>(args.size());
        for (Argument a : args) out.add(value(a, inputs, results, gasId));
        return out;
    }

    private static ArgValue value(Argument a, List<ResolvedInput> inputs, List<List<ArgValue>> results,
                                  ObjectID gasId) {
        if (a instanceof Argument.GasCoin) {
            return new ArgValue.ObjectValue(gasId, KnownTypes.GAS_COIN);
        }
        if (a instanceof Argument.Input in) {
            ResolvedInput input = inputs.get(in.index());
            if (input.isPure()) {
                return new ArgValue.PureValue(((CallArg.Pure) input.arg()).bytes());
            }
            StructTag type = input.object().moveType()
                    .orElseThrow(() -> new IllegalStateException("package passed as value"));
            return new ArgValue.ObjectValue(input.object().id(), type);
        }
        if (a instanceof Argument.Result r) {
            return results.get(r.command()).get(0);
        }
        Argument.NestedResult n = (Argument.NestedResult) a;
        return results.get(n.command()).get(n.result());
    }

    /** Takes {@code amount} from the gas coin's current balance; false if it is too low. */
    private static boolean deduct(TemporaryStore store, LedgerObject gasCoin, long amount) {
        ObjectView view = store.read(gasCoin.id())
                .orElseThrow(() -> new IllegalStateException("gas coin " + gasCoin.id() + " disappeared"));
        long balance = GasCoin.balance(view.moveData());
        if (balance < amount) return false;
        store.write(gasCoin.id(), GasCoin.withBalance(view.moveData(), balance - amount), view.owner());
        return true;
    }
}
