// file: server/src/main/java/io/objledger/server/AuthorityState.java
package io.objledger.server;

import io.objledger.core.AccountAddress;
import io.objledger.core.ExecutionLimits;
import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.args.ArgumentUsageValidator;
import io.objledger.core.args.PackageResolver;
import io.objledger.core.args.ResolvedInput;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.effects.EffectsBuilder;
import io.objledger.core.effects.EffectsInput;
import io.objledger.core.effects.ObjectWrite;
import io.objledger.core.effects.PriorState;
import io.objledger.core.effects.TransactionEffects;
import io.objledger.core.effects.TransactionOutputs;
import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;
import io.objledger.core.exec.ContractRuntime;
import io.objledger.core.exec.ExecutionResult;
import io.objledger.core.exec.ProgrammableTransactionExecutor;
import io.objledger.core.exec.TemporaryStore;
import io.objledger.core.gas.GasCoin;
import io.objledger.core.gas.GasSchedule;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.object.ObjectEntry;
import io.objledger.core.ownership.OwnershipAuthenticator;
import io.objledger.core.ownership.TransactionAuthority;
import io.objledger.core.tx.CallArg;
import io.objledger.core.tx.TransactionData;
import io.objledger.storage.ObjectStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Transaction pipeline of a single validator.
 * <p>
 * For each transaction:
 *  1) Static checks on the transaction shape.
 *  2) Gas checks: budget, gas object and balance.
 *  3) Load every object input at the referenced version and authenticate it.
 *  4) Execute the commands over a {@link TemporaryStore}.
 *  5) Collect the prior state of everything written, build effects and commit.
 * <p>
 * Transactions are idempotent by digest: a transaction that was already
 * committed returns its stored effects without running again.
 * <p>
 * Execution is serialized: owned inputs are checked against the latest
 * committed versions, so two transactions spending the same version cannot
 * both pass.
 */
public class AuthorityState {
    private static final Logger log = Logger.getLogger(AuthorityState.class.getName());

    private final ObjectStore store;
    private final ExecutionLimits limits;
    private final GasSchedule gasSchedule;
    private final ProgrammableTransactionExecutor executor;
    private final EffectsBuilder effectsBuilder;

    public AuthorityState(ObjectStore store, ContractRuntime runtime, ExecutionLimits limits, GasSchedule gasSchedule) {
        this.store = Objects.requireNonNull(store, "store");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.gasSchedule = Objects.requireNonNull(gasSchedule, "gasSchedule");
        PackageResolver packages = new StorePackageResolver(store);
        this.executor = new ProgrammableTransactionExecutor(runtime, packages, gasSchedule);
        this.effectsBuilder = new EffectsBuilder(limits);
    }

    /** Latest live version of an object, as seen in API responses. */
    public record ObjectInfo(ObjectRef reference, LedgerObject object) {}

    /**
     * Decode and run a submitted transaction. The signer stands in for the
     * transaction signature and must be the sender.
     *
     * @throws UserInputException if the bytes do not decode or the signer is not the sender
     */
    public TransactionEffects submit(byte[] txBytes, AccountAddress signer) {
        TransactionData tx;
        try {
            tx = TransactionData.fromBytes(txBytes);
        } catch (BcsException e) {
            throw new UserInputException(UserInputError.Kind.TRANSACTION_DESERIALIZATION, e.getMessage());
        }
        if (!tx.sender().equals(signer)) {
            throw new UserInputException(UserInputError.Kind.INCORRECT_USER_SIGNATURE,
                    "signer " + signer + " is not the sender " + tx.sender());
        }
        return executeTransaction(tx);
    }

    /**
     * Run {@code tx} and commit its outputs.
     *
     * @return effects of the (possibly failed) execution
     * @throws UserInputException if the transaction is rejected before execution; nothing is committed
     */
    public synchronized TransactionEffects executeTransaction(TransactionData tx) {
        TransactionDigest digest = tx.digest();
        Optional<TransactionEffects> done = store.getEffects(digest);
        if (done.isPresent()) {
            log.fine(() -> "tx " + digest + " already executed");
            return done.get();
        }
        try {
            ArgumentUsageValidator.checkInput(tx.kind());
            LedgerObject gas = loadGas(tx);
            List<ResolvedInput> inputs = loadInputs(tx);
            authenticate(tx, inputs, gas);

            List<LedgerObject> objects = new ArrayList<>();
            for (ResolvedInput in : inputs) {
                if (!in.isPure()) objects.add(in.object());
            }
            objects.add(gas);
            TemporaryStore temp = new TemporaryStore(digest, tx.sender(), objects, store::getObject);
            ExecutionResult result = executor.execute(tx, inputs, gas, temp);

            TransactionOutputs outputs = effectsBuilder.build(new EffectsInput(
                    digest, result.status(), gas.id(), causalVersions(objects), priorState(temp),
                    temp.writes(), temp.liveDuringTx(), sharedInputs(inputs), dependencies(objects, temp),
                    result.gasUsed()));
            store.commit(tx, outputs);
            TransactionEffects effects = outputs.effects();
            log.info(() -> "tx " + digest + " " + effects.status() + " lamport=" + effects.lamportVersion()
                    + " created=" + effects.created().size() + " mutated=" + effects.mutated().size()
                    + " deleted=" + effects.deleted().size() + " wrapped=" + effects.wrapped().size());
            return effects;
        } catch (UserInputException e) {
            log.warning("tx " + digest + " rejected: " + e.getMessage());
            throw e;
        }
    }

    /** @throws UserInputException {@code ObjectNotFound} for missing, wrapped and deleted ids */
    public ObjectInfo getObjectInfo(ObjectID id) {
        LedgerObject o = store.getObject(id)
                .orElseThrow(() -> new UserInputException(UserInputError.Kind.OBJECT_NOT_FOUND, id.toString()));
        return new ObjectInfo(o.reference(), o);
    }

    public Optional<TransactionEffects> getEffects(TransactionDigest digest) {
        return store.getEffects(digest);
    }

    public GasSchedule gasSchedule() {
        return gasSchedule;
    }

    // ----------------- input loading -----------------

    private LedgerObject loadGas(TransactionData tx) {
        ObjectRef ref = tx.gasPayment();
        for (CallArg arg : tx.kind().inputs()) {
            if (arg.objectId().filter(ref.id()::equals).isPresent()) {
                throw new UserInputException(UserInputError.Kind.DUPLICATE_OBJECT_REF_INPUT,
                        "gas object " + ref.id() + " is also an input");
            }
        }
        if (tx.gasBudget() < gasSchedule.minBudget()) {
            throw new UserInputException(UserInputError.Kind.GAS_BUDGET_TOO_LOW,
                    "budget " + tx.gasBudget() + " below minimum " + gasSchedule.minBudget());
        }
        LedgerObject gas = loadOwned(ref);
        if (!GasCoin.isGasCoin(gas) || !(gas.owner() instanceof Owner.AddressOwner)) {
            throw new UserInputException(UserInputError.Kind.INVALID_GAS_OBJECT, ref.id().toString());
        }
        long balance = GasCoin.balance((MoveObjectData) gas.data());
        if (balance < tx.gasBudget()) {
            throw new UserInputException(UserInputError.Kind.GAS_BALANCE_TOO_LOW,
                    "balance " + balance + " below budget " + tx.gasBudget());
        }
        return gas;
    }

    private List<ResolvedInput> loadInputs(TransactionData tx) {
        List<ResolvedInput> out = new ArrayList<>();
        for (CallArg arg : tx.kind().inputs()) {
            if (arg instanceof CallArg.Pure p) {
                out.add(ResolvedInput.pure(p));
            } else if (arg instanceof CallArg.ImmOrOwnedObject o) {
                out.add(new ResolvedInput(arg, loadOwned(o.ref())));
            } else {
                ObjectID id = ((CallArg.SharedObject) arg).id();
                LedgerObject shared = store.getObject(id)
                        .orElseThrow(() -> new UserInputException(UserInputError.Kind.OBJECT_NOT_FOUND, id.toString()));
                out.add(new ResolvedInput(arg, shared));
            }
        }
        return out;
    }

    /** The object at exactly the referenced version and digest. */
    private LedgerObject loadOwned(ObjectRef ref) {
        LedgerObject o = store.getObject(ref.id())
                .orElseThrow(() -> new UserInputException(UserInputError.Kind.OBJECT_NOT_FOUND, ref.id().toString()));
        if (!o.version().equals(ref.version())) {
            throw new UserInputException(UserInputError.Kind.OBJECT_VERSION_UNAVAILABLE_FOR_CONSUMPTION,
                    ref + ", current version " + o.version());
        }
        if (!o.digest().equals(ref.digest())) {
            throw new UserInputException(UserInputError.Kind.INVALID_OBJECT_DIGEST,
                    ref + ", current digest " + o.digest());
        }
        return o;
    }

    private void authenticate(TransactionData tx, List<ResolvedInput> inputs, LedgerObject gas) {
        Set<ObjectID> inputIds = new HashSet<>();
        for (ResolvedInput in : inputs) {
            if (!in.isPure()) inputIds.add(in.object().id());
        }
        inputIds.add(gas.id());
        TransactionAuthority authority = new TransactionAuthority(tx.sender(), inputIds);
        OwnershipAuthenticator auth = new OwnershipAuthenticator(limits, store::getObject);
        for (ResolvedInput in : inputs) {
            if (!in.isPure()) auth.authenticateInput(in.arg(), in.object(), authority).orThrow();
        }
        auth.authenticate(gas, authority).orThrow();
    }

    // ----------------- effects inputs -----------------

    private static List<SequenceNumber> causalVersions(List<LedgerObject> objects) {
        List<SequenceNumber> out = new ArrayList<>(objects.size());
        for (LedgerObject o : objects) out.add(o.version());
        return out;
    }

    /**
     * Prior state of every written id, plus the stored descendants of every
     * deleted id so the effects builder can cascade the deletion.
     */
    private Map<ObjectID, PriorState> priorState(TemporaryStore temp) {
        Map<ObjectID, PriorState> pre = new HashMap<>();
        for (ObjectID id : temp.writes().keySet()) {
            LedgerObject known = temp.inputs().get(id);
            if (known == null) known = temp.loadedChildren().get(id);
            if (known != null) {
                pre.put(id, new PriorState.Live(known));
            } else {
                store.getLatestEntry(id).flatMap(PriorState::of).ifPresent(p -> pre.put(id, p));
            }
        }

        Deque<ObjectID> queue = new ArrayDeque<>();
        for (Map.Entry<ObjectID, ObjectWrite> e : temp.writes().entrySet()) {
            if (e.getValue() instanceof ObjectWrite.Delete) queue.add(e.getKey());
        }
        int found = 0;
        while (!queue.isEmpty() && found <= limits.maxCascadeObjects()) {
            for (ObjectEntry child : store.scanOwnedBy(queue.poll())) {
                if (pre.containsKey(child.id())) continue;
                Optional<PriorState> p = PriorState.of(child);
                if (p.isEmpty()) continue;
                pre.put(child.id(), p.get());
                queue.add(child.id());
                found++;
            }
        }
        return pre;
    }

    private static List<ObjectRef> sharedInputs(List<ResolvedInput> inputs) {
        List<ObjectRef> out = new ArrayList<>();
        for (ResolvedInput in : inputs) {
            if (in.isShared()) out.add(in.object().reference());
        }
        return out;
    }

    private static Set<TransactionDigest> dependencies(List<LedgerObject> objects, TemporaryStore temp) {
        Set<TransactionDigest> out = new HashSet<>();
        for (LedgerObject o : objects) out.add(o.previousTransaction());
        for (LedgerObject o : temp.loadedChildren().values()) out.add(o.previousTransaction());
        return out;
    }
}
