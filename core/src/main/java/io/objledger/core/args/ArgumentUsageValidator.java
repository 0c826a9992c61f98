// file: src/main/java/io/objledger/core/args/ArgumentUsageValidator.java
package io.objledger.core.args;

import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.error.CommandArgumentErrorKind;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;
import io.objledger.core.publish.FunctionDef;
import io.objledger.core.publish.ModuleDescriptor;
import io.objledger.core.publish.PublicationGate;
import io.objledger.core.tx.Argument;
import io.objledger.core.tx.CallArg;
import io.objledger.core.tx.Command;
import io.objledger.core.tx.ProgrammableTransaction;
import io.objledger.core.types.KnownTypes;
import io.objledger.core.types.PrimitiveType;
import io.objledger.core.types.SignatureToken;
import io.objledger.core.types.StructTag;
import io.objledger.core.types.TypeTag;
import io.objledger.core.types.VectorType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static io.objledger.core.error.CommandArgumentErrorKind.INVALID_BCS_BYTES;
import static io.objledger.core.error.CommandArgumentErrorKind.INVALID_GAS_COIN_USAGE;
import static io.objledger.core.error.CommandArgumentErrorKind.INVALID_OBJECT_BY_MUT_REF;
import static io.objledger.core.error.CommandArgumentErrorKind.INVALID_OBJECT_BY_VALUE;
import static io.objledger.core.error.CommandArgumentErrorKind.INVALID_USAGE_OF_TAKEN_VALUE;
import static io.objledger.core.error.CommandArgumentErrorKind.SHARED_OBJECT_NOT_ALLOWED_IN_VECTOR;
import static io.objledger.core.error.CommandArgumentErrorKind.TYPE_MISMATCH;

/**
 * Validates how a programmable transaction uses its arguments.
 * <p>
 * Two phases:
 *  - {@link #checkInput}: shape checks that need no state. Failures are
 *    {@link UserInputException}s and the transaction is rejected outright.
 *  - {@link #validate}: one walk over the commands with a fresh
 *    {@link UsageContext}. Failures are {@link ExecutionError}s carrying the
 *    command index and argument index of the first offending use.
 */
public final class ArgumentUsageValidator {
    private final PackageResolver resolver;

    public ArgumentUsageValidator(PackageResolver resolver) {
        this.resolver = resolver;
    }

    // ---- static input checks ----

    public static void checkInput(ProgrammableTransaction pt) {
        if (pt.commands().isEmpty()) {
            throw new UserInputException(UserInputError.Kind.EMPTY_COMMAND_INPUT, "transaction has no commands");
        }
        Set<ObjectID> seen = new HashSet<>();
        for (CallArg arg : pt.inputs()) {
            Optional<ObjectID> id = arg.objectId();
            if (id.isPresent() && !seen.add(id.get())) {
                throw new UserInputException(UserInputError.Kind.DUPLICATE_OBJECT_REF_INPUT, id.get().toString());
            }
        }
        for (int c = 0; c < pt.commands().size(); c++) {
            Command cmd = pt.commands().get(c);
            if (cmd instanceof Command.Publish p) {
                PublicationGate.checkInput(p);
            } else if (cmd instanceof Command.MakeMoveVec v) {
                if (v.elementType().isEmpty() && v.elements().isEmpty()) {
                    throw new UserInputException(UserInputError.Kind.EMPTY_COMMAND_INPUT,
                            "command " + c + ": empty vector without an element type");
                }
            } else if (cmd instanceof Command.TransferObjects t && t.objects().isEmpty()) {
                throw new UserInputException(UserInputError.Kind.EMPTY_COMMAND_INPUT,
                        "command " + c + ": nothing to transfer");
            }
            for (Argument a : cmd.arguments()) {
                checkReference(a, c, pt.inputs().size());
            }
        }
    }

    private static void checkReference(Argument a, int command, int inputCount) {
        boolean ok;
        if (a instanceof Argument.Input in) {
            ok = in.index() < inputCount;
        } else if (a instanceof Argument.Result r) {
            ok = r.command() < command;
        } else if (a instanceof Argument.NestedResult n) {
            ok = n.command() < command;
        } else {
            ok = true;
        }
        if (!ok) {
            throw new UserInputException(UserInputError.Kind.INVALID_ARGUMENT_REFERENCE,
                    "command " + command + " references " + a);
        }
    }

    // ---- usage walk ----

    /**
     * Walk every command once.
     *
     * @param inputs the loaded inputs, index-aligned with {@code pt.inputs()}
     * @throws ExecutionError at the first invalid argument use
     */
    public void validate(ProgrammableTransaction pt, List<ResolvedInput> inputs) {
        UsageContext ctx = new UsageContext(inputs);
        for (int c = 0; c < pt.commands().size(); c++) {
            Command cmd = pt.commands().get(c);
            try {
                ctx.recordResults(check(cmd, ctx));
            } catch (ExecutionError e) {
                throw e.atCommand(c);
            }
        }
    }

    private List<TypeTag> check(Command cmd, UsageContext ctx) {
        if (cmd instanceof Command.MoveCall call) return checkMoveCall(call, ctx);
        if (cmd instanceof Command.MakeMoveVec vec) return checkMakeMoveVec(vec, ctx);
        if (cmd instanceof Command.TransferObjects t) return checkTransfer(t, ctx);
        return List.of(); // Publish takes no arguments and its cap goes to the sender
    }

    private List<TypeTag> checkMoveCall(Command.MoveCall call, UsageContext ctx) {
        PackageResolver.ResolvedPackage pkg = resolver.resolve(call.packageId())
                .orElseThrow(() -> new ExecutionError(ExecutionFailureStatus.PACKAGE_NOT_FOUND,
                        call.packageId().toString()));
        ModuleDescriptor module = pkg.module(call.module())
                .orElseThrow(() -> new ExecutionError(ExecutionFailureStatus.FUNCTION_NOT_FOUND,
                        "no module " + call.module()));
        FunctionDef fn = module.function(call.function())
                .filter(FunctionDef::callable)
                .orElseThrow(() -> new ExecutionError(ExecutionFailureStatus.FUNCTION_NOT_FOUND,
                        call.module() + "::" + call.function()));
        if (fn.typeParameterCount() != call.typeArguments().size()) {
            throw new ExecutionError(ExecutionFailureStatus.TYPE_ARITY_MISMATCH,
                    "expected " + fn.typeParameterCount() + " type arguments, got " + call.typeArguments().size());
        }
        if (fn.parameters().size() != call.arguments().size()) {
            throw new ExecutionError(ExecutionFailureStatus.ARITY_MISMATCH,
                    "expected " + fn.parameters().size() + " arguments, got " + call.arguments().size());
        }
        AccountAddress self = pkg.id().toAddress();
        for (int i = 0; i < call.arguments().size(); i++) {
            SignatureToken param = fn.parameters().get(i);
            TypeTag expected = param.dereferenced().instantiate(call.typeArguments(), self);
            Usage usage = param instanceof SignatureToken.MutableReference ? Usage.MUT_REF
                    : param instanceof SignatureToken.Reference ? Usage.REF : Usage.BY_VALUE;
            checkParameter(call.arguments().get(i), i, expected, usage, ctx);
        }
        List<TypeTag> returns = new ArrayList<>(fn.returns().size());
        for (SignatureToken r : fn.returns()) {
            returns.add(r.dereferenced().instantiate(call.typeArguments(), self));
        }
        return returns;
    }

    private void checkParameter(Argument arg, int idx, TypeTag expected, Usage usage, UsageContext ctx) {
        if (arg instanceof Argument.GasCoin) {
            if (!expected.equals(KnownTypes.GAS_COIN)) throw argError(idx, TYPE_MISMATCH, "gas coin");
            if (usage == Usage.BY_VALUE) throw argError(idx, INVALID_GAS_COIN_USAGE, "gas coin by value");
            return;
        }
        if (arg instanceof Argument.Input in && ctx.input(in.index()).isPure()) {
            checkPure(ctx.input(in.index()), idx, expected);
            return;
        }
        if (ctx.isTaken(arg)) throw argError(idx, INVALID_USAGE_OF_TAKEN_VALUE, arg.toString());
        TypeTag actual = valueType(arg, idx, ctx);
        if (!actual.equals(expected)) {
            throw argError(idx, TYPE_MISMATCH,
                    "expected " + expected.toCanonicalString() + ", got " + actual.toCanonicalString());
        }
        if (arg instanceof Argument.Input in && ctx.input(in.index()).isReadOnly()) {
            if (usage == Usage.BY_VALUE) throw argError(idx, INVALID_OBJECT_BY_VALUE, "read-only object");
            if (usage == Usage.MUT_REF) throw argError(idx, INVALID_OBJECT_BY_MUT_REF, "read-only object");
        }
        if (usage == Usage.BY_VALUE) ctx.take(arg);
    }

    private List<TypeTag> checkMakeMoveVec(Command.MakeMoveVec vec, UsageContext ctx) {
        TypeTag element = vec.elementType().orElse(null);
        boolean pureElements = element != null && PureArgumentChecker.isPureType(element);
        for (int i = 0; i < vec.elements().size(); i++) {
            Argument a = vec.elements().get(i);
            if (a instanceof Argument.Input in && ctx.input(in.index()).isPure()) {
                if (!pureElements) throw argError(i, TYPE_MISMATCH, "pure value needs a pure element type");
                checkPure(ctx.input(in.index()), i, element);
                continue;
            }
            TypeTag actual = checkMovedElement(a, i, element, ctx);
            if (element == null) element = actual;
        }
        return List.of(new VectorType(element));
    }

    /** Moves {@code a} into a vector; returns its type. {@code expected} may be null (inferred). */
    private TypeTag checkMovedElement(Argument a, int idx, TypeTag expected, UsageContext ctx) {
        if (a instanceof Argument.GasCoin) throw argError(idx, INVALID_GAS_COIN_USAGE, "gas coin in vector");
        if (ctx.isTaken(a)) throw argError(idx, INVALID_USAGE_OF_TAKEN_VALUE, a.toString());
        if (a instanceof Argument.Input in) {
            ResolvedInput input = ctx.input(in.index());
            if (input.isShared()) throw argError(idx, SHARED_OBJECT_NOT_ALLOWED_IN_VECTOR, input.object().id().toString());
            if (input.isReadOnly()) throw argError(idx, INVALID_OBJECT_BY_VALUE, "read-only object");
        }
        TypeTag actual = valueType(a, idx, ctx);
        if (expected != null && !actual.equals(expected)) {
            throw argError(idx, TYPE_MISMATCH,
                    "expected " + expected.toCanonicalString() + ", got " + actual.toCanonicalString());
        }
        ctx.take(a);
        return actual;
    }

    private List<TypeTag> checkTransfer(Command.TransferObjects t, UsageContext ctx) {
        for (int i = 0; i < t.objects().size(); i++) {
            Argument a = t.objects().get(i);
            if (a instanceof Argument.GasCoin) throw argError(i, INVALID_GAS_COIN_USAGE, "gas coin transfer");
            if (a instanceof Argument.Input in && ctx.input(in.index()).isPure()) {
                throw argError(i, TYPE_MISMATCH, "pure value cannot be transferred");
            }
            if (ctx.isTaken(a)) throw argError(i, INVALID_USAGE_OF_TAKEN_VALUE, a.toString());
            if (a instanceof Argument.Input in) {
                ResolvedInput input = ctx.input(in.index());
                if (input.isReadOnly() || input.isShared()) {
                    throw argError(i, INVALID_OBJECT_BY_VALUE, "object cannot be transferred");
                }
            }
            if (!(valueType(a, i, ctx) instanceof StructTag)) {
                throw argError(i, TYPE_MISMATCH, "only objects can be transferred");
            }
            ctx.take(a);
        }
        int r = t.objects().size();
        Argument recipient = t.recipient();
        if (recipient instanceof Argument.Input in && ctx.input(in.index()).isPure()) {
            checkPure(ctx.input(in.index()), r, PrimitiveType.ADDRESS);
        } else if (recipient instanceof Argument.GasCoin || !valueType(recipient, r, ctx).equals(PrimitiveType.ADDRESS)) {
            throw argError(r, TYPE_MISMATCH, "recipient must be an address");
        }
        return List.of();
    }

    // ---- helpers ----

    private static void checkPure(ResolvedInput input, int idx, TypeTag expected) {
        if (!PureArgumentChecker.isPureType(expected)) {
            throw argError(idx, TYPE_MISMATCH, "pure value for " + expected.toCanonicalString());
        }
        try {
            PureArgumentChecker.check(((CallArg.Pure) input.arg()).bytes(), expected);
        } catch (BcsException e) {
            throw argError(idx, INVALID_BCS_BYTES, e.getMessage());
        }
    }

    /** Type of a non-pure, non-gas argument. */
    private static TypeTag valueType(Argument a, int idx, UsageContext ctx) {
        if (a instanceof Argument.Input in) {
            ResolvedInput input = ctx.input(in.index());
            return input.object().moveType()
                    .map(t -> (TypeTag) t)
                    .orElseThrow(() -> argError(idx, TYPE_MISMATCH, "packages are not values"));
        }
        if (a instanceof Argument.Result r) {
            List<TypeTag> results = ctx.results(r.command());
            if (results.size() != 1) {
                throw argError(idx, TYPE_MISMATCH, "command " + r.command() + " has " + results.size() + " results");
            }
            return results.get(0);
        }
        if (a instanceof Argument.NestedResult n) {
            List<TypeTag> results = ctx.results(n.command());
            if (n.result() >= results.size()) {
                throw argError(idx, TYPE_MISMATCH, "command " + n.command() + " has no result " + n.result());
            }
            return results.get(n.result());
        }
        return KnownTypes.GAS_COIN;
    }

    private static ExecutionError argError(int idx, CommandArgumentErrorKind kind, String message) {
        return ExecutionError.argument(idx, kind, message);
    }

    private enum Usage { BY_VALUE, REF, MUT_REF }
}
