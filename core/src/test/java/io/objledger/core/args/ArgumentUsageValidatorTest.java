package io.objledger.core.args;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TestObjects;
import io.objledger.core.TestPackages;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.error.CommandArgumentErrorKind;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.tx.Argument;
import io.objledger.core.tx.CallArg;
import io.objledger.core.tx.Command;
import io.objledger.core.tx.ProgrammableTransaction;
import io.objledger.core.tx.ProgrammableTransactionBuilder;
import io.objledger.core.types.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.objledger.core.TestObjects.ALICE;
import static io.objledger.core.TestObjects.BOB;
import static io.objledger.core.TestObjects.OTHER;
import static io.objledger.core.TestObjects.PACKAGE;
import static io.objledger.core.TestObjects.id;
import static io.objledger.core.TestObjects.object;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Every argument use is checked once, in command order, and the
 * first bad use is reported with its command and argument index.
 */
class ArgumentUsageValidatorTest {

    private final Map<ObjectID, LedgerObject> objects = new HashMap<>();
    private final ArgumentUsageValidator validator = new ArgumentUsageValidator(TestPackages.RESOLVER);

    private LedgerObject put(LedgerObject o) {
        objects.put(o.id(), o);
        return o;
    }

    private List<ResolvedInput> resolve(ProgrammableTransaction pt) {
        List<ResolvedInput> out = new ArrayList<>();
        for (CallArg arg : pt.inputs()) {
            out.add(arg instanceof CallArg.Pure p
                    ? ResolvedInput.pure(p)
                    : new ResolvedInput(arg, objects.get(arg.objectId().orElseThrow())));
        }
        return out;
    }

    private ExecutionError failure(ProgrammableTransaction pt) {
        return assertThrows(ExecutionError.class, () -> validator.validate(pt, resolve(pt)));
    }

    private static void assertArgError(ExecutionError e, int command, int arg, CommandArgumentErrorKind kind) {
        assertEquals(command, e.command());
        assertEquals(new ExecutionFailureStatus.CommandArgumentError(arg, kind), e.status());
    }

    private static Argument.Input owned(ProgrammableTransactionBuilder b, LedgerObject o) {
        return (Argument.Input) b.object(new CallArg.ImmOrOwnedObject(o.reference()));
    }

    private static Command.MoveCall call(String fn, Argument... args) {
        return new Command.MoveCall(PACKAGE, "m", fn, List.of(), List.of(args));
    }

    // ---- static input checks ----

    @Test
    void shape_errors_are_user_input_errors() {
        var empty = new ProgrammableTransaction(List.of(), List.of());
        assertEquals(UserInputError.Kind.EMPTY_COMMAND_INPUT,
                assertThrows(UserInputException.class, () -> ArgumentUsageValidator.checkInput(empty)).kind());

        var o = put(object(id(1), 1, Owner.address(ALICE)));
        var dup = new ProgrammableTransaction(
                List.of(new CallArg.ImmOrOwnedObject(o.reference()), new CallArg.ImmOrOwnedObject(o.reference())),
                List.of(call("borrow", new Argument.Input(0))));
        assertEquals(UserInputError.Kind.DUPLICATE_OBJECT_REF_INPUT,
                assertThrows(UserInputException.class, () -> ArgumentUsageValidator.checkInput(dup)).kind());

        var outOfRange = new ProgrammableTransaction(List.of(), List.of(call("borrow", new Argument.Input(0))));
        var forward = new ProgrammableTransaction(List.of(),
                List.of(call("take", new Argument.Result(1)), call("make")));
        for (var pt : List.of(outOfRange, forward)) {
            assertEquals(UserInputError.Kind.INVALID_ARGUMENT_REFERENCE,
                    assertThrows(UserInputException.class, () -> ArgumentUsageValidator.checkInput(pt)).kind());
        }

        var emptyVec = new ProgrammableTransaction(List.of(),
                List.of(new Command.MakeMoveVec(Optional.empty(), List.of())));
        assertEquals(UserInputError.Kind.EMPTY_COMMAND_INPUT,
                assertThrows(UserInputException.class, () -> ArgumentUsageValidator.checkInput(emptyVec)).kind());
    }

    // ---- taken values ----

    @Test
    void value_cannot_be_used_after_it_was_moved() {
        var o = put(object(id(1), 1, Owner.address(ALICE)));
        var b = new ProgrammableTransactionBuilder();
        var in = owned(b, o);
        b.command(call("take", in));
        b.command(call("borrow", in));
        assertArgError(failure(b.finish()), 1, 0, CommandArgumentErrorKind.INVALID_USAGE_OF_TAKEN_VALUE);
    }

    @Test
    void value_moved_into_a_vector_is_taken_for_later_commands() {
        var o = put(object(id(1), 1, Owner.address(ALICE)));
        var b = new ProgrammableTransactionBuilder();
        var in = owned(b, o);
        b.makeMoveVec(null, List.of(in));
        b.command(call("take", in));
        assertArgError(failure(b.finish()), 1, 0, CommandArgumentErrorKind.INVALID_USAGE_OF_TAKEN_VALUE);

        var ok = new ProgrammableTransactionBuilder();
        var in2 = owned(ok, o);
        ok.command(call("take_vec", ok.makeMoveVec(null, List.of(in2))));
        var pt = ok.finish();
        assertDoesNotThrow(() -> validator.validate(pt, resolve(pt)));
    }

    @Test
    void value_taken_before_a_vector_cannot_be_moved_into_it() {
        var o = put(object(id(1), 1, Owner.address(ALICE)));
        var b = new ProgrammableTransactionBuilder();
        var in = owned(b, o);
        b.command(call("take", in));
        b.makeMoveVec(null, List.of(in));
        assertArgError(failure(b.finish()), 1, 0, CommandArgumentErrorKind.INVALID_USAGE_OF_TAKEN_VALUE);

        var sameCall = new ProgrammableTransactionBuilder();
        var in2 = owned(sameCall, o);
        var vec = sameCall.makeMoveVec(null, List.of(in2));
        sameCall.command(call("take_vec_and_obj", vec, in2));
        assertArgError(failure(sameCall.finish()), 1, 1, CommandArgumentErrorKind.INVALID_USAGE_OF_TAKEN_VALUE);
    }

    @Test
    void empty_vector_with_an_element_type_is_valid() {
        var b = new ProgrammableTransactionBuilder();
        b.command(call("take_vec", b.makeMoveVec(TestObjects.OBJ, List.of())));
        var pt = b.finish();
        assertDoesNotThrow(() -> ArgumentUsageValidator.checkInput(pt));
        assertDoesNotThrow(() -> validator.validate(pt, resolve(pt)));
    }

    @Test
    void result_and_first_nested_result_are_the_same_value() {
        var b = new ProgrammableTransactionBuilder();
        var made = b.moveCall(PACKAGE, "m", "make", List.of(), List.of());
        b.command(call("take", made));
        b.command(call("take", new Argument.NestedResult(0, 0)));
        assertArgError(failure(b.finish()), 2, 0, CommandArgumentErrorKind.INVALID_USAGE_OF_TAKEN_VALUE);
    }

    @Test
    void multi_result_command_must_be_addressed_by_nested_result() {
        var b = new ProgrammableTransactionBuilder();
        var two = b.moveCall(PACKAGE, "m", "make_two", List.of(), List.of());
        b.command(call("take", two));
        assertArgError(failure(b.finish()), 1, 0, CommandArgumentErrorKind.TYPE_MISMATCH);

        var ok = new ProgrammableTransactionBuilder();
        ok.moveCall(PACKAGE, "m", "make_two", List.of(), List.of());
        ok.command(call("take", new Argument.NestedResult(0, 1)));
        ok.command(call("take", new Argument.NestedResult(0, 0)));
        var pt = ok.finish();
        assertDoesNotThrow(() -> validator.validate(pt, resolve(pt)));
    }

    // ---- read-only and gas ----

    @Test
    void immutable_and_read_only_shared_inputs_are_by_reference_only() {
        var frozen = put(object(id(1), 1, Owner.IMMUTABLE));
        var b = new ProgrammableTransactionBuilder();
        var in = owned(b, frozen);
        b.command(call("borrow", in));
        b.command(call("take", in));
        assertArgError(failure(b.finish()), 1, 0, CommandArgumentErrorKind.INVALID_OBJECT_BY_VALUE);

        var shared = put(object(id(2), 5, Owner.shared(SequenceNumber.of(2))));
        var s = new ProgrammableTransactionBuilder();
        var sin = s.object(new CallArg.SharedObject(shared.id(), SequenceNumber.of(2), false));
        s.command(call("borrow_mut", sin));
        assertArgError(failure(s.finish()), 0, 0, CommandArgumentErrorKind.INVALID_OBJECT_BY_MUT_REF);
    }

    @Test
    void gas_coin_only_by_mutable_reference() {
        var ok = new ProgrammableTransactionBuilder();
        ok.command(call("use_gas", Argument.GAS_COIN));
        var pt = ok.finish();
        assertDoesNotThrow(() -> validator.validate(pt, resolve(pt)));

        var vec = new ProgrammableTransactionBuilder();
        vec.makeMoveVec(null, List.of(Argument.GAS_COIN));
        assertArgError(failure(vec.finish()), 0, 0, CommandArgumentErrorKind.INVALID_GAS_COIN_USAGE);

        var transfer = new ProgrammableTransactionBuilder();
        transfer.transferObjects(List.of(Argument.GAS_COIN), BOB);
        assertArgError(failure(transfer.finish()), 0, 0, CommandArgumentErrorKind.INVALID_GAS_COIN_USAGE);
    }

    // ---- pure values ----

    @Test
    void pure_bytes_are_checked_against_the_parameter_type() {
        var good = new ProgrammableTransactionBuilder();
        good.command(call("take_string", good.pure(new BcsWriter().writeString("hello").toByteArray())));
        var pt = good.finish();
        assertDoesNotThrow(() -> validator.validate(pt, resolve(pt)));

        var badUtf8 = new ProgrammableTransactionBuilder();
        badUtf8.command(call("take_string", badUtf8.pure(new BcsWriter().writeBytes(new byte[]{(byte) 0xff}).toByteArray())));
        assertArgError(failure(badUtf8.finish()), 0, 0, CommandArgumentErrorKind.INVALID_BCS_BYTES);

        var shortU64 = new ProgrammableTransactionBuilder();
        shortU64.command(call("take_u64", shortU64.pure(new byte[]{1, 2, 3})));
        assertArgError(failure(shortU64.finish()), 0, 0, CommandArgumentErrorKind.INVALID_BCS_BYTES);

        var pureForObject = new ProgrammableTransactionBuilder();
        pureForObject.command(call("borrow", pureForObject.pureU64(7)));
        assertArgError(failure(pureForObject.finish()), 0, 0, CommandArgumentErrorKind.TYPE_MISMATCH);
    }

    // ---- vectors ----

    @Test
    void vector_elements_must_share_one_type_and_not_be_shared() {
        var a = put(object(id(1), 1, Owner.address(ALICE)));
        var other = put(object(id(2), 1, Owner.address(ALICE), OTHER));
        var b = new ProgrammableTransactionBuilder();
        b.makeMoveVec(null, List.of(owned(b, a), owned(b, other)));
        assertArgError(failure(b.finish()), 0, 1, CommandArgumentErrorKind.TYPE_MISMATCH);

        var shared = put(object(id(3), 4, Owner.shared(SequenceNumber.of(4))));
        var s = new ProgrammableTransactionBuilder();
        s.makeMoveVec(null, List.of(s.object(new CallArg.SharedObject(shared.id(), SequenceNumber.of(4), true))));
        assertArgError(failure(s.finish()), 0, 0, CommandArgumentErrorKind.SHARED_OBJECT_NOT_ALLOWED_IN_VECTOR);

        var pure = new ProgrammableTransactionBuilder();
        pure.makeMoveVec(PrimitiveType.U64, List.of(pure.pureU64(1), pure.pure(new byte[]{9})));
        assertArgError(failure(pure.finish()), 0, 1, CommandArgumentErrorKind.INVALID_BCS_BYTES);
    }

    // ---- call resolution ----

    @Test
    void call_resolution_failures() {
        var missingPkg = new ProgrammableTransaction(List.of(),
                List.of(new Command.MoveCall(id(77), "m", "make", List.of(), List.of())));
        assertEquals(ExecutionFailureStatus.PACKAGE_NOT_FOUND, failure(missingPkg).status());

        var hidden = new ProgrammableTransaction(List.of(), List.of(call("hidden")));
        assertEquals(ExecutionFailureStatus.FUNCTION_NOT_FOUND, failure(hidden).status());

        var noFn = new ProgrammableTransaction(List.of(), List.of(call("nope")));
        assertEquals(ExecutionFailureStatus.FUNCTION_NOT_FOUND, failure(noFn).status());

        var generic = new ProgrammableTransaction(List.of(), List.of(call("generic", Argument.GAS_COIN)));
        assertEquals(ExecutionFailureStatus.TYPE_ARITY_MISMATCH, failure(generic).status());

        var arity = new ProgrammableTransaction(List.of(), List.of(call("make", Argument.GAS_COIN)));
        var e = failure(arity);
        assertEquals(ExecutionFailureStatus.ARITY_MISMATCH, e.status());
        assertEquals(0, e.command());
    }

    // ---- transfers ----

    @Test
    void transfer_needs_objects_and_an_address() {
        var frozen = put(object(id(1), 1, Owner.IMMUTABLE));
        var b = new ProgrammableTransactionBuilder();
        b.transferObjects(List.of(owned(b, frozen)), BOB);
        assertArgError(failure(b.finish()), 0, 0, CommandArgumentErrorKind.INVALID_OBJECT_BY_VALUE);

        var o = put(object(id(2), 1, Owner.address(ALICE)));
        var badRecipient = new ProgrammableTransactionBuilder();
        var obj = owned(badRecipient, o);
        badRecipient.command(new Command.TransferObjects(List.of(obj), badRecipient.pureU64(3)));
        assertArgError(failure(badRecipient.finish()), 0, 1, CommandArgumentErrorKind.INVALID_BCS_BYTES);

        var ok = new ProgrammableTransactionBuilder();
        ok.transferObjects(List.of(ok.moveCall(PACKAGE, "m", "make", List.of(), List.of()), owned(ok, o)), BOB);
        var pt = ok.finish();
        assertDoesNotThrow(() -> validator.validate(pt, resolve(pt)));
    }
}
