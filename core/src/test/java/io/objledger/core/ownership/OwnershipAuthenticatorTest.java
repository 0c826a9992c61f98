package io.objledger.core.ownership;

import io.objledger.core.ExecutionLimits;
import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.error.UserInputError;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.tx.CallArg;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.objledger.core.TestObjects.ALICE;
import static io.objledger.core.TestObjects.BOB;
import static io.objledger.core.TestObjects.id;
import static io.objledger.core.TestObjects.object;
import static org.junit.jupiter.api.Assertions.*;

/**
 * An input is authorized when the sender owns it directly or
 * through a chain of object owners rooted at another input of the same
 * transaction.
 */
class OwnershipAuthenticatorTest {

    private final Map<ObjectID, LedgerObject> objects = new HashMap<>();

    private LedgerObject put(LedgerObject o) {
        objects.put(o.id(), o);
        return o;
    }

    private OwnershipAuthenticator authenticator(ExecutionLimits limits) {
        return new OwnershipAuthenticator(limits, ObjectTable.of(objects));
    }

    private static UserInputError.Kind denial(AuthDecision d) {
        assertTrue(d instanceof AuthDecision.Denied, "expected denial, got " + d);
        return ((AuthDecision.Denied) d).reason().kind();
    }

    // ---- address owners ----

    @Test
    void sender_owned_object_is_allowed_and_foreign_one_is_not() {
        var mine = put(object(id(1), 1, Owner.address(ALICE)));
        var theirs = put(object(id(2), 1, Owner.address(BOB)));
        var auth = new TransactionAuthority(ALICE, Set.of(mine.id(), theirs.id()));

        var a = authenticator(ExecutionLimits.DEFAULT);
        assertTrue(a.authenticate(mine, auth).isAllowed());
        assertEquals(UserInputError.Kind.INCORRECT_USER_SIGNATURE, denial(a.authenticate(theirs, auth)));
    }

    @Test
    void shared_and_immutable_objects_need_no_owner() {
        var shared = put(object(id(1), 3, Owner.shared(SequenceNumber.of(2))));
        var frozen = put(object(id(2), 1, Owner.IMMUTABLE));
        var auth = new TransactionAuthority(BOB, Set.of(shared.id(), frozen.id()));
        var a = authenticator(ExecutionLimits.DEFAULT);
        assertTrue(a.authenticate(shared, auth).isAllowed());
        assertTrue(a.authenticate(frozen, auth).isAllowed());
    }

    // ---- input kinds ----

    @Test
    void input_kind_must_match_owner_kind() {
        var shared = put(object(id(1), 3, Owner.shared(SequenceNumber.of(2))));
        var owned = put(object(id(2), 1, Owner.address(ALICE)));
        var auth = new TransactionAuthority(ALICE, Set.of(shared.id(), owned.id()));
        var a = authenticator(ExecutionLimits.DEFAULT);

        assertEquals(UserInputError.Kind.NOT_OWNED_OBJECT,
                denial(a.authenticateInput(new CallArg.ImmOrOwnedObject(shared.reference()), shared, auth)));
        assertEquals(UserInputError.Kind.NOT_SHARED_OBJECT,
                denial(a.authenticateInput(new CallArg.SharedObject(owned.id(), SequenceNumber.of(1), true), owned, auth)));
        assertEquals(UserInputError.Kind.SHARED_INITIAL_VERSION_MISMATCH,
                denial(a.authenticateInput(new CallArg.SharedObject(shared.id(), SequenceNumber.of(1), true), shared, auth)));
        assertTrue(a.authenticateInput(new CallArg.SharedObject(shared.id(), SequenceNumber.of(2), false), shared, auth)
                .isAllowed());
    }

    // ---- object owners ----

    @Test
    void child_is_authorized_through_parent_chain_rooted_at_an_input() {
        var root = put(object(id(1), 1, Owner.address(ALICE)));
        var mid = put(object(id(2), 1, Owner.object(root.id())));
        var leaf = put(object(id(3), 1, Owner.object(mid.id())));
        var a = authenticator(ExecutionLimits.DEFAULT);

        assertTrue(a.authenticate(leaf, new TransactionAuthority(ALICE, Set.of(root.id(), leaf.id()))).isAllowed());
        // root not passed as input
        assertEquals(UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT,
                denial(a.authenticate(leaf, new TransactionAuthority(ALICE, Set.of(leaf.id())))));
        // root owned by someone else
        assertEquals(UserInputError.Kind.INCORRECT_USER_SIGNATURE,
                denial(a.authenticate(leaf, new TransactionAuthority(BOB, Set.of(root.id(), leaf.id())))));
    }

    @Test
    void child_of_a_shared_or_immutable_input_is_allowed_for_anyone() {
        var shared = put(object(id(1), 4, Owner.shared(SequenceNumber.of(1))));
        var frozen = put(object(id(2), 1, Owner.IMMUTABLE));
        var underShared = put(object(id(3), 1, Owner.object(shared.id())));
        var underFrozen = put(object(id(4), 1, Owner.object(frozen.id())));
        var a = authenticator(ExecutionLimits.DEFAULT);

        var auth = new TransactionAuthority(BOB, Set.of(shared.id(), frozen.id(), underShared.id(), underFrozen.id()));
        assertTrue(a.authenticate(underShared, auth).isAllowed());
        assertTrue(a.authenticate(underFrozen, auth).isAllowed());
        assertEquals(UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT,
                denial(a.authenticate(underFrozen, new TransactionAuthority(BOB, Set.of(underFrozen.id())))));
    }

    @Test
    void cycles_missing_parents_and_deep_chains_are_rejected() {
        var a1 = put(object(id(1), 1, Owner.object(id(2))));
        put(object(id(2), 1, Owner.object(id(1))));
        var orphan = put(object(id(3), 1, Owner.object(id(99))));
        var auth = new TransactionAuthority(ALICE, Set.of(a1.id(), orphan.id()));
        var a = authenticator(ExecutionLimits.DEFAULT);
        assertEquals(UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT, denial(a.authenticate(a1, auth)));
        assertEquals(UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT, denial(a.authenticate(orphan, auth)));

        var root = put(object(id(10), 1, Owner.address(ALICE)));
        var c1 = put(object(id(11), 1, Owner.object(root.id())));
        var c2 = put(object(id(12), 1, Owner.object(c1.id())));
        var c3 = put(object(id(13), 1, Owner.object(c2.id())));
        var shallow = authenticator(new ExecutionLimits(2, 100, ChildInputPolicy.THROUGH_PARENT));
        var deepAuth = new TransactionAuthority(ALICE, Set.of(root.id(), c3.id()));
        assertEquals(UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT, denial(shallow.authenticate(c3, deepAuth)));
        assertTrue(authenticator(ExecutionLimits.DEFAULT).authenticate(c3, deepAuth).isAllowed());
    }

    @Test
    void reject_policy_refuses_every_child_input() {
        var root = put(object(id(1), 1, Owner.address(ALICE)));
        var child = put(object(id(2), 1, Owner.object(root.id())));
        var a = authenticator(ExecutionLimits.DEFAULT.withChildInputPolicy(ChildInputPolicy.REJECT));
        assertEquals(UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT,
                denial(a.authenticate(child, new TransactionAuthority(ALICE, Set.of(root.id(), child.id())))));
    }
}
