// file: src/main/java/io/objledger/core/ownership/OwnershipAuthenticator.java
package io.objledger.core.ownership;

import io.objledger.core.ExecutionLimits;
import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.tx.CallArg;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static io.objledger.core.error.UserInputError.Kind.INCORRECT_USER_SIGNATURE;
import static io.objledger.core.error.UserInputError.Kind.INVALID_CHILD_OBJECT_ARGUMENT;
import static io.objledger.core.error.UserInputError.Kind.NOT_OWNED_OBJECT;
import static io.objledger.core.error.UserInputError.Kind.NOT_SHARED_OBJECT;
import static io.objledger.core.error.UserInputError.Kind.SHARED_INITIAL_VERSION_MISMATCH;

/**
 * Decides whether a transaction may use an object as input.
 * <p>
 * Rules by owner kind:
 *  - address-owned: only the sender,
 *  - object-owned (child): the parent chain, followed by id through the
 *    {@link ObjectTable}, must reach an object that is itself an input and is
 *    authorized; a chain that ends elsewhere, breaks, loops or exceeds
 *    {@link ExecutionLimits#maxChainDepth()} is {@code InvalidChildObjectArgument},
 *  - shared: anyone, but only through a shared-object input,
 *  - immutable: anyone, read-only.
 * <p>
 * Stateless apart from its configuration; one instance serves any number of
 * transactions.
 */
public final class OwnershipAuthenticator {
    private final ExecutionLimits limits;
    private final ObjectTable table;

    public OwnershipAuthenticator(ExecutionLimits limits, ObjectTable table) {
        this.limits = limits;
        this.table = table;
    }

    /** Checks that the input kind matches the object's owner, then authorizes the object. */
    public AuthDecision authenticateInput(CallArg arg, LedgerObject object, TransactionAuthority authority) {
        if (arg instanceof CallArg.SharedObject s) {
            if (!(object.owner() instanceof Owner.Shared shared)) {
                return AuthDecision.deny(NOT_SHARED_OBJECT, object.id().toString());
            }
            if (!shared.initialSharedVersion().equals(s.initialSharedVersion())) {
                return AuthDecision.deny(SHARED_INITIAL_VERSION_MISMATCH,
                        object.id() + ": expected " + shared.initialSharedVersion()
                                + ", got " + s.initialSharedVersion());
            }
        } else if (arg instanceof CallArg.ImmOrOwnedObject && object.isShared()) {
            return AuthDecision.deny(NOT_OWNED_OBJECT, object.id() + " is shared");
        }
        return authenticate(object, authority);
    }

    public AuthDecision authenticate(LedgerObject object, TransactionAuthority authority) {
        Owner owner = object.owner();
        return switch (owner.kind()) {
            case ADDRESS -> senderOwns((Owner.AddressOwner) owner, object.id(), authority);
            case OBJECT -> authenticateChild(object, authority);
            case SHARED, IMMUTABLE -> AuthDecision.ALLOWED;
        };
    }

    private AuthDecision authenticateChild(LedgerObject child, TransactionAuthority authority) {
        if (limits.childInputPolicy() == ChildInputPolicy.REJECT) {
            return AuthDecision.deny(INVALID_CHILD_OBJECT_ARGUMENT,
                    child.id() + " is owned by an object and child inputs are disabled");
        }
        Set<ObjectID> visited = new HashSet<>();
        visited.add(child.id());
        LedgerObject current = child;
        for (int depth = 0; depth < limits.maxChainDepth(); depth++) {
            ObjectID parentId = ((Owner.ObjectOwner) current.owner()).parent();
            if (!visited.add(parentId)) {
                return invalidChild(child, "ownership cycle at " + parentId);
            }
            Optional<LedgerObject> parent = table.get(parentId);
            if (parent.isEmpty()) {
                return invalidChild(child, "parent " + parentId + " not found");
            }
            LedgerObject p = parent.get();
            if (p.owner().kind() == Owner.Kind.OBJECT) {
                current = p;
                continue;
            }
            if (!authority.isInput(parentId)) {
                return invalidChild(child, "root " + parentId + " is not an input of the transaction");
            }
            // the root is not object-owned, so this never recurses into the chain walk
            return authenticate(p, authority);
        }
        return invalidChild(child, "ownership chain deeper than " + limits.maxChainDepth());
    }

    private static AuthDecision senderOwns(Owner.AddressOwner owner, ObjectID id, TransactionAuthority authority) {
        if (owner.address().equals(authority.sender())) {
            return AuthDecision.ALLOWED;
        }
        return AuthDecision.deny(INCORRECT_USER_SIGNATURE,
                id + " is owned by " + owner.address() + ", not " + authority.sender());
    }

    private static AuthDecision invalidChild(LedgerObject child, String why) {
        return AuthDecision.deny(INVALID_CHILD_OBJECT_ARGUMENT, child.id() + ": " + why);
    }
}
