// file: src/main/java/io/objledger/core/ownership/TransactionAuthority.java
package io.objledger.core.ownership;

import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;

import java.util.Objects;
import java.util.Set;

/**
 * What a transaction can prove: who signed it and which objects it names
 * as inputs (gas included).
 */
public record TransactionAuthority(AccountAddress sender, Set<ObjectID> inputObjects) {
    public TransactionAuthority {
        Objects.requireNonNull(sender, "sender");
        inputObjects = Set.copyOf(inputObjects);
    }

    public boolean isInput(ObjectID id) {
        return inputObjects.contains(id);
    }
}
