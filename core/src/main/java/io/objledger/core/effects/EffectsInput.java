// file: src/main/java/io/objledger/core/effects/EffectsInput.java
package io.objledger.core.effects;

import io.objledger.core.ObjectID;
import io.objledger.core.ObjectRef;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.gas.GasCostSummary;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the effects reducer needs about one executed transaction.
 *
 * @param causalVersions versions observed that are not in {@code pre} (read-only inputs)
 * @param pre            prior state of every object written, plus candidate cascade descendants
 * @param writes         final state of every object the execution touched
 * @param liveDuringTx   ids that existed independently at some point during execution
 */
public record EffectsInput(
        TransactionDigest transaction,
        ExecutionStatus status,
        ObjectID gasObject,
        Collection<SequenceNumber> causalVersions,
        Map<ObjectID, PriorState> pre,
        Map<ObjectID, ObjectWrite> writes,
        Set<ObjectID> liveDuringTx,
        List<ObjectRef> sharedInputs,
        Set<TransactionDigest> dependencies,
        GasCostSummary gasUsed) {

    public EffectsInput {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(gasObject, "gasObject");
        causalVersions = List.copyOf(causalVersions);
        pre = Map.copyOf(pre);
        writes = Map.copyOf(writes);
        liveDuringTx = Set.copyOf(liveDuringTx);
        sharedInputs = List.copyOf(sharedInputs);
        dependencies = Set.copyOf(dependencies);
        Objects.requireNonNull(gasUsed, "gasUsed");
    }
}
