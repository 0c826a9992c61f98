// file: src/main/java/io/objledger/core/VersionAssigner.java
package io.objledger.core;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Assigns the single lamport version of one transaction and stamps it on
 * every object the transaction writes.
 * <p>
 * Design:
 *  - The version is 1 + max over every causal input (inputs, runtime loads,
 *    touched pre-state, gas), so it is strictly greater than every version
 *    the transaction observed.
 *  - One instance per transaction. Stamping the same id twice, or stamping a
 *    version that does not exceed the id's prior version, is an invariant
 *    violation and throws {@link IllegalStateException}.
 */
public final class VersionAssigner {
    private final SequenceNumber lamport;
    private final Map<ObjectID, SequenceNumber> stamped = new HashMap<>();

    private VersionAssigner(SequenceNumber lamport) {
        this.lamport = lamport;
    }

    /** Computes the lamport version from {@code causalInputs} (must be non-empty). */
    public static VersionAssigner assign(Collection<SequenceNumber> causalInputs) {
        return new VersionAssigner(SequenceNumber.lamportIncrement(causalInputs));
    }

    public SequenceNumber lamportVersion() {
        return lamport;
    }

    /**
     * Record that {@code id} moves from {@code prior} (null when it had no
     * prior version) to the lamport version.
     *
     * @return the lamport version
     */
    public SequenceNumber stamp(ObjectID id, SequenceNumber prior) {
        if (prior != null && lamport.compareTo(prior) <= 0) {
            throw new IllegalStateException(
                    "version collision for " + id + ": prior " + prior + " >= assigned " + lamport);
        }
        SequenceNumber previous = stamped.putIfAbsent(id, lamport);
        if (previous != null) {
            throw new IllegalStateException("object " + id + " stamped twice in one transaction");
        }
        return lamport;
    }

    public Map<ObjectID, SequenceNumber> stamped() {
        return Map.copyOf(stamped);
    }
}
