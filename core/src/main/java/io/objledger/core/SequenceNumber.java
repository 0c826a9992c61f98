// file: src/main/java/io/objledger/core/SequenceNumber.java
package io.objledger.core;

import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Collection;

/**
 * Per-object logical version.
 * <p>
 * Invariants:
 *  - values are non-negative and compared as unsigned 64-bit integers,
 *  - {@link #MAX} is reserved and never assigned to a live object.
 */
public record SequenceNumber(long value) implements Comparable<SequenceNumber> {
    public static final SequenceNumber MIN = new SequenceNumber(0);
    public static final SequenceNumber MAX = new SequenceNumber(Long.MAX_VALUE);

    public SequenceNumber {
        if (value < 0) throw new IllegalArgumentException("version must be >= 0: " + value);
    }

    public static SequenceNumber of(long value) {
        return new SequenceNumber(value);
    }

    /**
     * Lamport increment: 1 + max(inputs).
     *
     * @throws IllegalArgumentException if {@code inputs} is empty
     * @throws IllegalStateException if the result would reach {@link #MAX}
     */
    public static SequenceNumber lamportIncrement(Collection<SequenceNumber> inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("lamport increment needs at least one input version");
        }
        SequenceNumber max = MIN;
        for (SequenceNumber s : inputs) {
            if (s.compareTo(max) > 0) max = s;
        }
        return max.next();
    }

    public SequenceNumber next() {
        if (value + 1 >= MAX.value) {
            throw new IllegalStateException("version space exhausted at " + value);
        }
        return new SequenceNumber(value + 1);
    }

    public void encode(BcsWriter w) {
        w.writeU64(value);
    }

    public static SequenceNumber decode(BcsReader r) {
        long v = r.readU64();
        if (v < 0) throw new BcsException("version out of range");
        return new SequenceNumber(v);
    }

    @Override
    public int compareTo(SequenceNumber o) {
        return Long.compare(value, o.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
