// file: src/main/java/io/objledger/core/ExecutionLimits.java
package io.objledger.core;

import io.objledger.core.ownership.ChildInputPolicy;

import java.util.Objects;

/**
 * Library-level bounds applied while authorizing and reducing one transaction.
 *
 * @param maxChainDepth     longest parent chain followed when authorizing a child object
 * @param maxCascadeObjects most objects a single deletion may cascade to
 * @param childInputPolicy  whether object-owned children may be passed as inputs
 */
public record ExecutionLimits(int maxChainDepth, int maxCascadeObjects, ChildInputPolicy childInputPolicy) {
    public static final ExecutionLimits DEFAULT = new ExecutionLimits(64, 10_000, ChildInputPolicy.THROUGH_PARENT);

    public ExecutionLimits {
        if (maxChainDepth < 1) throw new IllegalArgumentException("maxChainDepth must be >= 1");
        if (maxCascadeObjects < 1) throw new IllegalArgumentException("maxCascadeObjects must be >= 1");
        Objects.requireNonNull(childInputPolicy, "childInputPolicy");
    }

    public ExecutionLimits withChildInputPolicy(ChildInputPolicy policy) {
        return new ExecutionLimits(maxChainDepth, maxCascadeObjects, policy);
    }
}
