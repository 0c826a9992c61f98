// file: src/main/java/io/objledger/core/gas/GasCostSummary.java
package io.objledger.core.gas;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

/** Gas charged to one transaction, already multiplied by the gas price. */
public record GasCostSummary(long computationCost, long storageCost) {
    public static final GasCostSummary ZERO = new GasCostSummary(0, 0);

    public GasCostSummary {
        if (computationCost < 0 || storageCost < 0) throw new IllegalArgumentException("negative gas cost");
    }

    public long total() {
        return computationCost + storageCost;
    }

    public void encode(BcsWriter w) {
        w.writeU64(computationCost);
        w.writeU64(storageCost);
    }

    public static GasCostSummary decode(BcsReader r) {
        return new GasCostSummary(r.readU64(), r.readU64());
    }
}
