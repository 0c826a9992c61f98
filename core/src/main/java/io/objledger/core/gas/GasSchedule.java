// file: src/main/java/io/objledger/core/gas/GasSchedule.java
package io.objledger.core.gas;

/**
 * Gas units charged per transaction. Units are multiplied by the
 * transaction's gas price to get the amount taken from the gas coin.
 *
 * @param minBudget        smallest accepted budget (in gas coin units)
 * @param baseComputation  units every transaction pays
 * @param perCommand       units per executed command
 * @param perStorageByte   units per byte of object content written
 */
public record GasSchedule(long minBudget, long baseComputation, long perCommand, long perStorageByte) {
    public static final GasSchedule DEFAULT = new GasSchedule(1_000, 100, 10, 1);

    public GasSchedule {
        if (minBudget < 0 || baseComputation < 0 || perCommand < 0 || perStorageByte < 0) {
            throw new IllegalArgumentException("gas schedule values must be >= 0");
        }
    }

    public long computationCost(int executedCommands, long gasPrice) {
        return Math.multiplyExact(Math.addExact(baseComputation, Math.multiplyExact(perCommand, executedCommands)), gasPrice);
    }

    public long storageCost(long writtenBytes, long gasPrice) {
        return Math.multiplyExact(Math.multiplyExact(perStorageByte, writtenBytes), gasPrice);
    }
}
