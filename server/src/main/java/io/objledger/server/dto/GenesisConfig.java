// file: server/src/main/java/io/objledger/server/dto/GenesisConfig.java
package io.objledger.server.dto;

import java.util.List;

/**
 * JSON genesis file.
 * Example:
 *   {
 *     "accounts": [
 *       { "address": "0xa11ce", "gasBalances": [1000000, 500000] }
 *     ],
 *     "gasSchedule": { "minBudget": 1000, "baseComputation": 100, "perCommand": 10, "perStorageByte": 1 }
 *   }
 * {@code gasSchedule} is optional.
 */
public class GenesisConfig {
    public List<Account> accounts;
    public GasScheduleConfig gasSchedule;

    public static class Account {
        public String address;
        public List<Long> gasBalances;
    }

    public static class GasScheduleConfig {
        public long minBudget;
        public long baseComputation;
        public long perCommand;
        public long perStorageByte;
    }
}
