// file: server/src/main/java/io/objledger/server/Genesis.java
package io.objledger.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.objledger.core.AccountAddress;
import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.SequenceNumber;
import io.objledger.core.TransactionDigest;
import io.objledger.core.gas.GasCoin;
import io.objledger.core.gas.GasSchedule;
import io.objledger.core.object.LedgerObject;
import io.objledger.server.dto.GenesisConfig;
import io.objledger.storage.ObjectStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Initial ledger state: gas coins per account and the gas schedule.
 * <p>
 * Genesis object ids are derived from the genesis digest and a running
 * index, so the same file always produces the same objects.
 */
public record Genesis(List<LedgerObject> objects, GasSchedule gasSchedule) {
    private static final Logger log = Logger.getLogger(Genesis.class.getName());

    public static final SequenceNumber GENESIS_VERSION = SequenceNumber.of(1);

    public Genesis {
        objects = List.copyOf(objects);
    }

    /** No objects, default gas schedule. */
    public static Genesis empty() {
        return new Genesis(List.of(), GasSchedule.DEFAULT);
    }

    public static Genesis fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return fromConfig(mapper.readValue(path.toFile(), GenesisConfig.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to load genesis from " + path, e);
        }
    }

    public static Genesis fromConfig(GenesisConfig cfg) {
        List<LedgerObject> objects = new ArrayList<>();
        if (cfg.accounts != null) {
            for (GenesisConfig.Account a : cfg.accounts) {
                if (a.address == null) throw new IllegalArgumentException("genesis account without address");
                AccountAddress owner = AccountAddress.fromHex(a.address);
                List<Long> balances = a.gasBalances == null ? List.of() : a.gasBalances;
                for (Long balance : balances) {
                    if (balance == null || balance < 0) {
                        throw new IllegalArgumentException("invalid gas balance for " + a.address + ": " + balance);
                    }
                    ObjectID id = ObjectID.derive(TransactionDigest.GENESIS, objects.size());
                    objects.add(new LedgerObject(id, GENESIS_VERSION, Owner.address(owner),
                            TransactionDigest.GENESIS, GasCoin.create(id, balance)));
                }
            }
        }
        GasSchedule schedule = GasSchedule.DEFAULT;
        if (cfg.gasSchedule != null) {
            GenesisConfig.GasScheduleConfig g = cfg.gasSchedule;
            schedule = new GasSchedule(g.minBudget, g.baseComputation, g.perCommand, g.perStorageByte);
        }
        return new Genesis(objects, schedule);
    }

    /** Insert every genesis object into an empty store. */
    public void apply(ObjectStore store) {
        for (LedgerObject o : objects) store.insertGenesisObject(o);
        log.info("genesis: inserted " + objects.size() + " objects");
    }
}
