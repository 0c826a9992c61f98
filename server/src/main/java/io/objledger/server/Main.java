// file: server/src/main/java/io/objledger/server/Main.java
package io.objledger.server;

import io.objledger.core.exec.ContractRuntime;
import io.objledger.storage.DurableObjectStore;
import io.objledger.storage.FileCommitLog;

import java.nio.file.Path;
import java.util.ServiceLoader;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a single validator.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Open the durable object store (commit log replay).
 *  - Apply genesis to an empty store.
 *  - Locate a {@link ContractRuntime} through {@link ServiceLoader}.
 *  - Start the HTTP server.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        ValidatorConfig cfg;
        try {
            cfg = ValidatorConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ValidatorConfig.USAGE);
            System.exit(1);
            return;
        }

        // ------ Storage -------
        var commitLog = new FileCommitLog(Path.of(cfg.dataDir()), 64L * 1024 * 1024); // rotate ~64MB
        var store = new DurableObjectStore(commitLog);

        Genesis genesis = cfg.genesisPath() == null ? Genesis.empty() : Genesis.fromJsonFile(Path.of(cfg.genesisPath()));
        if (!store.isInitialized()) {
            if (genesis.objects().isEmpty()) log.warning("starting with an empty ledger: no genesis file given");
            genesis.apply(store);
        }

        // ------ Execution -------
        ContractRuntime runtime = ServiceLoader.load(ContractRuntime.class).findFirst().orElseGet(() -> {
            log.warning("no ContractRuntime found on the class path; every MoveCall will fail");
            return new NoContractRuntime();
        });
        var authority = new AuthorityState(store, runtime, cfg.limits(), genesis.gasSchedule());

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), authority);
        web.start();
        log.info(String.format("Validator listening on http://%s:%d (data dir %s)", "localhost", cfg.httpPort(), cfg.dataDir()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            try {
                store.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "failed to close the commit log", e);
            }
        }));
    }
}
