// file: server/src/main/java/io/objledger/server/ValidatorConfig.java
package io.objledger.server;

import io.objledger.core.ExecutionLimits;
import io.objledger.core.ownership.ChildInputPolicy;

/**
 * Validator configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:        HTTP API port
 *  - dataDir:         directory for commit log segments
 *  - genesisPath:     optional JSON genesis file, applied when the store is empty
 *  - maxChainDepth:   longest object ownership chain walked when authorizing a child input
 *  - childInputs:     whether object-owned inputs are accepted through their parent
 */
public record ValidatorConfig(
        int httpPort,
        String dataDir,
        String genesisPath,
        int maxChainDepth,
        ChildInputPolicy childInputs
) {

    static final String USAGE = """
            Usage: validator [options]

            Options:
              --http-port,       -p   HTTP port (default: 9000)
              --data-dir,        -d   Commit log directory (default: ./data/ledger)
              --genesis,         -g   Path to JSON genesis file (optional)
              --max-chain-depth       Maximum object ownership chain depth (default: 64)
              --child-inputs          through-parent | reject (default: through-parent)
              --help,            -h   Show this help message
            """;

    public ValidatorConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range: " + httpPort);
        if (maxChainDepth <= 0) throw new IllegalArgumentException("max-chain-depth must be > 0");
    }

    /**
     * Very small CLI parser. All flags are optional; defaults suit local dev.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or an invalid number
     */
    public static ValidatorConfig fromArgs(String[] args) {
        int httpPort = 9000;
        String dataDir = "./data/ledger";
        String genesis = null;
        int maxChainDepth = ExecutionLimits.DEFAULT.maxChainDepth();
        ChildInputPolicy childInputs = ExecutionLimits.DEFAULT.childInputPolicy();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();
                case "--http-port", "-p" -> httpPort = parseInt(args, ++i, "http-port");
                case "--data-dir", "-d" -> dataDir = value(args, ++i);
                case "--genesis", "-g" -> genesis = value(args, ++i);
                case "--max-chain-depth" -> maxChainDepth = parseInt(args, ++i, "max-chain-depth");
                case "--child-inputs" -> childInputs = parsePolicy(value(args, ++i));
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new ValidatorConfig(httpPort, dataDir, genesis, maxChainDepth, childInputs);
    }

    public ExecutionLimits limits() {
        return new ExecutionLimits(maxChainDepth, ExecutionLimits.DEFAULT.maxCascadeObjects(), childInputs);
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for option: " + args[i - 1]);
        return args[i];
    }

    private static int parseInt(String[] args, int i, String name) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + v, e);
        }
    }

    private static ChildInputPolicy parsePolicy(String v) {
        return switch (v) {
            case "through-parent" -> ChildInputPolicy.THROUGH_PARENT;
            case "reject" -> ChildInputPolicy.REJECT;
            default -> throw new IllegalArgumentException("Invalid child-inputs: " + v);
        };
    }

    private static void printHelpAndExit() {
        System.out.println(USAGE);
        System.exit(0);
    }
}
