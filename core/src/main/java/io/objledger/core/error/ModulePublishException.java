// file: src/main/java/io/objledger/core/error/ModulePublishException.java
package io.objledger.core.error;

import java.util.List;

/** A package cannot be prepared for publication as requested. */
public class ModulePublishException extends RuntimeException {
    public ModulePublishException(String message) {
        super(message);
    }

    /**
     * One line per dependency without a published address, followed by the
     * hint about {@code --with-unpublished-dependencies}.
     */
    public static ModulePublishException unpublishedDependencies(List<String> names) {
        StringBuilder msg = new StringBuilder();
        for (String name : names) {
            msg.append("Package dependency \"").append(name)
                    .append("\" does not specify a published address (the Move.toml manifest for \"")
                    .append(name).append("\" does not contain a published-at field).\n");
        }
        msg.append("If this is intentional, you may use the --with-unpublished-dependencies flag to continue "
                + "publishing these dependencies as part of your package (they won't be linked against existing "
                + "packages on-chain).");
        return new ModulePublishException(msg.toString());
    }
}
