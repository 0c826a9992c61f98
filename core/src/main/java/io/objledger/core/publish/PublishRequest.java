// file: src/main/java/io/objledger/core/publish/PublishRequest.java
package io.objledger.core.publish;

import io.objledger.core.ObjectID;
import io.objledger.core.tx.Command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Modules and on-chain dependencies ready to go into a {@link Command.Publish}.
 *
 * @param bundledPackages names of packages whose modules are included (root first)
 */
public record PublishRequest(String packageName, List<byte[]> modules, List<ObjectID> dependencies,
                             List<String> bundledPackages) {
    public PublishRequest {
        Objects.requireNonNull(packageName, "packageName");
        List<byte[]> copy = new ArrayList<>(modules.size());
        for (byte[] m : modules) copy.add(m.clone());
        modules = List.copyOf(copy);
        dependencies = List.copyOf(dependencies);
        bundledPackages = List.copyOf(bundledPackages);
    }

    public Command.Publish toCommand() {
        return new Command.Publish(modules, dependencies);
    }
}
