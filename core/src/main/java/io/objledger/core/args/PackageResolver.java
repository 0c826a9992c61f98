// file: src/main/java/io/objledger/core/args/PackageResolver.java
package io.objledger.core.args;

import io.objledger.core.ObjectID;
import io.objledger.core.publish.ModuleDescriptor;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Looks up published packages by id. */
@FunctionalInterface
public interface PackageResolver {

    Optional<ResolvedPackage> resolve(ObjectID packageId);

    record ResolvedPackage(ObjectID id, Map<String, ModuleDescriptor> modules) {
        public ResolvedPackage {
            Objects.requireNonNull(id, "id");
            modules = Map.copyOf(modules);
        }

        public Optional<ModuleDescriptor> module(String name) {
            return Optional.ofNullable(modules.get(name));
        }
    }
}
