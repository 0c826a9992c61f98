// file: server/src/main/java/io/objledger/server/StorePackageResolver.java
package io.objledger.server;

import io.objledger.core.ObjectID;
import io.objledger.core.args.PackageResolver;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.object.LedgerObject;
import io.objledger.core.object.PackageData;
import io.objledger.core.publish.ModuleCodec;
import io.objledger.core.publish.ModuleDescriptor;
import io.objledger.storage.ObjectStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves packages from the object store. Packages are immutable, so a
 * decoded package is cached for the life of the process.
 */
final class StorePackageResolver implements PackageResolver {
    private final ObjectStore store;
    private final Map<ObjectID, ResolvedPackage> cache = new ConcurrentHashMap<>();

    StorePackageResolver(ObjectStore store) {
        this.store = store;
    }

    @Override
    public Optional<ResolvedPackage> resolve(ObjectID packageId) {
        ResolvedPackage cached = cache.get(packageId);
        if (cached != null) return Optional.of(cached);
        Optional<LedgerObject> o = store.getObject(packageId).filter(LedgerObject::isPackage);
        if (o.isEmpty()) return Optional.empty();
        ResolvedPackage p = decode(packageId, (PackageData) o.get().data());
        cache.putIfAbsent(packageId, p);
        return Optional.of(p);
    }

    private static ResolvedPackage decode(ObjectID id, PackageData data) {
        Map<String, ModuleDescriptor> modules = new HashMap<>();
        for (String name : data.modules().keySet()) {
            try {
                modules.put(name, ModuleCodec.decode(data.module(name).orElseThrow()));
            } catch (BcsException e) {
                // only verified modules are ever stored
                throw new IllegalStateException("stored package " + id + " has an undecodable module " + name, e);
            }
        }
        return new ResolvedPackage(id, modules);
    }
}
