// file: src/main/java/io/objledger/core/publish/PublicationGate.java
package io.objledger.core.publish;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.args.PackageResolver;
import io.objledger.core.bcs.BcsException;
import io.objledger.core.bcs.BcsWriter;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.error.ModulePublishException;
import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;
import io.objledger.core.exec.TemporaryStore;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.object.PackageData;
import io.objledger.core.tx.Command;
import io.objledger.core.types.KnownTypes;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Admission rules for publishing packages.
 * <p>
 * Three entry points, one per stage:
 *  - {@link #checkInput}: before execution, rejects empty publishes,
 *  - {@link #execute}: inside a transaction, verifies the modules and creates
 *    the package object and its upgrade capability,
 *  - {@link #prepare}: on the build side, resolves the dependency graph into
 *    a {@link PublishRequest}.
 */
public final class PublicationGate {
    private static final Logger log = Logger.getLogger(PublicationGate.class.getName());

    /** Version recorded in a fresh upgrade capability. */
    static final long FIRST_PACKAGE_VERSION = 1;

    private PublicationGate() {}

    /** @throws UserInputException {@code EmptyCommandInput} for no modules or only empty blobs */
    public static void checkInput(Command.Publish publish) {
        boolean allEmpty = publish.modules().stream().allMatch(m -> m.length == 0);
        if (allEmpty) {
            throw new UserInputException(UserInputError.Kind.EMPTY_COMMAND_INPUT, "publish without modules");
        }
    }

    /**
     * Verify and store a package. Creates an immutable package object and an
     * {@code UpgradeCap} owned by the sender.
     *
     * @return the new package id
     * @throws ExecutionError {@code VMVerificationOrDeserializationError} for undecodable,
     *         duplicate or ill-formed modules; {@code PackageNotFound} for a missing dependency
     */
    public static ObjectID execute(Command.Publish publish, TemporaryStore store, PackageResolver resolver) {
        Set<ByteBuffer> seenBlobs = new HashSet<>();
        TreeMap<String, byte[]> modules = new TreeMap<>();
        for (byte[] blob : publish.modules()) {
            if (!seenBlobs.add(ByteBuffer.wrap(blob))) {
                throw verification("duplicate module blob");
            }
            ModuleDescriptor module;
            try {
                module = ModuleCodec.decode(blob);
            } catch (BcsException e) {
                throw verification("cannot deserialize module: " + e.getMessage());
            }
            String err = ModuleVerifier.verify(module);
            if (err != null) throw verification(err);
            if (modules.put(module.name(), blob) != null) {
                throw verification("duplicate module name " + module.name());
            }
        }
        for (ObjectID dep : publish.dependencies()) {
            if (resolver.resolve(dep).isEmpty()) {
                throw new ExecutionError(ExecutionFailureStatus.PACKAGE_NOT_FOUND, "dependency " + dep);
            }
        }

        ObjectID packageId = store.freshId();
        store.write(packageId, new PackageData(modules), Owner.IMMUTABLE);
        ObjectID capId = store.freshId();
        store.write(capId, upgradeCap(capId, packageId), Owner.address(store.sender()));
        log.fine(() -> "published " + packageId + " modules=" + modules.keySet());
        return packageId;
    }

    /**
     * Resolve {@code graph} into the modules and dependency ids of one publish.
     * Every transitive dependency must have a published address unless
     * {@code withUnpublishedDependencies} is set, in which case its modules are
     * bundled into the publish.
     *
     * @throws ModulePublishException naming every unpublished dependency
     */
    public static PublishRequest prepare(PackageGraph graph, boolean withUnpublishedDependencies) {
        PackageGraph.PackageNode root = graph.root();
        List<byte[]> modules = new ArrayList<>(root.modules());
        List<ObjectID> deps = new ArrayList<>();
        List<String> bundled = new ArrayList<>();
        List<String> unpublished = new ArrayList<>();
        bundled.add(root.name());
        for (PackageGraph.PackageNode dep : graph.transitiveDependencies()) {
            if (dep.manifest().publishedAt().isPresent()) {
                deps.add(dep.manifest().publishedAt().get().toObjectId());
            } else if (withUnpublishedDependencies) {
                modules.addAll(dep.modules());
                bundled.add(dep.name());
            } else {
                unpublished.add(dep.name());
            }
        }
        if (!unpublished.isEmpty()) {
            throw ModulePublishException.unpublishedDependencies(unpublished);
        }
        return new PublishRequest(root.name(), modules, deps, bundled);
    }

    static MoveObjectData upgradeCap(ObjectID capId, ObjectID packageId) {
        BcsWriter w = new BcsWriter();
        capId.encode(w);
        packageId.encode(w);
        w.writeU64(FIRST_PACKAGE_VERSION);
        w.writeU8(0); // compatible upgrade policy
        return new MoveObjectData(KnownTypes.UPGRADE_CAP, w.toByteArray());
    }

    private static ExecutionError verification(String message) {
        return new ExecutionError(ExecutionFailureStatus.VM_VERIFICATION_OR_DESERIALIZATION_ERROR, message);
    }
}
