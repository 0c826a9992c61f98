package io.objledger.core.publish;

import io.objledger.core.ObjectID;
import io.objledger.core.Owner;
import io.objledger.core.TestPackages;
import io.objledger.core.args.PackageResolver;
import io.objledger.core.effects.ObjectWrite;
import io.objledger.core.error.ExecutionError;
import io.objledger.core.error.ExecutionFailureStatus;
import io.objledger.core.error.ModulePublishException;
import io.objledger.core.error.UserInputError;
import io.objledger.core.error.UserInputException;
import io.objledger.core.exec.ChildObjectLoader;
import io.objledger.core.exec.TemporaryStore;
import io.objledger.core.object.MoveObjectData;
import io.objledger.core.object.PackageData;
import io.objledger.core.tx.Command;
import io.objledger.core.types.KnownTypes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.objledger.core.TestObjects.ALICE;
import static io.objledger.core.TestObjects.PACKAGE;
import static io.objledger.core.TestObjects.digest;
import static io.objledger.core.TestObjects.id;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Publishing verifies every module, stores an immutable package
 * and hands the sender an upgrade capability.
 */
class PublicationGateTest {

    @TempDir Path dir;

    private final TemporaryStore store = new TemporaryStore(digest(7), ALICE, List.of(), ChildObjectLoader.NONE);
    private final byte[] module = ModuleCodec.encode(TestPackages.MODULE);

    private static ExecutionFailureStatus failureOf(Runnable r) {
        return assertThrows(ExecutionError.class, r::run).status();
    }

    @Test
    void publish_stores_package_and_upgrade_cap() {
        ObjectID pkg = PublicationGate.execute(new Command.Publish(List.of(module), List.of(PACKAGE)), store,
                TestPackages.RESOLVER);

        var pkgWrite = (ObjectWrite.Write) store.writes().get(pkg);
        assertEquals(Owner.IMMUTABLE, pkgWrite.owner());
        assertArrayEquals(module, ((PackageData) pkgWrite.data()).module("m").orElseThrow());

        var cap = store.writes().entrySet().stream().filter(e -> !e.getKey().equals(pkg)).findFirst().orElseThrow();
        var capWrite = (ObjectWrite.Write) cap.getValue();
        assertEquals(Owner.address(ALICE), capWrite.owner());
        assertEquals(KnownTypes.UPGRADE_CAP, ((MoveObjectData) capWrite.data()).type());
        assertEquals(2, store.writes().size());
        assertTrue(store.liveDuringTx().contains(pkg));
    }

    @Test
    void bad_modules_fail_verification() {
        assertEquals(ExecutionFailureStatus.VM_VERIFICATION_OR_DESERIALIZATION_ERROR,
                failureOf(() -> PublicationGate.execute(new Command.Publish(List.of(new byte[]{1, 2}), List.of()),
                        store, TestPackages.RESOLVER)));
        assertEquals(ExecutionFailureStatus.VM_VERIFICATION_OR_DESERIALIZATION_ERROR,
                failureOf(() -> PublicationGate.execute(new Command.Publish(List.of(module, module), List.of()),
                        store, TestPackages.RESOLVER)));
        assertTrue(store.writes().isEmpty());
    }

    @Test
    void missing_dependency_is_package_not_found() {
        assertEquals(ExecutionFailureStatus.PACKAGE_NOT_FOUND,
                failureOf(() -> PublicationGate.execute(new Command.Publish(List.of(module), List.of(id(9))),
                        store, TestPackages.RESOLVER)));
    }

    @Test
    void publish_without_module_bytes_is_rejected_up_front() {
        var e = assertThrows(UserInputException.class,
                () -> PublicationGate.checkInput(new Command.Publish(List.of(new byte[0]), List.of())));
        assertEquals(UserInputError.Kind.EMPTY_COMMAND_INPUT, e.kind());
    }

    // ---- preparing a package graph ----

    private void pkg(String name, String extra, String deps) throws Exception {
        Path p = Files.createDirectories(dir.resolve(name.toLowerCase()));
        Files.writeString(p.resolve("Move.toml"),
                "[package]\nname = \"" + name + "\"\nversion = \"0.0.1\"\n" + extra + "\n[dependencies]\n" + deps);
        Path modules = Files.createDirectories(p.resolve("build").resolve(name).resolve("bytecode_modules"));
        ModuleDescriptor own = new ModuleDescriptor(name.toLowerCase(), List.of(),
                List.of(new FunctionDef("run", true, 0, List.of(), List.of())));
        Files.write(modules.resolve(name.toLowerCase() + ".mv"), ModuleCodec.encode(own));
    }

    @Test
    void unpublished_dependency_needs_the_override() throws Exception {
        pkg("Root", "", "Lib = { local = \"../lib\" }\nBase = { local = \"../base\" }\n");
        pkg("Lib", "published-at = \"0x777\"", "Base = { local = \"../base\" }\n");
        pkg("Base", "", "");
        var graph = PackageLoader.load(dir.resolve("root"));

        var e = assertThrows(ModulePublishException.class, () -> PublicationGate.prepare(graph, false));
        assertTrue(e.getMessage().startsWith("Package dependency \"Base\" does not specify a published address"));
        assertTrue(e.getMessage().contains("--with-unpublished-dependencies"));

        var request = PublicationGate.prepare(graph, true);
        assertEquals(List.of(ObjectID.fromHex("0x777")), request.dependencies());
        assertEquals(2, request.modules().size());
        assertEquals(List.of("Root", "Base"), request.bundledPackages());

        var resolver = (PackageResolver) id -> id.equals(ObjectID.fromHex("0x777"))
                ? Optional.of(new PackageResolver.ResolvedPackage(id, Map.of()))
                : Optional.empty();
        ObjectID published = PublicationGate.execute(request.toCommand(), store, resolver);
        var data = (PackageData) ((ObjectWrite.Write) store.writes().get(published)).data();
        assertEquals(List.of("base", "root"), List.copyOf(data.modules().keySet()));
    }

    @Test
    void every_unpublished_dependency_is_named() throws Exception {
        pkg("Root", "", "Alpha = { local = \"../alpha\" }\nBeta = { local = \"../beta\" }\n");
        pkg("Alpha", "", "");
        pkg("Beta", "", "");
        var graph = PackageLoader.load(dir.resolve("root"));

        String message = assertThrows(ModulePublishException.class, () -> PublicationGate.prepare(graph, false))
                .getMessage();
        String[] lines = message.split("\n");
        assertEquals(3, lines.length);
        assertTrue(message.contains("Package dependency \"Alpha\" does not specify a published address"));
        assertTrue(message.contains("Package dependency \"Beta\" does not specify a published address"));
        assertTrue(lines[2].startsWith("If this is intentional"));
    }

    @Test
    void upgrade_cap_holds_its_package() {
        MoveObjectData cap = PublicationGate.upgradeCap(id(1), id(2));
        assertEquals(KnownTypes.UPGRADE_CAP, cap.type());
        assertEquals(32 + 32 + 8 + 1, cap.contents().length);
        assertArrayEquals(id(2).bytes(), Arrays.copyOfRange(cap.contents(), 32, 64));
    }
}
