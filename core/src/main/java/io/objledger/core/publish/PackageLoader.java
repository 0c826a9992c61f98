// file: src/main/java/io/objledger/core/publish/PackageLoader.java
package io.objledger.core.publish;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads a package directory and its local dependencies into a {@link PackageGraph}.
 * <p>
 * Layout of a package directory:
 * <pre>
 *   Move.toml
 *   build/&lt;name&gt;/bytecode_modules/*.mv   (compiled modules, loaded in file name order)
 * </pre>
 * A package without a build directory has no modules.
 */
public final class PackageLoader {
    private PackageLoader() {}

    public static PackageGraph load(Path rootDir) {
        Path root = rootDir.toAbsolutePath().normalize();
        Map<String, PackageGraph.PackageNode> nodes = new HashMap<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.add(root);
        String rootName = null;
        while (!pending.isEmpty()) {
            Path dir = pending.poll();
            PackageManifest manifest = ManifestParser.parseFile(dir);
            if (rootName == null) rootName = manifest.name();
            PackageGraph.PackageNode existing = nodes.get(manifest.name());
            if (existing != null) {
                if (!existing.directory().equals(dir)) {
                    throw new IllegalArgumentException("package " + manifest.name() + " found in both "
                            + existing.directory() + " and " + dir);
                }
                continue;
            }
            nodes.put(manifest.name(), new PackageGraph.PackageNode(manifest, dir, readModules(dir, manifest.name())));
            for (Map.Entry<String, String> dep : manifest.dependencies().entrySet()) {
                Path depDir = dir.resolve(dep.getValue()).normalize();
                PackageManifest depManifest = ManifestParser.parseFile(depDir);
                if (!depManifest.name().equals(dep.getKey())) {
                    throw new IllegalArgumentException("dependency " + dep.getKey() + " of " + manifest.name()
                            + " resolves to package " + depManifest.name());
                }
                pending.add(depDir);
            }
        }
        return new PackageGraph(rootName, nodes);
    }

    static List<byte[]> readModules(Path packageDir, String name) {
        Path modulesDir = packageDir.resolve("build").resolve(name).resolve("bytecode_modules");
        if (!Files.isDirectory(modulesDir)) return List.of();
        try (Stream<Path> files = Files.list(modulesDir)) {
            List<Path> sorted = files
                    .filter(p -> p.getFileName().toString().endsWith(".mv"))
                    .sorted()
                    .toList();
            List<byte[]> out = new ArrayList<>(sorted.size());
            for (Path p : sorted) out.add(Files.readAllBytes(p));
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read modules from " + modulesDir, e);
        }
    }
}
