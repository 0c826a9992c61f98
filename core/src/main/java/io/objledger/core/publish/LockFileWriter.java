// file: src/main/java/io/objledger/core/publish/LockFileWriter.java
package io.objledger.core.publish;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Renders the {@code Move.lock} file for a package graph. Output depends only
 * on the graph, so the same graph always yields byte-identical text.
 */
public final class LockFileWriter {
    static final String HEADER = "# @generated by Move, please check-in and do not edit manually.\n";
    static final int LOCK_VERSION = 0;

    private LockFileWriter() {}

    public static String render(PackageGraph graph) {
        PackageGraph.PackageNode root = graph.root();
        StringBuilder sb = new StringBuilder(HEADER)
                .append('\n')
                .append("[move]\n")
                .append("version = ").append(LOCK_VERSION).append('\n');
        appendDependencies(sb, root.manifest().dependencies().keySet());
        for (PackageGraph.PackageNode dep : graph.transitiveDependencies()) {
            sb.append('\n')
              .append("[[move.package]]\n")
              .append("name = \"").append(dep.name()).append("\"\n")
              .append("source = { local = \"").append(relativeSource(root, dep)).append("\" }\n");
            appendDependencies(sb, dep.manifest().dependencies().keySet());
        }
        return sb.toString();
    }

    public static void write(PackageGraph graph, Path lockFile) {
        try {
            Files.writeString(lockFile, render(graph));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write lock file " + lockFile, e);
        }
    }

    private static void appendDependencies(StringBuilder sb, Collection<String> names) {
        if (names.isEmpty()) return;
        sb.append('\n').append("dependencies = [\n");
        for (String n : names) {
            sb.append("  { name = \"").append(n).append("\" },\n");
        }
        sb.append("]\n");
    }

    private static String relativeSource(PackageGraph.PackageNode root, PackageGraph.PackageNode dep) {
        Path rel = root.directory().relativize(dep.directory());
        return rel.toString().replace('\\', '/');
    }
}
