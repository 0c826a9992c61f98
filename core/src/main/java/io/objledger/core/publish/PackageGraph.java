// file: src/main/java/io/objledger/core/publish/PackageGraph.java
package io.objledger.core.publish;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * A root package and everything it depends on, keyed by package name.
 * <p>
 * Invariants:
 *  - every dependency named by a node is itself a node,
 *  - the dependency relation is acyclic.
 */
public final class PackageGraph {

    /** One package: its manifest, where it lives and its compiled module blobs. */
    public record PackageNode(PackageManifest manifest, Path directory, List<byte[]> modules) {
        public PackageNode {
            Objects.requireNonNull(manifest, "manifest");
            Objects.requireNonNull(directory, "directory");
            List<byte[]> copy = new ArrayList<>(modules.size());
            for (byte[] m : modules) copy.add(m.clone());
            modules = List.copyOf(copy);
        }

        public String name() {
            return manifest.name();
        }
    }

    private final String rootName;
    private final Map<String, PackageNode> nodes;

    public PackageGraph(String rootName, Map<String, PackageNode> nodes) {
        this.rootName = Objects.requireNonNull(rootName, "rootName");
        this.nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
        if (!this.nodes.containsKey(rootName)) {
            throw new IllegalArgumentException("root package " + rootName + " not in graph");
        }
        for (PackageNode n : this.nodes.values()) {
            for (String dep : n.manifest().dependencies().keySet()) {
                if (!this.nodes.containsKey(dep)) {
                    throw new IllegalArgumentException(n.name() + " depends on unknown package " + dep);
                }
            }
        }
        checkAcyclic();
    }

    public PackageNode root() {
        return nodes.get(rootName);
    }

    /** Every package reachable from the root, excluding the root, sorted by name. */
    public List<PackageNode> transitiveDependencies() {
        Set<String> seen = new HashSet<>();
        List<String> stack = new ArrayList<>(root().manifest().dependencies().keySet());
        while (!stack.isEmpty()) {
            String name = stack.remove(stack.size() - 1);
            if (!seen.add(name)) continue;
            stack.addAll(nodes.get(name).manifest().dependencies().keySet());
        }
        seen.remove(rootName);
        List<PackageNode> out = new ArrayList<>();
        for (String name : new TreeMap<>(nodes).keySet()) {
            if (seen.contains(name)) out.add(nodes.get(name));
        }
        return out;
    }

    private void checkAcyclic() {
        Set<String> done = new HashSet<>();
        for (String name : nodes.keySet()) {
            visit(name, new HashSet<>(), done);
        }
    }

    private void visit(String name, Set<String> path, Set<String> done) {
        if (done.contains(name)) return;
        if (!path.add(name)) {
            throw new IllegalArgumentException("dependency cycle through " + name);
        }
        for (String dep : nodes.get(name).manifest().dependencies().keySet()) {
            visit(dep, path, done);
        }
        path.remove(name);
        done.add(name);
    }
}
