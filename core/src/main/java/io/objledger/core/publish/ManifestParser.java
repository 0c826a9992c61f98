// file: src/main/java/io/objledger/core/publish/ManifestParser.java
package io.objledger.core.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.objledger.core.AccountAddress;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads {@code Move.toml} package manifests.
 * <p>
 * Recognised layout:
 * <pre>
 * [package]
 * name = "Examples"
 * version = "0.0.1"
 * published-at = "0x777"      # optional, any other key is a custom property
 *
 * [dependencies]
 * Sui = { local = "../sui-framework" }
 *
 * [addresses]
 * examples = "0x0"
 * </pre>
 */
public final class ManifestParser {
    public static final String MANIFEST_FILE = "Move.toml";
    public static final String PUBLISHED_AT = "published-at";

    private static final Set<String> STANDARD_KEYS = Set.of("name", "version", "authors", "license", "edition");
    private static final TomlMapper MAPPER = new TomlMapper();

    private ManifestParser() {}

    public static PackageManifest parseFile(Path packageDir) {
        Path file = packageDir.resolve(MANIFEST_FILE);
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read manifest " + file, e);
        }
    }

    /** @throws IllegalArgumentException for malformed manifests */
    public static PackageManifest parse(String toml) {
        JsonNode root;
        try {
            root = MAPPER.readTree(toml);
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid manifest TOML: " + e.getMessage(), e);
        }
        JsonNode pkg = root.path("package");
        if (!pkg.isObject()) throw new IllegalArgumentException("manifest has no [package] section");
        String name = pkg.path("name").asText(null);
        if (name == null || name.isBlank()) throw new IllegalArgumentException("[package] name is required");
        String version = pkg.path("version").asText("0.0.0");

        TreeMap<String, String> custom = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = pkg.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!STANDARD_KEYS.contains(f.getKey())) {
                custom.put(f.getKey(), f.getValue().isValueNode() ? f.getValue().asText() : f.getValue().toString());
            }
        }
        Optional<AccountAddress> publishedAt = Optional.empty();
        if (custom.containsKey(PUBLISHED_AT)) {
            try {
                publishedAt = Optional.of(AccountAddress.fromHex(custom.get(PUBLISHED_AT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid published-at in " + name + ": " + custom.get(PUBLISHED_AT), e);
            }
        }

        TreeMap<String, String> deps = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> depFields = root.path("dependencies").fields();
        while (depFields.hasNext()) {
            Map.Entry<String, JsonNode> d = depFields.next();
            JsonNode local = d.getValue().path("local");
            if (!local.isTextual()) {
                throw new IllegalArgumentException("dependency " + d.getKey() + " must be { local = \"path\" }");
            }
            deps.put(d.getKey(), local.asText());
        }

        TreeMap<String, String> addresses = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> addrFields = root.path("addresses").fields();
        while (addrFields.hasNext()) {
            Map.Entry<String, JsonNode> a = addrFields.next();
            addresses.put(a.getKey(), a.getValue().asText());
        }
        return new PackageManifest(name, version, publishedAt, custom, deps, addresses);
    }
}
