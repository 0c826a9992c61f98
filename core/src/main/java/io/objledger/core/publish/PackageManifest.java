// file: src/main/java/io/objledger/core/publish/PackageManifest.java
package io.objledger.core.publish;

import io.objledger.core.AccountAddress;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Parsed package manifest.
 *
 * @param customProperties {@code [package]} keys beyond the standard ones, as written
 * @param dependencies     dependency name to local path, relative to the package directory
 */
public record PackageManifest(String name, String version, Optional<AccountAddress> publishedAt,
                              SortedMap<String, String> customProperties,
                              SortedMap<String, String> dependencies,
                              SortedMap<String, String> addresses) {
    public PackageManifest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(publishedAt, "publishedAt");
        customProperties = unmodifiable(customProperties);
        dependencies = unmodifiable(dependencies);
        addresses = unmodifiable(addresses);
    }

    private static SortedMap<String, String> unmodifiable(Map<String, String> m) {
        return Collections.unmodifiableSortedMap(new TreeMap<>(m));
    }
}
