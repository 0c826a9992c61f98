// file: src/main/java/io/objledger/core/object/PackageData.java
package io.objledger.core.object;

import io.objledger.core.bcs.BcsReader;
import io.objledger.core.bcs.BcsWriter;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/** Published package: module name to serialized module, sorted by name. */
public record PackageData(SortedMap<String, byte[]> modules) implements ObjectData {
    public PackageData {
        TreeMap<String, byte[]> copy = new TreeMap<>();
        for (Map.Entry<String, byte[]> e : modules.entrySet()) {
            copy.put(e.getKey(), e.getValue().clone());
        }
        modules = Collections.unmodifiableSortedMap(copy);
    }

    public Optional<byte[]> module(String name) {
        byte[] b = modules.get(name);
        return b == null ? Optional.empty() : Optional.of(b.clone());
    }

    @Override
    public int sizeInBytes() {
        int n = 0;
        for (byte[] b : modules.values()) n += b.length;
        return n;
    }

    void encodeBody(BcsWriter w) {
        w.writeVector(modules.entrySet(), (ww, e) -> {
            ww.writeString(e.getKey());
            ww.writeBytes(e.getValue());
        });
    }

    static PackageData decodeBody(BcsReader r) {
        TreeMap<String, byte[]> m = new TreeMap<>();
        int n = r.readLength();
        for (int i = 0; i < n; i++) {
            m.put(r.readString(), r.readBytes());
        }
        return new PackageData(m);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof PackageData other)) return false;
        if (!modules.keySet().equals(other.modules.keySet())) return false;
        for (Map.Entry<String, byte[]> e : modules.entrySet()) {
            if (!Arrays.equals(e.getValue(), other.modules.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (Map.Entry<String, byte[]> e : modules.entrySet()) {
            h = 31 * h + e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return "PackageData" + modules.keySet();
    }
}
