package io.objledger.core.publish;

import io.objledger.core.AccountAddress;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ManifestParserTest {

    @Test
    void parses_package_dependencies_and_addresses() {
        var m = ManifestParser.parse("""
                [package]
                name = "Examples"
                version = "0.0.1"
                published-at = "0x777"
                license = "Apache-2.0"

                [dependencies]
                Sui = { local = "../../sui-framework" }

                [addresses]
                examples = "0x0"
                """);
        assertEquals("Examples", m.name());
        assertEquals("0.0.1", m.version());
        assertEquals(Optional.of(AccountAddress.fromHex("0x777")), m.publishedAt());
        assertEquals(Map.of("published-at", "0x777"), m.customProperties());
        assertEquals(Map.of("Sui", "../../sui-framework"), m.dependencies());
        assertEquals(Map.of("examples", "0x0"), m.addresses());
    }

    @Test
    void published_at_is_optional() {
        var m = ManifestParser.parse("[package]\nname = \"A\"\n");
        assertTrue(m.publishedAt().isEmpty());
        assertTrue(m.dependencies().isEmpty());
        assertEquals("0.0.0", m.version());
    }

    @Test
    void malformed_manifests_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ManifestParser.parse("name = \"A\""));
        assertThrows(IllegalArgumentException.class, () -> ManifestParser.parse("[package\nname="));
        assertThrows(IllegalArgumentException.class,
                () -> ManifestParser.parse("[package]\nname = \"A\"\n[dependencies]\nB = \"1.0\"\n"));
        assertThrows(IllegalArgumentException.class,
                () -> ManifestParser.parse("[package]\nname = \"A\"\npublished-at = \"not-hex\"\n"));
    }
}
