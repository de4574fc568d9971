package com.draupnir.policy.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    @DisplayName("Classpath default enables DNS and port checks")
    void testLoadDefault() {
        PolicyRulesConfig config = loader.loadDefault();
        assertTrue(config.isRequireDnsEgress());
        assertTrue(config.isRequireL7Ports());
        assertFalse(config.isForbidWildcardFqdns());
    }

    @Test
    @DisplayName("Rules file overrides defaults and ignores unknown keys")
    void testLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yaml");
        Files.writeString(file, "requireDnsEgress: false\nforbidWildcardFqdns: true\nsomethingElse: 1\n");

        PolicyRulesConfig config = loader.load(file.toString());

        assertFalse(config.isRequireDnsEgress());
        assertTrue(config.isRequireL7Ports());
        assertTrue(config.isForbidWildcardFqdns());
    }

    @Test
    @DisplayName("Missing or broken rules files fall back to built-in defaults")
    void testFallbacks(@TempDir Path dir) throws IOException {
        assertEquals(PolicyRulesConfig.defaults(), loader.load(dir.resolve("missing.yaml").toString()));
        assertEquals(PolicyRulesConfig.defaults(), loader.loadFromFile(dir.toString()));

        Path broken = dir.resolve("broken.yaml");
        Files.writeString(broken, "requireDnsEgress: [not a bool\n");
        assertEquals(PolicyRulesConfig.defaults(), loader.loadFromFile(broken.toString()));

        Path empty = dir.resolve("empty.yaml");
        Files.writeString(empty, "");
        assertEquals(PolicyRulesConfig.defaults(), loader.loadFromFile(empty.toString()));
    }
}
