package com.plang.config;

import com.plang.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static PlangConfig parse(String yaml) {
        return ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should load every section from the classpath")
    void shouldLoadFromClasspath() {
        PlangConfig config = ConfigLoader.load("classpath:plang-test.yaml");

        assertEquals("test-governance", config.name());
        assertEquals("2.1", config.version());
        assertEquals(25, config.engine().maxSteps());
        assertEquals(2, config.resolver().signatureLength());
        assertEquals(100, config.activation().blockSeverity());
        assertEquals(List.of("classpath:policies/safety.plang", "classpath:policies/routing.plang"),
                config.policies());
    }

    @Test
    @DisplayName("Missing sections fall back to defaults")
    void shouldApplyDefaults() {
        PlangConfig config = parse("plang:\n  name: bare\n");

        assertEquals("bare", config.name());
        assertEquals(200, config.engine().maxSteps());
        assertEquals(3, config.resolver().signatureLength());
        assertEquals(ActivationConfig.NEVER_BLOCK, config.activation().blockSeverity());
        assertTrue(config.policies().isEmpty());
    }

    @Test
    @DisplayName("Settings may sit at the root without the plang key")
    void shouldAcceptRootLevelSettings() {
        PlangConfig config = parse("name: flat\nengine:\n  max-steps: 9\n");
        assertEquals("flat", config.name());
        assertEquals(9, config.engine().maxSteps());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:plang-invalid.yaml"));
        assertThrows(ConfigurationException.class, () -> parse("plang:\n  engine:\n    max-steps: lots\n"));
        assertThrows(ConfigurationException.class, () -> parse("plang:\n  engine: 5\n"));
        assertThrows(ConfigurationException.class, () -> parse("plang:\n  policies: one.plang\n"));
        assertThrows(ConfigurationException.class, () -> parse(""));
    }

    @ParameterizedTest
    @CsvSource({
            "5000000000",
            "-3000000000",
            "99999999999999999999999",
            "200.7",
            "1e3"
    })
    @DisplayName("Should reject numbers that are not ints")
    void shouldRejectNonIntNumbers(String number) {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> parse("plang:\n  engine:\n    max-steps: " + number + "\n"));
        assertTrue(e.getMessage().contains("max-steps"), e.getMessage());
    }

    @Test
    @DisplayName("Should accept the largest int")
    void shouldAcceptIntBoundary() {
        assertEquals(Integer.MAX_VALUE, parse("plang:\n  engine:\n    max-steps: 2147483647\n").engine().maxSteps());
    }

    @Test
    @DisplayName("Should fail on missing files")
    void shouldFailOnMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.readSource("/no/such/policy.plang"));
    }

    @Test
    @DisplayName("Should read policy sources as text")
    void shouldReadSource() {
        String source = ConfigLoader.readSource("classpath:policies/routing.plang");
        assertTrue(source.contains("policy route_legal: ROUTING"));
    }
}
