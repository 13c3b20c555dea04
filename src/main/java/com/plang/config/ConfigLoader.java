package com.plang.config;

import com.plang.conflict.ConflictResolver;
import com.plang.exception.ConfigurationException;
import com.plang.runtime.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads runtime configuration and policy sources.
 * Paths with a {@code classpath:} prefix are classpath resources, anything else is a file.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load configuration from a path.
     *
     * @param path Path to the YAML file
     * @return Loaded configuration
     * @throws ConfigurationException when the file is missing or invalid
     */
    public static PlangConfig load(String path) {
        log.info("Loading PLang configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Read a policy source file as UTF-8 text.
     *
     * @param location classpath: or file system path
     * @return Source text
     */
    public static String readSource(String location) {
        try {
            Resource resource = getResource(location);
            try (InputStream inputStream = resource.getInputStream()) {
                return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read policy source: " + location, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    static PlangConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Invalid YAML configuration: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The plang section may be at the root or under 'plang'
        Map<String, Object> plang = root.containsKey("plang")
                ? asMap(root.get("plang"), "plang")
                : root;

        String name = getString(plang, "name", "default");
        String version = getString(plang, "version", "1.0");

        Map<String, Object> engineMap = asMap(plang.get("engine"), "engine");
        int maxSteps = getInt(engineMap, "max-steps", ExecutionContext.DEFAULT_MAX_STEPS);
        if (maxSteps < 1) {
            throw new ConfigurationException("engine.max-steps must be positive, got " + maxSteps);
        }

        Map<String, Object> resolverMap = asMap(plang.get("resolver"), "resolver");
        int signatureLength = getInt(resolverMap, "signature-length", ConflictResolver.DEFAULT_SIGNATURE_LENGTH);
        if (signatureLength < 1) {
            throw new ConfigurationException("resolver.signature-length must be positive, got " + signatureLength);
        }

        Map<String, Object> activationMap = asMap(plang.get("activation"), "activation");
        int blockSeverity = getInt(activationMap, "block-severity", ActivationConfig.NEVER_BLOCK);
        if (blockSeverity < 0) {
            throw new ConfigurationException("activation.block-severity must not be negative, got " + blockSeverity);
        }

        List<String> policies = new ArrayList<>();
        Object policyList = plang.get("policies");
        if (policyList instanceof List<?> list) {
            for (Object item : list) {
                policies.add(String.valueOf(item));
            }
        } else if (policyList != null) {
            throw new ConfigurationException("'policies' must be a list of source locations");
        }

        PlangConfig config = new PlangConfig(name, version, new EngineConfig(maxSteps),
                new ResolverConfig(signatureLength), new ActivationConfig(blockSeverity), policies);

        log.info("Loaded PLang configuration: {} v{} with {} policy source(s), max-steps: {}, block-severity: {}",
                name, version, policies.size(), maxSteps, blockSeverity);
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new ConfigurationException("'" + key + "' must be a mapping");
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        if (value instanceof Long || value instanceof BigInteger) {
            BigInteger number = new BigInteger(value.toString());
            if (number.bitLength() > 31) {
                throw new ConfigurationException("'" + key + "' is out of range: " + value);
            }
            return number.intValue();
        }
        if (value instanceof Number) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'");
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }
}
