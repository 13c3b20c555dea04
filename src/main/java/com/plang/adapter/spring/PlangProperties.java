package com.plang.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot properties under {@code plang.*}.
 * <p>
 * These only locate the runtime's own YAML file; engine, resolver and activation settings,
 * and the list of policy sources, live in that file.
 */
@ConfigurationProperties(prefix = "plang")
public class PlangProperties {

    /**
     * Set to false to skip compiling and publishing policies at startup.
     */
    private boolean enabled = true;

    /**
     * YAML file with max-steps, signature-length, block-severity and the policy source
     * locations. A {@code classpath:} prefix reads from the classpath, anything else from disk.
     */
    private String configPath = "classpath:plang.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
