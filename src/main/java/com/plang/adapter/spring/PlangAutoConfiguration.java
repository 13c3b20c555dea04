package com.plang.adapter.spring;

import com.plang.config.ConfigLoader;
import com.plang.config.PlangConfig;
import com.plang.conflict.PolicyConflict;
import com.plang.service.CompilationResult;
import com.plang.service.PolicyRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring Boot auto-configuration for PLang.
 * Compiles and publishes the configured policy sources at startup; any error fails the context.
 */
@Configuration
@ConditionalOnProperty(prefix = "plang", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PlangProperties.class)
public class PlangAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PlangAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PlangConfig plangConfig(PlangProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyRuntime policyRuntime(PlangConfig config) {
        log.info("Creating PolicyRuntime: {}", config.name());
        PolicyRuntime runtime = new PolicyRuntime(config);
        if (config.policies().isEmpty()) {
            log.warn("No policy sources configured; nothing published");
            return runtime;
        }

        Map<String, String> sources = new LinkedHashMap<>();
        for (String location : config.policies()) {
            sources.put(location, ConfigLoader.readSource(location));
        }

        CompilationResult compilation = runtime.compileAll(sources);
        for (PolicyConflict conflict : compilation.conflicts()) {
            log.info("Policy conflict: {}", conflict);
        }
        runtime.publish(compilation);
        return runtime;
    }
}
