package com.plang.config;

import java.util.List;

/**
 * Root configuration for the policy runtime.
 *
 * @param name       Deployment name
 * @param version    Configuration version
 * @param engine     Interpreter settings
 * @param resolver   Conflict resolver settings
 * @param activation Publishing rules
 * @param policies   Locations of policy source files, loaded in order
 */
public record PlangConfig(
        String name,
        String version,
        EngineConfig engine,
        ResolverConfig resolver,
        ActivationConfig activation,
        List<String> policies
) {
    public PlangConfig {
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    /**
     * Defaults with no policy sources.
     */
    public static PlangConfig defaults() {
        return new PlangConfig("default", "1.0", EngineConfig.defaults(), ResolverConfig.defaults(),
                ActivationConfig.defaults(), List.of());
    }
}
