package com.plang.config;

import com.plang.runtime.ExecutionContext;

/**
 * Interpreter settings.
 *
 * @param maxSteps Per-policy instruction budget
 */
public record EngineConfig(int maxSteps) {

    public EngineConfig {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("max-steps must be positive: " + maxSteps);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(ExecutionContext.DEFAULT_MAX_STEPS);
    }
}
