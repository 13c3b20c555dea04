package com.plang.config;

/**
 * Rules for publishing a compiled module.
 *
 * @param blockSeverity Unresolved conflicts at or above this severity block publishing;
 *                      anything above 100 never blocks
 */
public record ActivationConfig(int blockSeverity) {

    public static final int NEVER_BLOCK = 101;

    public static ActivationConfig defaults() {
        return new ActivationConfig(NEVER_BLOCK);
    }

    public boolean blocks(int severity) {
        return severity >= blockSeverity;
    }
}
