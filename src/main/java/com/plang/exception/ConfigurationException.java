package com.plang.exception;

/**
 * Exception thrown when configuration or a policy source cannot be loaded,
 * or when a compiled policy set is refused for activation.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PlangException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
