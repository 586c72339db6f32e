package com.acme.hotdog.router.config;

/**
 * Raised when the configuration document cannot produce a fully valid runtime:
 * malformed YAML, missing required settings, or a rule that fails to compile.
 * The daemon refuses to start on this error.
 */
public final class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
