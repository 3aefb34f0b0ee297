package com.governance.engine.config;

/**
 * Raised when the version manifest or validation schema is missing or malformed.
 * Governance cannot run without a source of truth, so this always aborts the run
 * before any score is produced.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
