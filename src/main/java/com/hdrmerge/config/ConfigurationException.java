package com.hdrmerge.config;

/**
 * A required external tool is not configured or cannot be used. Raised before any worker starts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
