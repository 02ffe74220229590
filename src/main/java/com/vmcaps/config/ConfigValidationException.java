package com.vmcaps.config;

/**
 * Exception thrown when a machine configuration is well-formed JSON but invalid.
 */
public class ConfigValidationException extends Exception {

    public ConfigValidationException(String message) {
        super(message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
