package com.vmcaps.config;

/**
 * Exception thrown when a machine configuration file cannot be read.
 */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
