package com.vmcaps.migration;

/**
 * Exception thrown when the capability part of a migration stream cannot be read.
 */
public class MigrationStreamException extends Exception {

    public MigrationStreamException(String message) {
        super(message);
    }

    public MigrationStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
