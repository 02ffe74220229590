package com.vmcaps.caps;

/**
 * Base exception for all capability handling failures.
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }
}
