package com.vmcaps.caps;

/**
 * Thrown when attempting to register after the registry is frozen.
 */
public class RegistryFrozenException extends CapabilityException {

    public RegistryFrozenException() {
        super("Capability registry is frozen - no further registrations allowed");
    }
}
