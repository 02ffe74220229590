package com.vmcaps.caps;

/**
 * Thrown when the active execution backend cannot honor a requested capability level.
 *
 * Raised from {@link CapabilityApplier#apply} during machine reset. There is no
 * consistent runtime state after this error, so machine construction must abort.
 */
public class ConfigurationRejectedException extends CapabilityException {

    private final String capabilityName;
    private final CapabilityLevel requestedLevel;

    public ConfigurationRejectedException(String capabilityName, CapabilityLevel requestedLevel, String message) {
        super(message);
        this.capabilityName = capabilityName;
        this.requestedLevel = requestedLevel;
    }

    public String getCapabilityName() {
        return capabilityName;
    }

    public CapabilityLevel getRequestedLevel() {
        return requestedLevel;
    }
}
