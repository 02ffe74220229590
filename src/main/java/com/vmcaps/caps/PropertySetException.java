package com.vmcaps.caps;

/**
 * Exception thrown when a capability property cannot be set.
 *
 * Returned to the configuration caller; never fatal to a running machine.
 */
public class PropertySetException extends Exception {

    private final String propertyName;

    public PropertySetException(String propertyName, String message) {
        super(String.format("Cannot set property '%s': %s", propertyName, message));
        this.propertyName = propertyName;
    }

    public PropertySetException(String propertyName, String message, Throwable cause) {
        super(String.format("Cannot set property '%s': %s", propertyName, message), cause);
        this.propertyName = propertyName;
    }

    public String getPropertyName() {
        return propertyName;
    }
}
