package com.vmcaps.caps;

/**
 * Severity of a {@link ValidationMessage}.
 */
public enum Severity {
    ERROR,
    WARN
}
