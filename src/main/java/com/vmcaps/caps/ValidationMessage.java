package com.vmcaps.caps;

/**
 * A validation message with severity and details.
 */
public record ValidationMessage(
    Severity severity,   // ERROR/WARN/INFO
    String code,         // e.g. "CAPABILITY_UPGRADE"
    String message,      // human-readable
    String capability    // capability name, optional
) {}
