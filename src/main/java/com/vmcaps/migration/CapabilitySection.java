package com.vmcaps.migration;

/**
 * One capability's record in the migration stream: the section name
 * ({@code cap/<name>}), its format version and the level as an unsigned byte.
 */
public record CapabilitySection(
    String name,
    int version,
    int value
) {

    public static final int CURRENT_VERSION = 1;
    public static final int MINIMUM_VERSION = 1;
}
