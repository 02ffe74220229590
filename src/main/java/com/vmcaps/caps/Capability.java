package com.vmcaps.caps;

import com.vmcaps.compat.CompatLevel;
import com.vmcaps.machine.Machine;

import java.util.Objects;

/**
 * Descriptor of one optional machine capability.
 */
public record Capability(
    int ordinal,                  // position in the registry, 0..N-1
    String name,                  // stable external name, e.g. "htm"
    String description,           // help text for the configuration property
    CompatLevel threshold,        // minimum CPU compatibility to offer the capability
    CapabilityLevel maxLevel,     // highest accepted level, ON for boolean capabilities
    CapabilityApplier applier     // hardware-side apply hook
) {

    public static final String PROPERTY_PREFIX = "cap-";
    public static final String SECTION_PREFIX = "cap/";

    public Capability {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(threshold, "threshold");
        Objects.requireNonNull(maxLevel, "maxLevel");
        Objects.requireNonNull(applier, "applier");
        if (ordinal < 0) {
            throw new IllegalArgumentException("Capability ordinal must not be negative: " + ordinal);
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("Capability name must be non-blank");
        }
        if (maxLevel.isOff()) {
            throw new IllegalArgumentException("Capability '" + name + "' must allow at least one level above off");
        }
    }

    /**
     * Configuration property key, e.g. {@code cap-htm}.
     */
    public String propertyName() {
        return PROPERTY_PREFIX + name;
    }

    /**
     * Migration section name, e.g. {@code cap/htm}.
     */
    public String sectionName() {
        return SECTION_PREFIX + name;
    }

    /**
     * True when the capability only has the levels OFF and ON.
     */
    public boolean isBoolean() {
        return maxLevel.equals(CapabilityLevel.ON);
    }

    public boolean accepts(CapabilityLevel level) {
        return !level.isAbove(maxLevel);
    }

    /**
     * Applies the level through this capability's {@link CapabilityApplier}.
     */
    public void apply(Machine machine, CapabilityLevel level) {
        applier.apply(machine, level);
    }
}
