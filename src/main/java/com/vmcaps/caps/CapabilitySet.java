package com.vmcaps.caps;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size mapping from capability ordinal to {@link CapabilityLevel}.
 *
 * Every slot holds a level; a fresh set has every capability {@link CapabilityLevel#OFF}.
 * Sets are mutable and owned by a single machine, so callers hand out copies
 * whenever a set crosses an ownership boundary.
 */
public final class CapabilitySet {

    private final CapabilityLevel[] levels;

    public CapabilitySet(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Capability set size must not be negative: " + size);
        }
        this.levels = new CapabilityLevel[size];
        Arrays.fill(levels, CapabilityLevel.OFF);
    }

    private CapabilitySet(CapabilityLevel[] levels) {
        this.levels = levels;
    }

    /**
     * Creates a set holding the given levels in ordinal order.
     */
    public static CapabilitySet of(CapabilityLevel... levels) {
        CapabilityLevel[] copy = levels.clone();
        for (int i = 0; i < copy.length; i++) {
            Objects.requireNonNull(copy[i], "level for ordinal " + i);
        }
        return new CapabilitySet(copy);
    }

    public int size() {
        return levels.length;
    }

    public CapabilityLevel get(int ordinal) {
        return levels[Objects.checkIndex(ordinal, levels.length)];
    }

    public void set(int ordinal, CapabilityLevel level) {
        Objects.requireNonNull(level, "level");
        levels[Objects.checkIndex(ordinal, levels.length)] = level;
    }

    public CapabilitySet copy() {
        return new CapabilitySet(levels.clone());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(levels, ((CapabilitySet) obj).levels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(levels);
    }

    @Override
    public String toString() {
        return Arrays.toString(levels);
    }
}
