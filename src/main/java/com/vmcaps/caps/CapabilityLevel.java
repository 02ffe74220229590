package com.vmcaps.caps;

/**
 * Level requested for, or granted to, a single capability.
 *
 * Levels are small unsigned values ordered numerically. {@link #OFF} is always the
 * lowest level; boolean capabilities only use {@link #OFF} and {@link #ON}, but any
 * value up to {@link #MAX_VALUE} is representable so multi-level capabilities need
 * no change here.
 */
public record CapabilityLevel(int value) implements Comparable<CapabilityLevel> {

    /** Largest value that fits the one-byte migration encoding. */
    public static final int MAX_VALUE = 0xFF;

    public static final CapabilityLevel OFF = new CapabilityLevel(0);
    public static final CapabilityLevel ON = new CapabilityLevel(1);

    public CapabilityLevel {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                "Capability level out of range: " + value + " (expected 0.." + MAX_VALUE + ")");
        }
    }

    /**
     * Returns the level with the given numeric value.
     *
     * @param value numeric level, 0..255
     * @return the level
     * @throws IllegalArgumentException if value is out of range
     */
    public static CapabilityLevel of(int value) {
        if (value == 0) return OFF;
        if (value == 1) return ON;
        return new CapabilityLevel(value);
    }

    /**
     * Maps a boolean property value onto {@link #ON} or {@link #OFF}.
     */
    public static CapabilityLevel of(boolean enabled) {
        return enabled ? ON : OFF;
    }

    public boolean isOff() {
        return value == 0;
    }

    public boolean isAbove(CapabilityLevel other) {
        return compareTo(other) > 0;
    }

    public boolean isBelow(CapabilityLevel other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(CapabilityLevel other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
