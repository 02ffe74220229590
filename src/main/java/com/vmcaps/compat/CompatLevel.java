package com.vmcaps.compat;

import java.util.Objects;

/**
 * CPU compatibility level, e.g. architecture revision "2.06".
 *
 * Only the ordering matters to capability handling: a capability is offered when the
 * guest CPU's compatibility level is at least the capability's declared threshold.
 * Supports major.minor format.
 */
public final class CompatLevel implements Comparable<CompatLevel> {

    private final int major;
    private final int minor;

    private CompatLevel(int major, int minor) {
        this.major = major;
        this.minor = minor;
    }

    public static CompatLevel of(int major, int minor) {
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Compatibility level components must not be negative: " + major + "." + minor);
        }
        return new CompatLevel(major, minor);
    }

    /**
     * Parses a compatibility level string.
     *
     * @param level level string like "2.07"
     * @return CompatLevel instance
     * @throws IllegalArgumentException if format is invalid
     */
    public static CompatLevel parse(String level) {
        Objects.requireNonNull(level, "Compatibility level cannot be null");

        String[] parts = level.trim().split("\\.");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid compatibility level: " + level + " (expected major.minor)");
        }

        try {
            return of(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid compatibility level numbers in: " + level, e);
        }
    }

    @Override
    public int compareTo(CompatLevel other) {
        Objects.requireNonNull(other, "Other compatibility level cannot be null");

        int majorCompare = Integer.compare(this.major, other.major);
        if (majorCompare != 0) return majorCompare;

        return Integer.compare(this.minor, other.minor);
    }

    /**
     * Checks if this level is at least the given threshold.
     *
     * @param threshold minimum required level
     * @return true if this >= threshold
     */
    public boolean isAtLeast(CompatLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    public boolean isBelow(CompatLevel threshold) {
        return compareTo(threshold) < 0;
    }

    /**
     * Returns the lower of two levels.
     */
    public static CompatLevel min(CompatLevel a, CompatLevel b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public String toString() {
        return String.format("%d.%02d", major, minor);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        CompatLevel other = (CompatLevel) obj;
        return major == other.major && minor == other.minor;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor);
    }
}
