package com.vmcaps.machine;

import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.caps.CapabilitySet;
import com.vmcaps.caps.StandardCapabilities;

import java.util.Objects;
import java.util.Optional;

/**
 * Machine type: the capability registry it exposes and its baseline defaults.
 */
public record MachineClass(
    String name,
    CapabilityRegistry registry,
    CapabilitySet baseline
) {

    public MachineClass {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(baseline, "baseline");
        if (baseline.size() != registry.size()) {
            throw new IllegalArgumentException(String.format(
                "Baseline for machine class '%s' has %d entries but registry has %d",
                name, baseline.size(), registry.size()));
        }
        for (int i = 0; i < baseline.size(); i++) {
            if (!registry.lookup(i).accepts(baseline.get(i))) {
                throw new IllegalArgumentException(String.format(
                    "Baseline level %s for cap-%s exceeds its maximum",
                    baseline.get(i), registry.lookup(i).name()));
            }
        }
        baseline = baseline.copy();
    }

    /**
     * Gets a copy of the baseline.
     */
    @Override
    public CapabilitySet baseline() {
        return baseline.copy();
    }

    /**
     * Looks up a known machine class by name.
     */
    public static Optional<MachineClass> forName(String name) {
        if ("pseries".equals(name)) {
            return Optional.of(pseries());
        }
        return Optional.empty();
    }

    /**
     * Current pseries machine type with the standard capabilities.
     */
    public static MachineClass pseries() {
        return new MachineClass("pseries", StandardCapabilities.registry(), StandardCapabilities.defaultBaseline());
    }
}
