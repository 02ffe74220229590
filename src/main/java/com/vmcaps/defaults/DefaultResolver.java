package com.vmcaps.defaults;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.caps.CapabilitySet;
import com.vmcaps.compat.CompatLevel;
import com.vmcaps.machine.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes default capability levels from a machine-class baseline and the guest CPU's
 * compatibility level.
 *
 * A capability whose threshold the compatibility level does not reach is forced off;
 * every other capability keeps its baseline level. The result never exceeds the baseline.
 * Pure function of its inputs.
 */
public class DefaultResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultResolver.class);

    private final CapabilityRegistry registry;

    public DefaultResolver(CapabilityRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Computes defaults from an explicit baseline and compatibility level.
     *
     * @param baseline machine-class baseline, one entry per registered capability
     * @param compat the guest CPU's compatibility level
     * @return a new set; the baseline is not modified
     */
    public CapabilitySet computeDefaults(CapabilitySet baseline, CompatLevel compat) {
        Objects.requireNonNull(baseline, "baseline");
        Objects.requireNonNull(compat, "compat");
        if (baseline.size() != registry.size()) {
            throw new IllegalArgumentException(
                "Baseline has " + baseline.size() + " entries, registry has " + registry.size());
        }

        CapabilitySet result = baseline.copy();
        for (Capability capability : registry) {
            if (compat.isBelow(capability.threshold())) {
                if (!baseline.get(capability.ordinal()).isOff()) {
                    LOGGER.debug("cap-{} forced off: compatibility {} is below {}",
                        capability.name(), compat, capability.threshold());
                }
                result.set(capability.ordinal(), CapabilityLevel.OFF);
            }
        }
        return result;
    }

    /**
     * Computes defaults for a machine from its class baseline and its CPU's current
     * compatibility level.
     */
    public CapabilitySet computeDefaults(Machine machine) {
        return computeDefaults(machine.getMachineClass().baseline(), machine.compatLevel());
    }
}
