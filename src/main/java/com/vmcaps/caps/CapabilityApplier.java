package com.vmcaps.caps;

import com.vmcaps.machine.Machine;

/**
 * Hardware-side hook that configures the emulated machine for one capability.
 *
 * Contract:
 * <ul>
 *   <li>{@link CapabilityLevel#OFF} is always accepted, even where disabling has no real effect.</li>
 *   <li>Any level above OFF must be checked against the active execution backend;
 *       unsupported levels throw {@link ConfigurationRejectedException}.</li>
 *   <li>Calling twice with the same level has no effect beyond the first call.</li>
 * </ul>
 */
@FunctionalInterface
public interface CapabilityApplier {

    /**
     * Applies the level to the machine's virtual hardware.
     *
     * @param machine the machine being reset
     * @param level the effective level for this capability
     * @throws ConfigurationRejectedException if the backend cannot provide the level
     */
    void apply(Machine machine, CapabilityLevel level);

    /**
     * Applier that accepts every level without touching the machine.
     */
    static CapabilityApplier acceptAll() {
        return (machine, level) -> { };
    }
}
