package com.vmcaps.compat;

import com.vmcaps.hardware.CpuModel;

/**
 * Answers which compatibility level a guest CPU runs at.
 */
@FunctionalInterface
public interface CpuCompatibility {

    /**
     * Returns the compatibility level of the CPU under the given ceiling.
     *
     * @param cpu the guest CPU model
     * @param ceiling operator-supplied maximum, or null for no limit
     * @return the effective compatibility level
     */
    CompatLevel compatLevel(CpuModel cpu, CompatLevel ceiling);

    /**
     * The CPU's native level, lowered to the ceiling when one is given.
     */
    static CpuCompatibility capped() {
        return (cpu, ceiling) -> ceiling == null
            ? cpu.nativeCompat()
            : CompatLevel.min(cpu.nativeCompat(), ceiling);
    }
}
