package com.vmcaps.hardware;

import com.vmcaps.caps.CapabilityApplier;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.ConfigurationRejectedException;
import com.vmcaps.machine.Machine;

/**
 * Vector Scalar Extensions, provided when the CPU model implements VSX.
 */
public class VsxApplier implements CapabilityApplier {

    @Override
    public void apply(Machine machine, CapabilityLevel level) {
        if (level.isOff()) {
            return;
        }

        CpuModel cpu = machine.getCpu();
        // CPU models without Altivec are never accepted as guest CPUs
        if (!cpu.has(InstructionFeature.ALTIVEC)) {
            throw new IllegalStateException("CPU model " + cpu.name() + " lacks Altivec");
        }
        if (!cpu.has(InstructionFeature.VSX)) {
            throw new ConfigurationRejectedException("vsx", level,
                "VSX support not available, try cap-vsx=off");
        }
    }
}
