package com.vmcaps.hardware;

import com.vmcaps.caps.CapabilityApplier;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.ConfigurationRejectedException;
import com.vmcaps.machine.Machine;

/**
 * Decimal Floating Point, provided when the CPU model implements DFP.
 */
public class DfpApplier implements CapabilityApplier {

    @Override
    public void apply(Machine machine, CapabilityLevel level) {
        if (level.isOff()) {
            return;
        }
        if (!machine.getCpu().has(InstructionFeature.DFP)) {
            throw new ConfigurationRejectedException("dfp", level,
                "DFP support not available, try cap-dfp=off");
        }
    }
}
