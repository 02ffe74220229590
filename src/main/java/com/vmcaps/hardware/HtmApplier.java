package com.vmcaps.hardware;

import com.vmcaps.caps.CapabilityApplier;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.ConfigurationRejectedException;
import com.vmcaps.machine.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hardware Transactional Memory. Needs a KVM host with HTM and a guest CPU model that implements it;
 * software emulation has none.
 */
public class HtmApplier implements CapabilityApplier {

    private static final Logger LOGGER = LoggerFactory.getLogger(HtmApplier.class);

    @Override
    public void apply(Machine machine, CapabilityLevel level) {
        if (level.isOff()) {
            // TODO: fence HTM off on the guest CPU once the backends can disable it
            return;
        }

        ExecutionBackend backend = machine.getBackend();
        if (backend.kind() == ExecutionBackend.Kind.TCG) {
            throw new ConfigurationRejectedException("htm", level,
                "No Transactional Memory support in TCG, try cap-htm=off");
        }
        if (!backend.supportsTransactionalMemory()) {
            throw new ConfigurationRejectedException("htm", level,
                "KVM implementation does not support Transactional Memory, try cap-htm=off");
        }
        if (!machine.getCpu().has(InstructionFeature.HTM)) {
            throw new ConfigurationRejectedException("htm", level,
                "CPU model " + machine.getCpu().name() + " has no Transactional Memory, try cap-htm=off");
        }
        LOGGER.debug("Machine {} runs with transactional memory", machine.getId());
    }
}
