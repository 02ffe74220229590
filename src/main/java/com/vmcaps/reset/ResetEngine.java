package com.vmcaps.reset;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.CapabilitySet;
import com.vmcaps.caps.ConfigurationRejectedException;
import com.vmcaps.defaults.DefaultResolver;
import com.vmcaps.lifecycle.MachinePhase;
import com.vmcaps.lifecycle.PhaseController;
import com.vmcaps.machine.Machine;
import com.vmcaps.machine.MachineCapabilityState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges overrides and defaults into the effective set and applies it to the hardware.
 *
 * Runs before the guest is scheduled. Repeating a reset with unchanged overrides and
 * CPU compatibility produces the same effective set and repeats only idempotent
 * {@code apply} calls.
 */
public class ResetEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResetEngine.class);

    private final DefaultResolver defaultResolver;

    public ResetEngine(DefaultResolver defaultResolver) {
        this.defaultResolver = defaultResolver;
    }

    /**
     * Resets the machine's capabilities.
     *
     * <ol>
     *   <li>Recompute the default set.</li>
     *   <li>Copy defaults into the effective set for every capability without an override.</li>
     *   <li>Apply every effective level in registry order.</li>
     * </ol>
     *
     * @param machine the machine to reset
     * @throws ConfigurationRejectedException if the backend cannot provide an effective level;
     *         machine construction must abort and the machine stays out of RUNNING
     */
    public void reset(Machine machine) {
        PhaseController phases = machine.getPhaseController();
        if (phases.isPhase(MachinePhase.CONFIGURATION)) {
            phases.advanceTo(MachinePhase.RESET);
        }

        MachineCapabilityState state = machine.getCapabilityState();
        CapabilitySet defaults = defaultResolver.computeDefaults(machine);
        state.setDefaults(defaults);

        for (Capability capability : machine.getRegistry()) {
            int i = capability.ordinal();
            if (!state.isOverridden(i)) {
                state.setEffective(i, defaults.get(i));
            }
        }

        for (Capability capability : machine.getRegistry()) {
            CapabilityLevel level = state.getEffective(capability.ordinal());
            try {
                capability.apply(machine, level);
            } catch (ConfigurationRejectedException e) {
                LOGGER.error("Machine {} cannot run with cap-{}={}: {}",
                    machine.getId(), capability.name(), level, e.getMessage());
                throw e;
            }
            LOGGER.debug("Machine {} applied cap-{}={}", machine.getId(), capability.name(), level);
        }

        if (phases.isPhase(MachinePhase.RESET)) {
            phases.advanceTo(MachinePhase.RUNNING);
        }
        LOGGER.info("Machine {} capabilities reset: effective {} (defaults {}, compat {})",
            machine.getId(), state.getEffective(), defaults, machine.compatLevel());
    }
}
