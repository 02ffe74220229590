package com.vmcaps.lifecycle;

import com.vmcaps.caps.WrongPhaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Phase controller for one machine.
 *
 * Each machine owns its controller; all phase transitions for that machine go through it.
 * Machines are driven from a single thread, so no synchronization is done here.
 */
public class PhaseController {
    private static final Logger LOGGER = LoggerFactory.getLogger(PhaseController.class);

    private final String machineId;
    private MachinePhase currentPhase;
    private Instant phaseTransitionTime;

    public PhaseController(String machineId) {
        this.machineId = machineId;
        this.currentPhase = MachinePhase.CONFIGURATION;
        this.phaseTransitionTime = Instant.now();
        LOGGER.debug("Machine {} starts in CONFIGURATION phase", machineId);
    }

    /**
     * Gets the current phase.
     *
     * @return the current MachinePhase
     */
    public MachinePhase getCurrentPhase() {
        return currentPhase;
    }

    /**
     * Advances to a later phase.
     *
     * @param nextPhase the phase to advance to
     * @throws IllegalStateException if nextPhase is not after the current phase
     */
    public void advanceTo(MachinePhase nextPhase) {
        MachinePhase current = currentPhase;

        if (nextPhase == current) {
            LOGGER.warn("Machine {} attempted to advance to the same phase: {}", machineId, nextPhase);
            return;
        }

        if (!nextPhase.isAfter(current)) {
            String errorMsg = String.format(
                "Invalid phase transition for machine %s: %s -> %s. Phases must advance monotonically.",
                machineId, current, nextPhase
            );
            LOGGER.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        currentPhase = nextPhase;
        phaseTransitionTime = Instant.now();
        LOGGER.info("Machine {} phase transition: {} -> {}", machineId, current, nextPhase);
    }

    /**
     * Requires that the current phase matches the expected phase.
     *
     * @param expectedPhase the expected phase
     * @throws WrongPhaseException if the current phase is not the expected phase
     */
    public void requirePhase(MachinePhase expectedPhase) {
        if (currentPhase != expectedPhase) {
            throw new WrongPhaseException(expectedPhase.name(), currentPhase.name());
        }
    }

    /**
     * Requires that the current phase is at least the given phase.
     *
     * @param minimumPhase the minimum required phase
     * @throws WrongPhaseException if the current phase is before the required phase
     */
    public void requireAtLeast(MachinePhase minimumPhase) {
        if (currentPhase.isBefore(minimumPhase)) {
            throw new WrongPhaseException(minimumPhase + " or later", currentPhase.name());
        }
    }

    /**
     * Gets the time of the last phase transition.
     */
    public Instant getPhaseTransitionTime() {
        return phaseTransitionTime;
    }

    /**
     * Checks if the current phase is one of the specified phases.
     */
    public boolean isPhase(MachinePhase... phases) {
        for (MachinePhase phase : phases) {
            if (currentPhase == phase) {
                return true;
            }
        }
        return false;
    }
}
