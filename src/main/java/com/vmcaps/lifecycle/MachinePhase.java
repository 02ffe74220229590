package com.vmcaps.lifecycle;

/**
 * Lifecycle phases of a machine as far as capabilities are concerned.
 *
 * Phases advance monotonically and never regress.
 */
public enum MachinePhase {
    /**
     * Machine is being constructed. Capability properties may be set.
     */
    CONFIGURATION,

    /**
     * First reset is in progress. Defaults are computed and applied to the hardware.
     * A machine whose first reset failed stays here.
     */
    RESET,

    /**
     * Capabilities are applied; the guest may run and migrate.
     * Later resets happen in this phase.
     */
    RUNNING;

    /**
     * Returns true if this phase comes after the given phase.
     *
     * @param other the phase to compare against
     * @return true if this phase is later in the lifecycle
     */
    public boolean isAfter(MachinePhase other) {
        return this.ordinal() > other.ordinal();
    }

    /**
     * Returns true if this phase comes before the given phase.
     *
     * @param other the phase to compare against
     * @return true if this phase is earlier in the lifecycle
     */
    public boolean isBefore(MachinePhase other) {
        return this.ordinal() < other.ordinal();
    }
}
