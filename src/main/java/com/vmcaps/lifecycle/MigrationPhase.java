package com.vmcaps.lifecycle;

/**
 * Where a machine stands in the capability part of a migration.
 *
 * The source goes {@code IDLE -> PRE_SAVE -> IDLE}; the destination goes
 * {@code IDLE -> PRE_LOAD -> POST_LOAD -> IDLE}. The migration capability set
 * only exists outside {@link #IDLE}.
 */
public enum MigrationPhase {
    IDLE,
    PRE_SAVE,
    PRE_LOAD,
    POST_LOAD;

    public boolean isActive() {
        return this != IDLE;
    }
}
