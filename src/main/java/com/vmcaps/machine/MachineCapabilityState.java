package com.vmcaps.machine;

import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.CapabilitySet;
import com.vmcaps.caps.WrongPhaseException;
import com.vmcaps.lifecycle.MigrationPhase;

import java.util.Objects;

/**
 * Capability levels held by one machine.
 *
 * <ul>
 *   <li><b>default</b> - levels used without explicit configuration, recomputed at every reset</li>
 *   <li><b>effective</b> - levels the virtual hardware runs with; equals default for every
 *       capability without an override</li>
 *   <li><b>migration</b> - exists only while a migration is in flight</li>
 * </ul>
 *
 * Override flags are set by property setters and never cleared.
 */
public final class MachineCapabilityState {

    private final int size;
    private CapabilitySet defaults;
    private final CapabilitySet effective;
    private final boolean[] overrides;

    private MigrationPhase migrationPhase = MigrationPhase.IDLE;
    private CapabilitySet migration;
    private boolean[] received;

    public MachineCapabilityState(int size) {
        this.size = size;
        this.defaults = new CapabilitySet(size);
        this.effective = new CapabilitySet(size);
        this.overrides = new boolean[size];
    }

    public int size() {
        return size;
    }

    /**
     * Gets a copy of the default set.
     */
    public CapabilitySet getDefaults() {
        return defaults.copy();
    }

    /**
     * Gets a copy of the effective set.
     */
    public CapabilitySet getEffective() {
        return effective.copy();
    }

    public CapabilityLevel getDefault(int ordinal) {
        return defaults.get(ordinal);
    }

    public CapabilityLevel getEffective(int ordinal) {
        return effective.get(ordinal);
    }

    public boolean isOverridden(int ordinal) {
        return overrides[Objects.checkIndex(ordinal, size)];
    }

    /**
     * Replaces the default set. Only the reset engine calls this.
     */
    public void setDefaults(CapabilitySet newDefaults) {
        requireSize(newDefaults);
        this.defaults = newDefaults.copy();
    }

    /**
     * Sets an effective level at reset. Only the reset engine calls this.
     */
    public void setEffective(int ordinal, CapabilityLevel level) {
        effective.set(ordinal, level);
    }

    /**
     * Records an explicit request for a level. The override flag stays set for the
     * lifetime of the machine.
     */
    public void recordOverride(int ordinal, CapabilityLevel level) {
        overrides[Objects.checkIndex(ordinal, size)] = true;
        effective.set(ordinal, level);
    }

    // Migration set

    public MigrationPhase getMigrationPhase() {
        return migrationPhase;
    }

    /**
     * Starts a migration with the given snapshot as the migration set.
     *
     * @throws WrongPhaseException if another migration is in flight
     */
    public void beginMigration(MigrationPhase phase, CapabilitySet snapshot) {
        if (!phase.isActive()) {
            throw new IllegalArgumentException("Migration cannot begin in phase " + phase);
        }
        if (migrationPhase.isActive()) {
            throw new WrongPhaseException(MigrationPhase.IDLE.name(), migrationPhase.name());
        }
        requireSize(snapshot);
        this.migration = snapshot.copy();
        this.received = new boolean[size];
        this.migrationPhase = phase;
    }

    /**
     * Moves an in-flight migration to its next phase.
     */
    public void advanceMigration(MigrationPhase expected, MigrationPhase next) {
        requireMigrationPhase(expected);
        this.migrationPhase = next;
    }

    public void requireMigrationPhase(MigrationPhase expected) {
        if (migrationPhase != expected) {
            throw new WrongPhaseException(expected.name(), migrationPhase.name());
        }
    }

    /**
     * Gets a copy of the migration set.
     *
     * @throws WrongPhaseException if no migration is in flight
     */
    public CapabilitySet getMigration() {
        requireActiveMigration();
        return migration.copy();
    }

    public CapabilityLevel getMigration(int ordinal) {
        requireActiveMigration();
        return migration.get(ordinal);
    }

    /**
     * Stores a level that arrived in the incoming migration stream.
     */
    public void receive(int ordinal, CapabilityLevel level) {
        requireMigrationPhase(MigrationPhase.PRE_LOAD);
        migration.set(ordinal, level);
        received[ordinal] = true;
    }

    /**
     * True if the capability was present in the incoming stream, or the migration set
     * otherwise differs from the default set.
     */
    public boolean isReceived(int ordinal) {
        requireActiveMigration();
        return received[Objects.checkIndex(ordinal, size)] || !migration.get(ordinal).equals(defaults.get(ordinal));
    }

    /**
     * Drops the migration set and returns to {@link MigrationPhase#IDLE}.
     */
    public void endMigration() {
        this.migration = null;
        this.received = null;
        this.migrationPhase = MigrationPhase.IDLE;
    }

    private void requireActiveMigration() {
        if (!migrationPhase.isActive()) {
            throw new WrongPhaseException("an active migration", migrationPhase.name());
        }
    }

    private void requireSize(CapabilitySet set) {
        Objects.requireNonNull(set, "set");
        if (set.size() != size) {
            throw new IllegalArgumentException(
                "Capability set has " + set.size() + " entries, expected " + size);
        }
    }
}
