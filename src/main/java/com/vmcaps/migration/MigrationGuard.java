package com.vmcaps.migration;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.CapabilitySet;
import com.vmcaps.caps.Severity;
import com.vmcaps.caps.ValidationMessage;
import com.vmcaps.defaults.DefaultResolver;
import com.vmcaps.lifecycle.MachinePhase;
import com.vmcaps.lifecycle.MigrationPhase;
import com.vmcaps.machine.Machine;
import com.vmcaps.machine.MachineCapabilityState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps capabilities consistent across a live migration.
 *
 * The migration controller calls {@link #preSave} on the source before the capability
 * sections are written, and {@link #preLoad} then {@link #postMigration} on the destination
 * around reading them. A source level above the destination's rejects the migration;
 * a source level below it only produces a warning.
 *
 * {@link #postMigration} must run even when no capability section arrived, since
 * destination overrides can conflict with source defaults.
 */
public class MigrationGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationGuard.class);

    public static final String CODE_UPGRADE = "CAPABILITY_UPGRADE";
    public static final String CODE_DOWNGRADE = "CAPABILITY_DOWNGRADE";

    private final DefaultResolver defaultResolver;

    public MigrationGuard(DefaultResolver defaultResolver) {
        this.defaultResolver = defaultResolver;
    }

    /**
     * Source side: snapshots the effective set into the migration set.
     */
    public void preSave(Machine machine) {
        machine.getPhaseController().requireAtLeast(MachinePhase.RUNNING);
        MachineCapabilityState state = machine.getCapabilityState();
        state.beginMigration(MigrationPhase.PRE_SAVE, state.getEffective());
        LOGGER.debug("Machine {} saving capabilities {}", machine.getId(), state.getEffective());
    }

    /**
     * Destination side: seeds the migration set with this machine's own defaults, so
     * capabilities the source never sent end up at the destination's default.
     */
    public void preLoad(Machine machine) {
        machine.getPhaseController().requireAtLeast(MachinePhase.RUNNING);
        MachineCapabilityState state = machine.getCapabilityState();
        state.beginMigration(MigrationPhase.PRE_LOAD, state.getDefaults());
        LOGGER.debug("Machine {} expecting capabilities, defaults {}", machine.getId(), state.getDefaults());
    }

    /**
     * Decides whether a capability goes on the wire: only explicitly overridden
     * capabilities whose effective level differs from the default.
     */
    public static boolean isNeeded(MachineCapabilityState state, int ordinal) {
        return state.isOverridden(ordinal)
            && !state.getEffective(ordinal).equals(state.getDefault(ordinal));
    }

    /**
     * Ends an outgoing migration and drops the migration set.
     */
    public void completeSave(Machine machine) {
        MachineCapabilityState state = machine.getCapabilityState();
        state.requireMigrationPhase(MigrationPhase.PRE_SAVE);
        state.endMigration();
    }

    /**
     * Abandons whatever migration is in flight.
     */
    public void abort(Machine machine) {
        MachineCapabilityState state = machine.getCapabilityState();
        if (state.getMigrationPhase().isActive()) {
            LOGGER.warn("Machine {} abandons migration in phase {}", machine.getId(), state.getMigrationPhase());
        }
        state.endMigration();
    }

    /**
     * Destination side: reconstructs the source's effective set and compares it with
     * this machine's effective set. The migration set is discarded afterwards.
     *
     * @param machine the destination machine, after {@link #preLoad} and the section load
     * @return result holding one error per capability the destination cannot honor and
     *         one warning per capability it offers less of
     */
    public MigrationValidationResult postMigration(Machine machine) {
        MachineCapabilityState state = machine.getCapabilityState();
        state.advanceMigration(MigrationPhase.PRE_LOAD, MigrationPhase.POST_LOAD);

        try {
            CapabilitySet source = reconstructSource(machine);
            CapabilitySet destination = state.getEffective();
            List<ValidationMessage> errors = new ArrayList<>();
            List<ValidationMessage> warnings = new ArrayList<>();

            for (Capability capability : machine.getRegistry()) {
                CapabilityLevel src = source.get(capability.ordinal());
                CapabilityLevel dst = destination.get(capability.ordinal());

                if (src.isAbove(dst)) {
                    String message = String.format(
                        "cap-%s higher level (%d) in incoming stream than on destination (%d)",
                        capability.name(), src.value(), dst.value());
                    LOGGER.error(message);
                    errors.add(new ValidationMessage(Severity.ERROR, CODE_UPGRADE, message, capability.name()));
                } else if (src.isBelow(dst)) {
                    String message = String.format(
                        "cap-%s lower level (%d) in incoming stream than on destination (%d)",
                        capability.name(), src.value(), dst.value());
                    LOGGER.warn(message);
                    warnings.add(new ValidationMessage(Severity.WARN, CODE_DOWNGRADE, message, capability.name()));
                }
            }

            MigrationValidationResult result = new MigrationValidationResult(errors, warnings);
            if (result.isSuccess()) {
                LOGGER.info("Machine {} accepted incoming capabilities {} ({} warnings)",
                    machine.getId(), source, warnings.size());
            } else {
                LOGGER.error("Machine {} rejects incoming migration: {} incompatible capabilities",
                    machine.getId(), errors.size());
            }
            return result;
        } finally {
            state.endMigration();
        }
    }

    /**
     * Same as {@link #postMigration}, but throws when the migration must be rejected.
     *
     * @throws MigrationIncompatibleException if any capability failed
     */
    public MigrationValidationResult requireCompatible(Machine machine) {
        MigrationValidationResult result = postMigration(machine);
        if (!result.isSuccess()) {
            throw new MigrationIncompatibleException(machine.getId(), result);
        }
        return result;
    }

    /**
     * The source's effective set as far as the stream reveals it: freshly computed
     * destination defaults, overlaid with every capability that arrived.
     */
    private CapabilitySet reconstructSource(Machine machine) {
        MachineCapabilityState state = machine.getCapabilityState();
        CapabilitySet source = defaultResolver.computeDefaults(machine);
        for (Capability capability : machine.getRegistry()) {
            int i = capability.ordinal();
            if (state.isReceived(i)) {
                source.set(i, state.getMigration(i));
            }
        }
        return source;
    }
}
