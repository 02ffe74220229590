package com.vmcaps.migration;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.lifecycle.MigrationPhase;
import com.vmcaps.machine.Machine;
import com.vmcaps.machine.MachineCapabilityState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes and reads the per-capability migration sections.
 *
 * One generic section per registered capability, driven by registry order. A section
 * is written only when {@link MigrationGuard#isNeeded} holds; absent sections are
 * never an error when reading.
 */
public class CapabilityStateSerializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityStateSerializer.class);

    /**
     * Produces the sections for an outgoing migration.
     *
     * @param machine source machine after {@link MigrationGuard#preSave}
     * @return sections in registry order, possibly empty
     */
    public List<CapabilitySection> save(Machine machine) {
        MachineCapabilityState state = machine.getCapabilityState();
        state.requireMigrationPhase(MigrationPhase.PRE_SAVE);

        List<CapabilitySection> sections = new ArrayList<>();
        for (Capability capability : machine.getRegistry()) {
            int i = capability.ordinal();
            if (MigrationGuard.isNeeded(state, i)) {
                sections.add(new CapabilitySection(
                    capability.sectionName(), CapabilitySection.CURRENT_VERSION, state.getMigration(i).value()));
            }
        }

        LOGGER.debug("Machine {} sends {} capability sections", machine.getId(), sections.size());
        return Collections.unmodifiableList(sections);
    }

    /**
     * Stores incoming sections into the migration set.
     *
     * @param machine destination machine after {@link MigrationGuard#preLoad}
     * @param sections sections read from the stream
     * @throws MigrationStreamException if a section is unknown, repeated, has an
     *         unsupported version or a value that is not an unsigned byte
     */
    public void load(Machine machine, List<CapabilitySection> sections) throws MigrationStreamException {
        MachineCapabilityState state = machine.getCapabilityState();
        state.requireMigrationPhase(MigrationPhase.PRE_LOAD);

        Set<String> seen = new HashSet<>();
        for (CapabilitySection section : sections) {
            Capability capability = machine.getRegistry().findBySection(section.name())
                .orElseThrow(() -> new MigrationStreamException("Unknown capability section '" + section.name() + "'"));

            if (!seen.add(section.name())) {
                throw new MigrationStreamException("Duplicate capability section '" + section.name() + "'");
            }
            if (section.version() < CapabilitySection.MINIMUM_VERSION || section.version() > CapabilitySection.CURRENT_VERSION) {
                throw new MigrationStreamException(String.format(
                    "Section '%s' has version %d, supported %d..%d",
                    section.name(), section.version(), CapabilitySection.MINIMUM_VERSION, CapabilitySection.CURRENT_VERSION));
            }
            if (section.value() < 0 || section.value() > CapabilityLevel.MAX_VALUE) {
                throw new MigrationStreamException(String.format(
                    "Section '%s' value %d does not fit an unsigned byte", section.name(), section.value()));
            }

            state.receive(capability.ordinal(), CapabilityLevel.of(section.value()));
            LOGGER.debug("Machine {} received cap-{}={}", machine.getId(), capability.name(), section.value());
        }
    }
}
