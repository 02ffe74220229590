package com.vmcaps.caps;

import com.vmcaps.compat.CompatLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable table of capability descriptors.
 *
 * Entries are 1:1 with the ordinals {@code [0, N)} and names are unique. The table is
 * built once through a {@link Builder} and never changes afterwards, so it may be read
 * from any thread without synchronization. Iteration follows ordinal order.
 */
public final class CapabilityRegistry implements Iterable<Capability> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final List<Capability> capabilities;
    private final Map<String, Capability> byName;

    private CapabilityRegistry(List<Capability> capabilities) {
        this.capabilities = Collections.unmodifiableList(capabilities);
        Map<String, Capability> names = new HashMap<>();
        for (Capability capability : capabilities) {
            names.put(capability.name(), capability);
        }
        this.byName = Collections.unmodifiableMap(names);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the descriptor for an ordinal.
     *
     * @param ordinal capability ordinal
     * @return the descriptor
     * @throws IndexOutOfBoundsException if the ordinal is outside {@code [0, size())}
     */
    public Capability lookup(int ordinal) {
        return capabilities.get(Objects.checkIndex(ordinal, capabilities.size()));
    }

    /**
     * Finds a capability by its stable external name, e.g. "htm".
     */
    public Optional<Capability> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Finds a capability by its configuration property key, e.g. "cap-htm".
     */
    public Optional<Capability> findByProperty(String propertyName) {
        if (propertyName == null || !propertyName.startsWith(Capability.PROPERTY_PREFIX)) {
            return Optional.empty();
        }
        return find(propertyName.substring(Capability.PROPERTY_PREFIX.length()));
    }

    /**
     * Finds a capability by its migration section name, e.g. "cap/htm".
     */
    public Optional<Capability> findBySection(String sectionName) {
        if (sectionName == null || !sectionName.startsWith(Capability.SECTION_PREFIX)) {
            return Optional.empty();
        }
        return find(sectionName.substring(Capability.SECTION_PREFIX.length()));
    }

    /**
     * Gets all descriptors in registry order.
     *
     * @return immutable list indexed by ordinal
     */
    public List<Capability> capabilities() {
        return capabilities;
    }

    public int size() {
        return capabilities.size();
    }

    /**
     * Creates a set sized for this registry with every capability off.
     */
    public CapabilitySet newSet() {
        return new CapabilitySet(capabilities.size());
    }

    @Override
    public Iterator<Capability> iterator() {
        return capabilities.iterator();
    }

    /**
     * Collects descriptors and freezes them into a {@link CapabilityRegistry}.
     */
    public static final class Builder {

        private final Map<Integer, Capability> byOrdinal = new TreeMap<>();
        private boolean frozen = false;

        private Builder() {
        }

        /**
         * Registers a boolean capability at the next free ordinal.
         */
        public Builder register(String name, String description, CompatLevel threshold, CapabilityApplier applier) {
            return register(name, description, threshold, CapabilityLevel.ON, applier);
        }

        /**
         * Registers a capability with the given highest level at the next free ordinal.
         */
        public Builder register(String name, String description, CompatLevel threshold,
                                CapabilityLevel maxLevel, CapabilityApplier applier) {
            return register(new Capability(byOrdinal.size(), name, description, threshold, maxLevel, applier));
        }

        /**
         * Registers a fully specified descriptor.
         *
         * @throws RegistryFrozenException if {@link #build()} was already called
         * @throws IllegalArgumentException if the ordinal is taken
         */
        public Builder register(Capability capability) {
            Objects.requireNonNull(capability, "capability");
            if (frozen) {
                throw new RegistryFrozenException();
            }
            if (byOrdinal.putIfAbsent(capability.ordinal(), capability) != null) {
                throw new IllegalArgumentException("Capability ordinal already registered: " + capability.ordinal());
            }
            return this;
        }

        /**
         * Validates the collected descriptors and freezes them.
         *
         * @return the immutable registry
         * @throws IllegalStateException if ordinals are not dense from zero or names repeat
         */
        public CapabilityRegistry build() {
            if (frozen) {
                throw new RegistryFrozenException();
            }

            List<Capability> ordered = new ArrayList<>(byOrdinal.size());
            Map<String, Integer> seenNames = new HashMap<>();
            int expected = 0;
            for (Capability capability : byOrdinal.values()) {
                if (capability.ordinal() != expected) {
                    throw new IllegalStateException("Capability ordinals must be dense: missing ordinal " + expected);
                }
                Integer previous = seenNames.putIfAbsent(capability.name(), capability.ordinal());
                if (previous != null) {
                    throw new IllegalStateException(String.format(
                        "Capability name '%s' used by ordinals %d and %d", capability.name(), previous, capability.ordinal()));
                }
                ordered.add(capability);
                expected++;
            }

            frozen = true;
            LOGGER.info("Capability registry built with {} capabilities", ordered.size());
            return new CapabilityRegistry(ordered);
        }
    }
}
