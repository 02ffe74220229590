package com.vmcaps.machine;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.caps.PropertySetException;
import com.vmcaps.config.LevelCodec;
import com.vmcaps.lifecycle.MachinePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Getter/setter pair for every {@code cap-<name>} property of a machine class.
 *
 * Setting a property records an override: the requested level becomes effective and
 * survives every later reset. Properties can only be set while the machine is being
 * constructed, which includes retrying after a reset the backend rejected.
 */
public class CapabilityProperties {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityProperties.class);

    private final CapabilityRegistry registry;

    public CapabilityProperties(CapabilityRegistry registry) {
        this.registry = registry;
    }

    /**
     * Gets the effective value of a property.
     *
     * @param machine the machine to read
     * @param propertyName property key such as "cap-htm"
     * @return Boolean for boolean capabilities, Integer otherwise
     * @throws IllegalArgumentException if no capability has this property
     */
    public Object get(Machine machine, String propertyName) {
        Capability capability = resolve(propertyName);
        return LevelCodec.encode(capability, machine.getCapabilityState().getEffective(capability.ordinal()));
    }

    /**
     * Sets a property from a raw configuration value.
     *
     * @param machine the machine being configured
     * @param propertyName property key such as "cap-htm"
     * @param rawValue Boolean, Number or String value
     * @throws PropertySetException if the property is unknown, the value is malformed,
     *         or the machine is past configuration
     */
    public void set(Machine machine, String propertyName, Object rawValue) throws PropertySetException {
        Capability capability = registry.findByProperty(propertyName)
            .orElseThrow(() -> new PropertySetException(propertyName, "no such capability property"));
        set(machine, capability, LevelCodec.decode(capability, rawValue));
    }

    /**
     * Sets a capability to an already decoded level.
     */
    public void set(Machine machine, Capability capability, CapabilityLevel level) throws PropertySetException {
        String propertyName = capability.propertyName();
        if (!machine.getPhaseController().isPhase(MachinePhase.CONFIGURATION, MachinePhase.RESET)) {
            throw new PropertySetException(propertyName,
                "capabilities can only be set before the machine runs (phase is "
                    + machine.getPhaseController().getCurrentPhase() + ")");
        }
        if (!capability.accepts(level)) {
            throw new PropertySetException(propertyName,
                "level " + level + " exceeds maximum " + capability.maxLevel());
        }

        machine.getCapabilityState().recordOverride(capability.ordinal(), level);
        LOGGER.debug("Machine {} {}={}", machine.getId(), propertyName, level);
    }

    /**
     * Gets property keys and their help text in registry order.
     */
    public Map<String, String> describe() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (Capability capability : registry) {
            descriptions.put(capability.propertyName(), capability.description());
        }
        return Collections.unmodifiableMap(descriptions);
    }

    /**
     * Gets the property type name: "bool" for boolean capabilities, "uint8" otherwise.
     */
    public static String typeName(Capability capability) {
        return capability.isBoolean() ? "bool" : "uint8";
    }

    private Capability resolve(String propertyName) {
        return registry.findByProperty(propertyName)
            .orElseThrow(() -> new IllegalArgumentException("No such capability property: " + propertyName));
    }
}
