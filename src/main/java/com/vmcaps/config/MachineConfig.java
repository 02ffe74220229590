package com.vmcaps.config;

import com.vmcaps.caps.PropertySetException;
import com.vmcaps.compat.CompatLevel;
import com.vmcaps.machine.CapabilityProperties;
import com.vmcaps.machine.Machine;
import com.vmcaps.machine.MachineClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Machine configuration as read from a configuration file.
 */
public record MachineConfig(
    String machineClass,                 // optional machine class name
    CompatLevel maxCpuCompat,            // optional CPU compatibility ceiling
    Map<String, Object> capabilities     // property key -> raw value, in file order
) {

    public MachineConfig {
        capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
    }

    /**
     * Copies the machine class and CPU compatibility ceiling onto a machine builder.
     */
    public Machine.Builder configure(Machine.Builder builder) {
        if (machineClass != null) {
            builder.machineClass(MachineClass.forName(machineClass)
                .orElseThrow(() -> new IllegalArgumentException("Unknown machine class '" + machineClass + "'")));
        }
        if (maxCpuCompat != null) {
            builder.maxCpuCompat(maxCpuCompat);
        }
        return builder;
    }

    /**
     * Sets every configured capability property on the machine.
     *
     * @throws ConfigValidationException if a property is rejected
     */
    public void applyTo(Machine machine, CapabilityProperties properties) throws ConfigValidationException {
        for (Map.Entry<String, Object> entry : capabilities.entrySet()) {
            try {
                properties.set(machine, entry.getKey(), entry.getValue());
            } catch (PropertySetException e) {
                throw new ConfigValidationException(e.getMessage(), e);
            }
        }
    }
}
