package com.vmcaps.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.caps.PropertySetException;
import com.vmcaps.compat.CompatLevel;
import com.vmcaps.machine.MachineClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Loads machine configuration files.
 *
 * <pre>
 * {
 *   "machineClass": "pseries",
 *   "maxCpuCompat": "2.06",
 *   "capabilities": { "cap-htm": "off", "cap-vsx": true }
 * }
 * </pre>
 *
 * Capability values are checked against the registry while loading, so a bad file is
 * reported before any machine is built.
 */
public class MachineConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(MachineConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> TOP_LEVEL_FIELDS = Set.of("machineClass", "maxCpuCompat", "capabilities");

    private final CapabilityRegistry registry;

    public MachineConfigLoader(CapabilityRegistry registry) {
        this.registry = registry;
    }

    /**
     * Loads and validates a configuration file.
     *
     * @param configFile path to the JSON file
     * @return the parsed configuration
     * @throws ConfigLoadException if the file is missing, unreadable or not JSON
     * @throws ConfigValidationException if the content is invalid
     */
    public MachineConfig load(Path configFile) throws ConfigLoadException, ConfigValidationException {
        if (!Files.exists(configFile)) {
            throw new ConfigLoadException("Machine configuration not found: " + configFile);
        }

        String content;
        try {
            content = Files.readString(configFile);
        } catch (IOException e) {
            throw new ConfigLoadException(
                String.format("Failed to read machine configuration from '%s'", configFile), e
            );
        }

        MachineConfig config = parse(content);
        LOGGER.info("Loaded machine configuration from {} with {} capability settings",
            configFile, config.capabilities().size());
        return config;
    }

    /**
     * Parses and validates configuration JSON.
     */
    public MachineConfig parse(String json) throws ConfigLoadException, ConfigValidationException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Machine configuration is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigValidationException("Machine configuration must be a JSON object");
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!TOP_LEVEL_FIELDS.contains(name)) {
                throw new ConfigValidationException(String.format("Unknown configuration field '%s'", name));
            }
        }

        String machineClass = null;
        JsonNode classNode = root.get("machineClass");
        if (classNode != null && !classNode.isNull()) {
            if (!classNode.isTextual()) {
                throw new ConfigValidationException("Field 'machineClass' must be a string");
            }
            machineClass = classNode.asText();
            if (MachineClass.forName(machineClass).isEmpty()) {
                throw new ConfigValidationException(String.format("Unknown machine class '%s'", machineClass));
            }
        }

        CompatLevel maxCpuCompat = null;
        JsonNode compatNode = root.get("maxCpuCompat");
        if (compatNode != null && !compatNode.isNull()) {
            if (!compatNode.isTextual()) {
                throw new ConfigValidationException("Field 'maxCpuCompat' must be a string like \"2.06\"");
            }
            try {
                maxCpuCompat = CompatLevel.parse(compatNode.asText());
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException("Invalid 'maxCpuCompat': " + e.getMessage(), e);
            }
        }

        return new MachineConfig(machineClass, maxCpuCompat, parseCapabilities(root.get("capabilities")));
    }

    private Map<String, Object> parseCapabilities(JsonNode node) throws ConfigValidationException {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return capabilities;
        }
        if (!node.isObject()) {
            throw new ConfigValidationException("Field 'capabilities' must be an object");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String property = field.getKey();
            Capability capability = registry.findByProperty(property)
                .orElseThrow(() -> new ConfigValidationException(
                    String.format("Unknown capability property '%s'", property)));

            Object value = convertJsonNode(field.getValue());
            try {
                LevelCodec.decode(capability, value);
            } catch (PropertySetException e) {
                throw new ConfigValidationException(e.getMessage(), e);
            }
            capabilities.put(property, value);
        }
        return capabilities;
    }

    /**
     * Converts a scalar JsonNode to Boolean, Number or String; anything else to null.
     */
    private Object convertJsonNode(JsonNode node) {
        if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isIntegralNumber()) {
            return node.asLong();
        } else if (node.isNumber()) {
            return node.asDouble();
        } else if (node.isTextual()) {
            return node.asText();
        }
        return null;
    }
}
