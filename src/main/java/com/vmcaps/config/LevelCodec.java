package com.vmcaps.config;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.PropertySetException;

import java.util.Locale;

/**
 * Converts raw property values to and from {@link CapabilityLevel}.
 *
 * Accepts booleans, the strings on/off/true/false/yes/no (any case) and numeric levels
 * up to the capability's maximum.
 */
public final class LevelCodec {

    private LevelCodec() {
    }

    /**
     * Decodes a raw property value for a capability.
     *
     * @param capability the target capability
     * @param raw Boolean, Number or String value
     * @return the decoded level
     * @throws PropertySetException if the value is malformed or above the capability's maximum
     */
    public static CapabilityLevel decode(Capability capability, Object raw) throws PropertySetException {
        String property = capability.propertyName();
        if (raw == null) {
            throw new PropertySetException(property, "value is missing");
        }

        CapabilityLevel level;
        if (raw instanceof Boolean) {
            level = CapabilityLevel.of((Boolean) raw);
        } else if (raw instanceof Number) {
            Number number = (Number) raw;
            if (number.doubleValue() != number.longValue()) {
                throw new PropertySetException(property, "'" + raw + "' is not a whole number");
            }
            level = numeric(property, number.longValue(), raw);
        } else if (raw instanceof String) {
            level = parse(property, (String) raw);
        } else {
            throw new PropertySetException(property, "unsupported value type " + raw.getClass().getName());
        }

        if (!capability.accepts(level)) {
            throw new PropertySetException(property,
                "level " + level + " exceeds maximum " + capability.maxLevel());
        }
        return level;
    }

    /**
     * Encodes a level the way the property reports it: a Boolean for boolean
     * capabilities, the numeric level otherwise.
     */
    public static Object encode(Capability capability, CapabilityLevel level) {
        if (capability.isBoolean()) {
            return !level.isOff();
        }
        return level.value();
    }

    private static CapabilityLevel parse(String property, String raw) throws PropertySetException {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "on":
            case "true":
            case "yes":
                return CapabilityLevel.ON;
            case "off":
            case "false":
            case "no":
                return CapabilityLevel.OFF;
            default:
                break;
        }
        try {
            return numeric(property, Long.parseLong(value), raw);
        } catch (NumberFormatException e) {
            throw new PropertySetException(property, "'" + raw + "' is not a valid capability level", e);
        }
    }

    private static CapabilityLevel numeric(String property, long value, Object raw) throws PropertySetException {
        if (value < 0 || value > CapabilityLevel.MAX_VALUE) {
            throw new PropertySetException(property, "'" + raw + "' is out of range");
        }
        return CapabilityLevel.of((int) value);
    }
}
