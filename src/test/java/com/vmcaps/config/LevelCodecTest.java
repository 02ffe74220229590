package com.vmcaps.config;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityApplier;
import com.vmcaps.caps.CapabilityLevel;
import com.vmcaps.caps.PropertySetException;
import com.vmcaps.caps.StandardCapabilities;
import com.vmcaps.compat.CompatLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class LevelCodecTest {

    private final Capability htm = StandardCapabilities.registry().lookup(StandardCapabilities.HTM);
    private final Capability leveled = new Capability(0, "lvl", "Leveled", CompatLevel.of(2, 6),
        CapabilityLevel.of(3), CapabilityApplier.acceptAll());

    @ParameterizedTest
    @ValueSource(strings = {"off", "OFF", "false", "no", " No ", "0"})
    void testFalsyStrings(String raw) throws PropertySetException {
        assertEquals(CapabilityLevel.OFF, LevelCodec.decode(htm, raw));
    }

    @Test
    void testBooleansAndNumbers() throws PropertySetException {
        assertEquals(CapabilityLevel.ON, LevelCodec.decode(htm, Boolean.TRUE));
        assertEquals(CapabilityLevel.ON, LevelCodec.decode(htm, 1L));
        assertEquals(CapabilityLevel.of(3), LevelCodec.decode(leveled, 3));
        assertEquals(CapabilityLevel.of(2), LevelCodec.decode(leveled, 2.0d));
    }

    @Test
    void testRejectsBadValues() {
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(htm, null));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(htm, "enabled"));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(htm, 2));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(leveled, 4));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(leveled, -1));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(leveled, 1.5d));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(leveled, "300"));
        assertThrows(PropertySetException.class, () -> LevelCodec.decode(leveled, new Object()));
    }

    @Test
    void testEncode() {
        assertEquals(Boolean.TRUE, LevelCodec.encode(htm, CapabilityLevel.ON));
        assertEquals(Boolean.FALSE, LevelCodec.encode(htm, CapabilityLevel.OFF));
        assertEquals(2, LevelCodec.encode(leveled, CapabilityLevel.of(2)));
    }
}
