package com.vmcaps.compat;

import com.vmcaps.hardware.CpuModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CompatLevel and the capped CPU compatibility query.
 */
public class CompatLevelTest {

    @Test
    void testParseValidLevel() {
        assertEquals("2.07", CompatLevel.parse("2.07").toString());
        assertEquals(CompatLevel.of(3, 0), CompatLevel.parse(" 3.0 "));
    }

    @Test
    void testParseInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> CompatLevel.parse("2"));
        assertThrows(IllegalArgumentException.class, () -> CompatLevel.parse("2.0.7"));
        assertThrows(IllegalArgumentException.class, () -> CompatLevel.parse("power8"));
        assertThrows(IllegalArgumentException.class, () -> CompatLevel.parse("2.x"));
        assertThrows(NullPointerException.class, () -> CompatLevel.parse(null));
    }

    @Test
    void testCompareTo() {
        var v205 = CompatLevel.parse("2.05");
        var v206 = CompatLevel.parse("2.06");
        var v207 = CompatLevel.parse("2.07");
        var v300 = CompatLevel.parse("3.00");

        assertTrue(v205.compareTo(v206) < 0);
        assertTrue(v206.compareTo(v207) < 0);
        assertTrue(v207.compareTo(v300) < 0);
        assertEquals(0, v206.compareTo(CompatLevel.of(2, 6)));
        assertTrue(v300.compareTo(v205) > 0);
    }

    @Test
    void testIsAtLeastAndIsBelow() {
        var base = CompatLevel.parse("2.06");

        assertTrue(base.isAtLeast(CompatLevel.parse("2.06")));
        assertTrue(base.isAtLeast(CompatLevel.parse("2.05")));
        assertFalse(base.isAtLeast(CompatLevel.parse("2.07")));

        assertTrue(base.isBelow(CompatLevel.parse("2.07")));
        assertFalse(base.isBelow(CompatLevel.parse("2.06")));
    }

    @Test
    void testEqualsAndHashCode() {
        var a = CompatLevel.parse("2.07");
        var b = CompatLevel.of(2, 7);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, CompatLevel.of(2, 6));
    }

    @Test
    void testCappedCompatibility() {
        CpuCompatibility compat = CpuCompatibility.capped();

        assertEquals(CompatLevel.of(2, 7), compat.compatLevel(CpuModel.power8(), null));
        assertEquals(CompatLevel.of(2, 6), compat.compatLevel(CpuModel.power8(), CompatLevel.of(2, 6)));
        // a ceiling above the CPU's own level does not raise it
        assertEquals(CompatLevel.of(2, 6), compat.compatLevel(CpuModel.power7(), CompatLevel.of(3, 0)));
    }
}
