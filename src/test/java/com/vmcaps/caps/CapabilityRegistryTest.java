package com.vmcaps.caps;

import com.vmcaps.compat.CompatLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CapabilityRegistryTest {

    private static final CompatLevel COMPAT = CompatLevel.of(2, 6);

    @Test
    @DisplayName("Every ordinal has exactly one descriptor and names are unique")
    void testStandardRegistryTotality() {
        CapabilityRegistry registry = StandardCapabilities.registry();

        assertEquals(3, registry.size());
        Set<String> names = new HashSet<>();
        for (int i = 0; i < registry.size(); i++) {
            Capability capability = registry.lookup(i);
            assertEquals(i, capability.ordinal());
            assertTrue(names.add(capability.name()), "duplicate name " + capability.name());
        }
    }

    @Test
    void testStandardRegistryOrderAndMetadata() {
        CapabilityRegistry registry = StandardCapabilities.registry();

        List<String> names = registry.capabilities().stream().map(Capability::name).toList();
        assertEquals(List.of("htm", "vsx", "dfp"), names);

        Capability htm = registry.lookup(StandardCapabilities.HTM);
        assertEquals("cap-htm", htm.propertyName());
        assertEquals("cap/htm", htm.sectionName());
        assertEquals("Allow Hardware Transactional Memory (HTM)", htm.description());
        assertEquals(CompatLevel.of(2, 7), htm.threshold());
        assertTrue(htm.isBoolean());

        assertEquals(CompatLevel.of(2, 6), registry.lookup(StandardCapabilities.VSX).threshold());
        assertEquals(CompatLevel.of(2, 6), registry.lookup(StandardCapabilities.DFP).threshold());
    }

    @Test
    void testIterationFollowsOrdinals() {
        int expected = 0;
        for (Capability capability : StandardCapabilities.registry()) {
            assertEquals(expected++, capability.ordinal());
        }
        assertEquals(3, expected);
    }

    @Test
    void testLookupOutOfRange() {
        CapabilityRegistry registry = StandardCapabilities.registry();

        assertThrows(IndexOutOfBoundsException.class, () -> registry.lookup(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> registry.lookup(3));
    }

    @Test
    void testFindByNamePropertyAndSection() {
        CapabilityRegistry registry = StandardCapabilities.registry();

        assertEquals(StandardCapabilities.VSX, registry.find("vsx").orElseThrow().ordinal());
        assertEquals(StandardCapabilities.DFP, registry.findByProperty("cap-dfp").orElseThrow().ordinal());
        assertEquals(StandardCapabilities.HTM, registry.findBySection("cap/htm").orElseThrow().ordinal());

        assertTrue(registry.find("altivec").isEmpty());
        assertTrue(registry.findByProperty("htm").isEmpty());
        assertTrue(registry.findByProperty(null).isEmpty());
        assertTrue(registry.findBySection("spapr/cap/htm").isEmpty());
    }

    @Test
    void testCapabilitiesListIsImmutable() {
        List<Capability> capabilities = StandardCapabilities.registry().capabilities();

        assertThrows(UnsupportedOperationException.class, () -> capabilities.remove(0));
    }

    @Test
    void testBuilderAssignsOrdinalsInRegistrationOrder() {
        CapabilityRegistry registry = CapabilityRegistry.builder()
            .register("a", "first", COMPAT, CapabilityApplier.acceptAll())
            .register("b", "second", COMPAT, CapabilityLevel.of(3), CapabilityApplier.acceptAll())
            .build();

        assertEquals("a", registry.lookup(0).name());
        assertEquals("b", registry.lookup(1).name());
        assertFalse(registry.lookup(1).isBoolean());
        assertEquals(CapabilityLevel.of(3), registry.lookup(1).maxLevel());
        assertEquals(new CapabilitySet(2), registry.newSet());
    }

    @Test
    void testBuilderRejectsGapInOrdinals() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder()
            .register(new Capability(0, "a", "a", COMPAT, CapabilityLevel.ON, CapabilityApplier.acceptAll()))
            .register(new Capability(2, "c", "c", COMPAT, CapabilityLevel.ON, CapabilityApplier.acceptAll()));

        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("missing ordinal 1"));
    }

    @Test
    void testBuilderRejectsDuplicateNames() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder()
            .register("a", "first", COMPAT, CapabilityApplier.acceptAll())
            .register("a", "again", COMPAT, CapabilityApplier.acceptAll());

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testBuilderRejectsDuplicateOrdinals() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder()
            .register(new Capability(0, "a", "a", COMPAT, CapabilityLevel.ON, CapabilityApplier.acceptAll()));

        assertThrows(IllegalArgumentException.class, () ->
            builder.register(new Capability(0, "b", "b", COMPAT, CapabilityLevel.ON, CapabilityApplier.acceptAll())));
    }

    @Test
    void testBuilderIsFrozenAfterBuild() {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder()
            .register("a", "first", COMPAT, CapabilityApplier.acceptAll());
        builder.build();

        assertThrows(RegistryFrozenException.class, () ->
            builder.register("b", "second", COMPAT, CapabilityApplier.acceptAll()));
        assertThrows(RegistryFrozenException.class, builder::build);
    }

    @Test
    void testCapabilityRejectsInvalidDescriptors() {
        assertThrows(IllegalArgumentException.class, () ->
            new Capability(-1, "a", "a", COMPAT, CapabilityLevel.ON, CapabilityApplier.acceptAll()));
        assertThrows(IllegalArgumentException.class, () ->
            new Capability(0, " ", "a", COMPAT, CapabilityLevel.ON, CapabilityApplier.acceptAll()));
        assertThrows(IllegalArgumentException.class, () ->
            new Capability(0, "a", "a", COMPAT, CapabilityLevel.OFF, CapabilityApplier.acceptAll()));
        assertThrows(NullPointerException.class, () ->
            new Capability(0, "a", "a", null, CapabilityLevel.ON, CapabilityApplier.acceptAll()));
    }
}
