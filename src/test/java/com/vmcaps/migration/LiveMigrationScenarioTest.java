package com.vmcaps.migration;

import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.caps.PropertySetException;
import com.vmcaps.caps.StandardCapabilities;
import com.vmcaps.caps.TestCapabilities;
import com.vmcaps.compat.CompatLevel;
import com.vmcaps.defaults.DefaultResolver;
import com.vmcaps.hardware.CpuModel;
import com.vmcaps.hardware.ExecutionBackend;
import com.vmcaps.machine.CapabilityProperties;
import com.vmcaps.machine.Machine;
import com.vmcaps.reset.ResetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Source and destination machines exchanging capabilities through an encoded stream.
 */
class LiveMigrationScenarioTest {

    private final MigrationStreamCodec codec = new MigrationStreamCodec();
    private final CapabilityStateSerializer serializer = new CapabilityStateSerializer();

    private CapabilityRegistry registry;
    private ResetEngine resetEngine;
    private MigrationGuard guard;
    private CapabilityProperties properties;

    @BeforeEach
    void setUp() {
        registry = TestCapabilities.registry();
        DefaultResolver resolver = new DefaultResolver(registry);
        resetEngine = new ResetEngine(resolver);
        guard = new MigrationGuard(resolver);
        properties = new CapabilityProperties(registry);
    }

    private Machine start(String id, CompatLevel compat, String property, Object value) throws PropertySetException {
        Machine machine = TestCapabilities.machine(id,
            TestCapabilities.machineClass(registry, TestCapabilities.allOn()), compat);
        if (property != null) {
            properties.set(machine, property, value);
        }
        resetEngine.reset(machine);
        return machine;
    }

    private String send(Machine source) {
        guard.preSave(source);
        try {
            return codec.encode(serializer.save(source));
        } finally {
            guard.completeSave(source);
        }
    }

    private MigrationValidationResult accept(Machine destination, String stream) throws MigrationStreamException {
        guard.preLoad(destination);
        try {
            serializer.load(destination, codec.decode(stream));
        } catch (MigrationStreamException e) {
            guard.abort(destination);
            throw e;
        }
        return guard.postMigration(destination);
    }

    @Test
    @DisplayName("Source override above the destination's level is rejected")
    void testOverrideUpgradeIsRejected() throws Exception {
        Machine source = start("src", CompatLevel.of(2, 6), "cap-f1", true);
        Machine destination = start("dst", CompatLevel.of(2, 6), null, null);

        String stream = send(source);
        assertEquals(List.of(new CapabilitySection("cap/f1", 1, 1)), codec.decode(stream));

        MigrationValidationResult result = accept(destination, stream);

        assertFalse(result.isSuccess());
        String message = result.errors().get(0).message();
        assertTrue(message.contains("cap-f1"));
        assertTrue(message.contains("(1)"));
        assertTrue(message.contains("(0)"));
    }

    @Test
    void testIdenticalMachinesMigrateCleanly() throws Exception {
        Machine source = start("src", CompatLevel.of(2, 7), null, null);
        Machine destination = start("dst", CompatLevel.of(2, 7), null, null);

        MigrationValidationResult result = accept(destination, send(source));

        assertTrue(result.isSuccess());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void testSourceDowngradeOnlyWarns() throws Exception {
        Machine source = start("src", CompatLevel.of(2, 7), "cap-f3", "off");
        Machine destination = start("dst", CompatLevel.of(2, 7), null, null);

        MigrationValidationResult result = accept(destination, send(source));

        assertTrue(result.isSuccess());
        assertEquals(1, result.warnings().size());
        assertEquals("f3", result.warnings().get(0).capability());
    }

    @Test
    void testMatchingOverridesOnBothSides() throws Exception {
        Machine source = start("src", CompatLevel.of(2, 6), "cap-f1", "on");
        Machine destination = start("dst", CompatLevel.of(2, 6), "cap-f1", "on");

        assertTrue(accept(destination, send(source)).isSuccess());
    }

    @Test
    void testSourceCanMigrateAgainAfterSave() throws Exception {
        Machine source = start("src", CompatLevel.of(2, 6), "cap-f1", "on");

        assertEquals(send(source), send(source));
    }

    @Test
    void testCorruptStreamLeavesDestinationUsable() throws Exception {
        Machine destination = start("dst", CompatLevel.of(2, 7), null, null);

        assertThrows(MigrationStreamException.class,
            () -> accept(destination, "{\"formatVersion\":1,\"sections\":[{\"name\":\"cap/zz\",\"version\":1,\"value\":1}]}"));

        assertTrue(accept(destination, "{\"formatVersion\":1}").isSuccess());
    }

    @Test
    @DisplayName("Standard pseries machines on KVM with HTM migrate cleanly")
    void testStandardMachines() throws Exception {
        CapabilityRegistry standard = StandardCapabilities.registry();
        DefaultResolver resolver = new DefaultResolver(standard);
        ResetEngine engine = new ResetEngine(resolver);
        MigrationGuard standardGuard = new MigrationGuard(resolver);

        Machine source = Machine.builder("src").cpu(CpuModel.power8()).backend(ExecutionBackend.kvm(true)).build();
        Machine destination = Machine.builder("dst").cpu(CpuModel.power9()).backend(ExecutionBackend.kvm(true)).build();
        new CapabilityProperties(standard).set(source, "cap-htm", "on");
        new CapabilityProperties(standard).set(destination, "cap-htm", "on");
        engine.reset(source);
        engine.reset(destination);

        standardGuard.preSave(source);
        String stream = codec.encode(serializer.save(source));
        standardGuard.completeSave(source);

        standardGuard.preLoad(destination);
        serializer.load(destination, codec.decode(stream));
        assertTrue(standardGuard.requireCompatible(destination).isSuccess());
    }
}
