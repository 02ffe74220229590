package com.vmcaps.cli;

import com.vmcaps.caps.StandardCapabilities;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityHelpCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testRender() {
        List<String> lines = new CapabilityHelpCommand(StandardCapabilities.registry(), null).render();

        assertEquals(List.of(
            "cap-htm=bool - Allow Hardware Transactional Memory (HTM)",
            "cap-vsx=bool - Allow Vector Scalar Extensions (VSX)",
            "cap-dfp=bool - Allow Decimal Floating Point (DFP)"), lines);
    }

    @Test
    void testWritesToFile() throws Exception {
        Path output = tempDir.resolve("out/caps.txt");

        int exitCode = new CapabilityHelpCommand(StandardCapabilities.registry(), output).call();

        assertEquals(0, exitCode);
        assertEquals(3, Files.readAllLines(output).size());
    }

    @Test
    void testLogsWithoutOutputFile() {
        assertEquals(0, new CapabilityHelpCommand(StandardCapabilities.registry(), null).call());
    }

    @Test
    void testUnwritableOutputReturnsError() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");

        assertEquals(1, new CapabilityHelpCommand(StandardCapabilities.registry(), blocker.resolve("caps.txt")).call());
    }
}
