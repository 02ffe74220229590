package com.vmcaps.cli;

import com.vmcaps.caps.Capability;
import com.vmcaps.caps.CapabilityRegistry;
import com.vmcaps.machine.CapabilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command listing the capability properties of a machine class.
 *
 * Writes one line per capability, {@code cap-<name>=<type> - <description>}, in
 * registry order, to a file or, without an output file, to the log.
 */
public class CapabilityHelpCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityHelpCommand.class);

    private final CapabilityRegistry registry;
    private final Path outputFile;

    public CapabilityHelpCommand(CapabilityRegistry registry, Path outputFile) {
        this.registry = registry;
        this.outputFile = outputFile;
    }

    @Override
    public Integer call() {
        List<String> lines = render();

        if (outputFile == null) {
            lines.forEach(line -> LOGGER.info("{}", line));
            return 0;
        }

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outputFile, lines);
            LOGGER.info("Wrote {} capability properties to {}", lines.size(), outputFile);
            return 0;
        } catch (IOException e) {
            LOGGER.error("Failed to write capability properties to {}", outputFile, e);
            return 1;
        }
    }

    /**
     * Renders the property listing.
     */
    public List<String> render() {
        List<String> lines = new ArrayList<>(registry.size());
        for (Capability capability : registry) {
            lines.add(String.format("%s=%s - %s",
                capability.propertyName(), CapabilityProperties.typeName(capability), capability.description()));
        }
        return lines;
    }
}
