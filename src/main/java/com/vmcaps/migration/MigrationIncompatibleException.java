package com.vmcaps.migration;

import com.vmcaps.caps.CapabilityException;
import com.vmcaps.caps.ValidationMessage;

import java.util.stream.Collectors;

/**
 * Thrown when the destination cannot honor capability levels the source guest was using.
 *
 * Fatal to the incoming migration only; the destination machine keeps its configuration.
 */
public class MigrationIncompatibleException extends CapabilityException {

    private final MigrationValidationResult result;

    public MigrationIncompatibleException(String machineId, MigrationValidationResult result) {
        super("Incoming migration rejected for machine " + machineId + ": "
            + result.errors().stream().map(ValidationMessage::message).collect(Collectors.joining("; ")));
        this.result = result;
    }

    public MigrationValidationResult getResult() {
        return result;
    }
}
