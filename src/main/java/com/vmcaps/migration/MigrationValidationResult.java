package com.vmcaps.migration;

import com.vmcaps.caps.ValidationMessage;

import java.util.List;

/**
 * Result of comparing incoming capability levels with the destination's.
 */
public record MigrationValidationResult(
    List<ValidationMessage> errors,     // capabilities the destination cannot honor
    List<ValidationMessage> warnings    // capabilities the destination offers less of
) {

    public MigrationValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
