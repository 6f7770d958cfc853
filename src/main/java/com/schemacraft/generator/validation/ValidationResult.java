package com.schemacraft.generator.validation;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Errors and warnings of one validation run, each list in detection order.
 *
 * A result with any error must stop the pipeline before synthesis.
 */
@Value
@Builder
public class ValidationResult {

    @Singular
    List<ValidationIssue> errors;

    @Singular
    List<ValidationIssue> warnings;

    @NonNull
    SchemaStatistics statistics;

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrorMessages() {
        return errors.stream().map(ValidationIssue::getMessage).toList();
    }

    public List<String> getWarningMessages() {
        return warnings.stream().map(ValidationIssue::getMessage).toList();
    }
}
