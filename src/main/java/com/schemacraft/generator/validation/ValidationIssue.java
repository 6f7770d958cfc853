package com.schemacraft.generator.validation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single error or warning, optionally located on an entity and attribute.
 */
@Value
@Builder
public class ValidationIssue {

    @NonNull
    IssueCode code;

    @NonNull
    Severity severity;

    @NonNull
    String message;

    String entityName;
    String attributeName;

    public ValidationPhase getPhase() {
        return code.getPhase();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String describe() {
        return "[" + code + "] " + message;
    }
}
