package com.schemacraft.generator.pipeline;

/**
 * Where a compilation stopped.
 */
public enum CompilationStatus {
    INTAKE_FAILED,
    NORMALIZATION_FAILED,
    INVALID,

    /** Validation passed and synthesis was not requested. */
    VALIDATED,

    GENERATED
}
