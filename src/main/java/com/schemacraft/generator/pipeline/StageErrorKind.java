package com.schemacraft.generator.pipeline;

/**
 * Terminal failures a pipeline stage can report for bad input.
 */
public enum StageErrorKind {

    /**
     * The upstream text holds no parseable JSON object, even after repair.
     */
    INTAKE_PARSE,

    /**
     * The parsed document lacks the shape a schema needs (e.g. no entities array).
     */
    NORMALIZATION
}
