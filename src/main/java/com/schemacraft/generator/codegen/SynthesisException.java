package com.schemacraft.generator.codegen;

/**
 * A defect in the synthesizer's own tables or templates.
 *
 * Never thrown for bad input: a schema reaching synthesis has already been validated.
 * Aborts the whole invocation, so no partial output is ever returned.
 */
public class SynthesisException extends RuntimeException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }
}
