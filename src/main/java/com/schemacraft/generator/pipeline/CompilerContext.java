package com.schemacraft.generator.pipeline;

import java.time.Clock;

import com.schemacraft.generator.codegen.SynthesisOptions;
import com.schemacraft.generator.validation.ValidationOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a compilation needs besides its input, built once and passed explicitly.
 *
 * Immutable, so one instance can serve concurrent compilations.
 */
@Value
@Builder(toBuilder = true)
public class CompilerContext {

    /**
     * Source of the timestamp stamped into parsed documents.
     */
    @NonNull
    @Builder.Default
    Clock clock = Clock.systemUTC();

    @NonNull
    @Builder.Default
    ValidationOptions validationOptions = ValidationOptions.defaults();

    @NonNull
    @Builder.Default
    SynthesisOptions synthesisOptions = SynthesisOptions.defaults();

    public static CompilerContext defaults() {
        return CompilerContext.builder().build();
    }
}
