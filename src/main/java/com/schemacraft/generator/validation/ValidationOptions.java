package com.schemacraft.generator.validation;

import lombok.Builder;
import lombok.Value;

/**
 * Policy switches for {@link SchemaValidator}.
 */
@Value
@Builder(toBuilder = true)
public class ValidationOptions {

    /**
     * When set, a relationship whose source and target are the same entity is reported as a
     * warning instead of an error. Off by default.
     */
    boolean allowSelfReferences;

    public static ValidationOptions defaults() {
        return ValidationOptions.builder().build();
    }
}
