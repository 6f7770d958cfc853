package com.schemacraft.generator.codegen;

import lombok.Builder;
import lombok.Value;

/**
 * How one schema data type is represented in generated code and storage.
 */
@Value
@Builder
public class TypeMapping {

    /** Simple Java type name used in field declarations. */
    String javaType;

    /** Import needed for {@link #javaType}, or {@code null} for java.lang and primitives. */
    String importName;

    /** Whether text search covers fields of this type. */
    boolean textual;

    /** Explicit column definition, e.g. {@code TEXT}; {@code null} for the JPA default. */
    String columnDefinition;

    boolean lob;

    /** Whether a declared max length applies as the column length. */
    boolean sized;

    /** Whether the column gets a fixed precision and scale. */
    boolean exactNumeric;
}
