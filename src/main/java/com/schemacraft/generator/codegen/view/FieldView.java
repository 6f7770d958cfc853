package com.schemacraft.generator.codegen.view;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template view of one declared attribute. Every string is already safe to emit.
 */
@Value
@Builder
public class FieldView {
    String attributeName;
    String fieldName;
    String javaType;
    String columnName;

    @Singular
    List<String> annotations;

    /** Single-line remark placed above the field, or {@code null}. */
    String comment;

    String getterName;
    String setterName;
    boolean required;
    boolean textual;
}
