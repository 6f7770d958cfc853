package com.schemacraft.generator.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single attribute (column) of an {@link Entity}.
 *
 * Foreign-key reference fields are the only part of the IR the reconciler rewrites, and it
 * does so by building a new instance through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class Attribute {
    String name;
    DataType dataType;
    boolean primaryKey;
    boolean foreignKey;

    @Builder.Default
    boolean nullable = true;

    boolean unique;
    Integer maxLength;
    String defaultValue;

    /**
     * Name of the entity a foreign key points at (wire field {@code referencesTable}).
     */
    String referencedEntity;

    /**
     * Name of the attribute a foreign key points at (wire field {@code referencesColumn}).
     */
    String referencedAttribute;

    public boolean hasReference() {
        return foreignKey && referencedEntity != null && !referencedEntity.isBlank()
                && referencedAttribute != null && !referencedAttribute.isBlank();
    }
}
