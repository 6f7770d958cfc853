package com.schemacraft.generator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * An entity of the schema IR, with its attributes in declaration order.
 */
@Value
@Builder(toBuilder = true)
public class Entity {
    String name;

    @Singular
    List<Attribute> attributes;

    /**
     * Explicit storage table name; wins over the derived one when present.
     */
    String tableName;

    public Optional<Attribute> findAttribute(String attributeName) {
        return attributes.stream()
                .filter(a -> a.getName() != null && a.getName().equals(attributeName))
                .findFirst();
    }

    public boolean hasPrimaryKey() {
        return attributes.stream().anyMatch(Attribute::isPrimaryKey);
    }

    public boolean hasTableName() {
        return tableName != null && !tableName.isBlank();
    }
}
