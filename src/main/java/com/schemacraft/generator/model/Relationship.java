package com.schemacraft.generator.model;

import lombok.Builder;
import lombok.Value;

/**
 * A relationship between two entities, referenced by name.
 */
@Value
@Builder(toBuilder = true)
public class Relationship {
    String name;
    String sourceEntity;
    String targetEntity;
    RelationshipType type;
    String sourceCardinality;
    String targetCardinality;

    public boolean isSelfReference() {
        return sourceEntity != null && sourceEntity.equals(targetEntity);
    }

    public boolean involves(String entityName) {
        return entityName != null && (entityName.equals(sourceEntity) || entityName.equals(targetEntity));
    }
}
