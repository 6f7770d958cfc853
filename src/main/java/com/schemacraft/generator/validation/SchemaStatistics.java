package com.schemacraft.generator.validation;

import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Schema;

import lombok.Builder;
import lombok.Value;

/**
 * Counts reported alongside a validation run.
 */
@Value
@Builder
public class SchemaStatistics {
    int entityCount;
    int relationshipCount;
    int attributeCount;
    int primaryKeyCount;
    int foreignKeyCount;
    double averageAttributesPerEntity;

    public static SchemaStatistics of(Schema schema) {
        int attributes = 0;
        int primaryKeys = 0;
        int foreignKeys = 0;
        for (Entity entity : schema.getEntities()) {
            for (Attribute attribute : entity.getAttributes()) {
                attributes++;
                if (attribute.isPrimaryKey()) {
                    primaryKeys++;
                }
                if (attribute.isForeignKey()) {
                    foreignKeys++;
                }
            }
        }
        int entities = schema.getEntities().size();
        return SchemaStatistics.builder()
                .entityCount(entities)
                .relationshipCount(schema.getRelationships().size())
                .attributeCount(attributes)
                .primaryKeyCount(primaryKeys)
                .foreignKeyCount(foreignKeys)
                .averageAttributesPerEntity(entities == 0 ? 0.0 : (double) attributes / entities)
                .build();
    }
}
