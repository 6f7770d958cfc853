package com.schemacraft.generator.normalize;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacraft.generator.intake.RawDocument;
import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.DataType;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Relationship;
import com.schemacraft.generator.model.RelationshipType;
import com.schemacraft.generator.model.Schema;
import com.schemacraft.generator.pipeline.StageError;
import com.schemacraft.generator.pipeline.StageErrorKind;
import com.schemacraft.generator.pipeline.StageResult;

/**
 * Maps a {@link RawDocument} onto the schema IR.
 *
 * Only shape is enforced here (an entities array of objects, attribute and relationship
 * arrays where present). Values are coerced, never rejected: unknown type labels become
 * {@link DataType#STRING}, unknown relationship labels become {@link RelationshipType#ONE_TO_MANY}.
 */
public class SchemaNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    public StageResult<Schema> normalize(RawDocument document) {
        return normalize(document.getRoot());
    }

    public StageResult<Schema> normalize(ObjectNode root) {
        JsonNode entitiesNode = field(root, WireKeys.ENTITIES);
        if (entitiesNode == null || entitiesNode.isNull()) {
            return failure("Document has no entities array");
        }
        if (!entitiesNode.isArray()) {
            return failure("'entities' must be an array, got " + entitiesNode.getNodeType());
        }

        Schema.SchemaBuilder schema = Schema.builder()
                .projectName(text(root, WireKeys.PROJECT_NAME));

        int index = 0;
        for (JsonNode entityNode : entitiesNode) {
            index++;
            if (!entityNode.isObject()) {
                return failure("Entity " + index + " is not an object");
            }
            JsonNode attributesNode = field(entityNode, WireKeys.ATTRIBUTES);
            if (attributesNode != null && !attributesNode.isNull() && !attributesNode.isArray()) {
                return failure("Attributes of entity " + index + " must be an array");
            }

            Entity.EntityBuilder entity = Entity.builder()
                    .name(text(entityNode, WireKeys.NAME))
                    .tableName(text(entityNode, WireKeys.TABLE_NAME));

            if (attributesNode != null && attributesNode.isArray()) {
                int attrIndex = 0;
                for (JsonNode attributeNode : attributesNode) {
                    attrIndex++;
                    if (!attributeNode.isObject()) {
                        return failure("Attribute " + attrIndex + " of entity " + index + " is not an object");
                    }
                    entity.attribute(toAttribute(attributeNode));
                }
            }
            schema.entity(entity.build());
        }

        JsonNode relationshipsNode = field(root, WireKeys.RELATIONSHIPS);
        if (relationshipsNode != null && !relationshipsNode.isNull()) {
            if (!relationshipsNode.isArray()) {
                return failure("'relationships' must be an array, got " + relationshipsNode.getNodeType());
            }
            int relIndex = 0;
            for (JsonNode relationshipNode : relationshipsNode) {
                relIndex++;
                if (!relationshipNode.isObject()) {
                    return failure("Relationship " + relIndex + " is not an object");
                }
                schema.relationship(toRelationship(relationshipNode));
            }
        }

        JsonNode metadataNode = field(root, WireKeys.METADATA);
        if (metadataNode != null && metadataNode.isObject()) {
            Map<String, Object> metadata = MAPPER.convertValue(metadataNode, METADATA_TYPE);
            schema.metadata(metadata);
        }

        Schema result = schema.build();
        log.debug("Normalized {} entities and {} relationships",
                result.getEntities().size(), result.getRelationships().size());
        return StageResult.success(result);
    }

    private Attribute toAttribute(JsonNode node) {
        String typeLabel = text(node, WireKeys.DATA_TYPE);
        DataType dataType = DataType.coerce(typeLabel);
        if (typeLabel != null && DataType.fromLabel(typeLabel).isEmpty()) {
            log.debug("Unknown data type '{}' coerced to {}", typeLabel, dataType.getLabel());
        }

        return Attribute.builder()
                .name(text(node, WireKeys.NAME))
                .dataType(dataType)
                .primaryKey(bool(node, WireKeys.PRIMARY_KEY, false))
                .foreignKey(bool(node, WireKeys.FOREIGN_KEY, false))
                .nullable(bool(node, WireKeys.NULLABLE, true))
                .unique(bool(node, WireKeys.UNIQUE, false))
                .maxLength(integer(node, WireKeys.MAX_LENGTH))
                .defaultValue(scalarOrJson(node, WireKeys.DEFAULT_VALUE))
                .referencedEntity(text(node, WireKeys.REFERENCES_TABLE))
                .referencedAttribute(text(node, WireKeys.REFERENCES_COLUMN))
                .build();
    }

    private Relationship toRelationship(JsonNode node) {
        String typeLabel = text(node, WireKeys.RELATIONSHIP_TYPE);
        RelationshipType type = RelationshipType.coerce(typeLabel);
        if (typeLabel != null && RelationshipType.fromLabel(typeLabel).isEmpty()) {
            log.debug("Unknown relationship type '{}' coerced to {}", typeLabel, type.getLabel());
        }

        return Relationship.builder()
                .name(text(node, WireKeys.NAME))
                .sourceEntity(text(node, WireKeys.SOURCE_ENTITY))
                .targetEntity(text(node, WireKeys.TARGET_ENTITY))
                .type(type)
                .sourceCardinality(text(node, WireKeys.SOURCE_CARDINALITY))
                .targetCardinality(text(node, WireKeys.TARGET_CARDINALITY))
                .build();
    }

    private static JsonNode field(JsonNode node, List<String> aliases) {
        for (String alias : aliases) {
            JsonNode value = node.get(alias);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, List<String> aliases) {
        JsonNode value = field(node, aliases);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static boolean bool(JsonNode node, List<String> aliases, boolean defaultValue) {
        JsonNode value = field(node, aliases);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.intValue() != 0;
        }
        if (value.isTextual()) {
            String s = value.textValue().trim();
            if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("yes") || s.equals("1")) {
                return true;
            }
            if (s.equalsIgnoreCase("false") || s.equalsIgnoreCase("no") || s.equals("0")) {
                return false;
            }
        }
        return defaultValue;
    }

    private static Integer integer(JsonNode node, List<String> aliases) {
        JsonNode value = field(node, aliases);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.textValue().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric length '{}'", value.textValue());
                return null;
            }
        }
        return null;
    }

    private static String scalarOrJson(JsonNode node, List<String> aliases) {
        JsonNode value = field(node, aliases);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isContainerNode() ? value.toString() : value.asText();
    }

    private static StageResult<Schema> failure(String message) {
        log.warn("Normalization failed: {}", message);
        return StageResult.failure(StageError.of(StageErrorKind.NORMALIZATION, message));
    }
}
