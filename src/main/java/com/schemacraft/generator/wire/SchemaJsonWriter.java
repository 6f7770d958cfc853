package com.schemacraft.generator.wire;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Relationship;
import com.schemacraft.generator.model.Schema;
import com.schemacraft.generator.normalize.WireKeys;

/**
 * Writes the schema IR back out in its canonical camelCase wire form.
 *
 * Output read by {@link com.schemacraft.generator.normalize.SchemaNormalizer} yields an equal
 * schema. Absent optional values are omitted rather than written as {@code null}.
 */
public class SchemaJsonWriter {

    private final ObjectMapper mapper;

    public SchemaJsonWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toTree(Schema schema) {
        ObjectNode root = mapper.createObjectNode();
        putIfPresent(root, WireKeys.PROJECT_NAME, schema.getProjectName());

        ArrayNode entities = root.putArray(WireKeys.canonical(WireKeys.ENTITIES));
        for (Entity entity : schema.getEntities()) {
            entities.add(writeEntity(entity));
        }

        ArrayNode relationships = root.putArray(WireKeys.canonical(WireKeys.RELATIONSHIPS));
        for (Relationship relationship : schema.getRelationships()) {
            relationships.add(writeRelationship(relationship));
        }

        if (!schema.getMetadata().isEmpty()) {
            root.set(WireKeys.canonical(WireKeys.METADATA), mapper.valueToTree(schema.getMetadata()));
        }
        return root;
    }

    public String toJson(Schema schema) {
        try {
            return mapper.writeValueAsString(toTree(schema));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize schema", e);
        }
    }

    public void write(Schema schema, Path file) throws IOException {
        mapper.writeValue(file.toFile(), toTree(schema));
    }

    private ObjectNode writeEntity(Entity entity) {
        ObjectNode node = mapper.createObjectNode();
        putIfPresent(node, WireKeys.NAME, entity.getName());
        putIfPresent(node, WireKeys.TABLE_NAME, entity.getTableName());
        ArrayNode attributes = node.putArray(WireKeys.canonical(WireKeys.ATTRIBUTES));
        for (Attribute attribute : entity.getAttributes()) {
            attributes.add(writeAttribute(attribute));
        }
        return node;
    }

    private ObjectNode writeAttribute(Attribute attribute) {
        ObjectNode node = mapper.createObjectNode();
        putIfPresent(node, WireKeys.NAME, attribute.getName());
        if (attribute.getDataType() != null) {
            node.put(WireKeys.canonical(WireKeys.DATA_TYPE), attribute.getDataType().getLabel());
        }
        node.put(WireKeys.canonical(WireKeys.PRIMARY_KEY), attribute.isPrimaryKey());
        node.put(WireKeys.canonical(WireKeys.FOREIGN_KEY), attribute.isForeignKey());
        node.put(WireKeys.canonical(WireKeys.NULLABLE), attribute.isNullable());
        node.put(WireKeys.canonical(WireKeys.UNIQUE), attribute.isUnique());
        if (attribute.getMaxLength() != null) {
            node.put(WireKeys.canonical(WireKeys.MAX_LENGTH), attribute.getMaxLength());
        }
        putIfPresent(node, WireKeys.DEFAULT_VALUE, attribute.getDefaultValue());
        putIfPresent(node, WireKeys.REFERENCES_TABLE, attribute.getReferencedEntity());
        putIfPresent(node, WireKeys.REFERENCES_COLUMN, attribute.getReferencedAttribute());
        return node;
    }

    private ObjectNode writeRelationship(Relationship relationship) {
        ObjectNode node = mapper.createObjectNode();
        putIfPresent(node, WireKeys.NAME, relationship.getName());
        putIfPresent(node, WireKeys.SOURCE_ENTITY, relationship.getSourceEntity());
        putIfPresent(node, WireKeys.TARGET_ENTITY, relationship.getTargetEntity());
        if (relationship.getType() != null) {
            node.put(WireKeys.canonical(WireKeys.RELATIONSHIP_TYPE), relationship.getType().getLabel());
        }
        putIfPresent(node, WireKeys.SOURCE_CARDINALITY, relationship.getSourceCardinality());
        putIfPresent(node, WireKeys.TARGET_CARDINALITY, relationship.getTargetCardinality());
        return node;
    }

    private static void putIfPresent(ObjectNode node, List<String> aliases, String value) {
        if (value != null) {
            node.put(WireKeys.canonical(aliases), value);
        }
    }
}
