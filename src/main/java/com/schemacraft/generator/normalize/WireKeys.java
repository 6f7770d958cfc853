package com.schemacraft.generator.normalize;

import java.util.List;

/**
 * Field names of the canonical IR wire format, with the spellings accepted on intake.
 *
 * The first name of each list is the canonical one and is what the writer emits; the rest
 * are the snake_case and shorthand forms extraction output uses.
 */
public final class WireKeys {

    public static final List<String> PROJECT_NAME = List.of("projectName", "project_name");
    public static final List<String> ENTITIES = List.of("entities");
    public static final List<String> RELATIONSHIPS = List.of("relationships");
    public static final List<String> METADATA = List.of("metadata");

    public static final List<String> NAME = List.of("name");
    public static final List<String> ATTRIBUTES = List.of("attributes", "fields", "columns");
    public static final List<String> TABLE_NAME = List.of("tableName", "table_name");

    public static final List<String> DATA_TYPE = List.of("dataType", "data_type", "type");
    public static final List<String> PRIMARY_KEY = List.of("isPrimaryKey", "is_primary_key", "primaryKey", "primary_key");
    public static final List<String> FOREIGN_KEY = List.of("isForeignKey", "is_foreign_key", "foreignKey", "foreign_key");
    public static final List<String> NULLABLE = List.of("isNullable", "is_nullable", "nullable");
    public static final List<String> UNIQUE = List.of("isUnique", "is_unique", "unique");
    public static final List<String> MAX_LENGTH = List.of("maxLength", "max_length");
    public static final List<String> DEFAULT_VALUE = List.of("defaultValue", "default_value", "default");
    public static final List<String> REFERENCES_TABLE = List.of("referencesTable", "references_table");
    public static final List<String> REFERENCES_COLUMN = List.of("referencesColumn", "references_column");

    public static final List<String> SOURCE_ENTITY = List.of("sourceEntity", "source_entity", "source");
    public static final List<String> TARGET_ENTITY = List.of("targetEntity", "target_entity", "target");
    public static final List<String> RELATIONSHIP_TYPE = List.of("relationshipType", "relationship_type", "type", "cardinality");
    public static final List<String> SOURCE_CARDINALITY = List.of("sourceCardinality", "source_cardinality");
    public static final List<String> TARGET_CARDINALITY = List.of("targetCardinality", "target_cardinality");

    private WireKeys() {
        // Constants only
    }

    public static String canonical(List<String> aliases) {
        return aliases.get(0);
    }
}
