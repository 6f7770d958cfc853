package com.schemacraft.generator.analysis;

/**
 * Instruction prompt sent with every diagram.
 *
 * The JSON layout it asks for is the snake_case form the normalizer accepts.
 */
public final class ErdAnalysisPrompt {

    static final String BASE_PROMPT = """
            You are given an image of an entity-relationship diagram. Extract its schema as JSON.

            For every entity report its name in PascalCase, an optional storage table name and
            all of its attributes. For every attribute report its name in snake_case, its data
            type, and whether it is a primary key, a foreign key, nullable or unique. Report a
            maximum length and a default value where the diagram shows one. For foreign keys
            report the referenced entity and attribute.

            For every relationship report the source entity, the target entity, the relationship
            type (1:1, 1:N, N:1 or M:N) and any cardinality annotations.

            Allowed data types: string, integer, float, boolean, date, datetime, text, json, uuid,
            decimal, enum, array, time, blob, binary, char, varchar, longtext, tinyint, smallint,
            bigint, double, real, timestamp, year, set. Use string when unsure.

            Answer with a single JSON object of this shape and nothing else:
            {
              "project_name": "string or null",
              "entities": [
                {
                  "name": "EntityName",
                  "table_name": "table_name or null",
                  "attributes": [
                    {
                      "name": "attribute_name",
                      "data_type": "string",
                      "is_primary_key": false,
                      "is_foreign_key": false,
                      "is_nullable": true,
                      "is_unique": false,
                      "max_length": null,
                      "default_value": null,
                      "references_table": null,
                      "references_column": null
                    }
                  ]
                }
              ],
              "relationships": [
                {
                  "name": "relationship_name or null",
                  "source_entity": "SourceEntity",
                  "target_entity": "TargetEntity",
                  "relationship_type": "1:N",
                  "source_cardinality": null,
                  "target_cardinality": null
                }
              ],
              "metadata": {
                "confidence_score": 0.0,
                "notes": "observations about the diagram"
              }
            }
            """;

    private ErdAnalysisPrompt() {
        // Constants only
    }

    /**
     * The prompt, with the caller's hint appended when there is one.
     */
    public static String build(String hint) {
        if (hint == null || hint.isBlank()) {
            return BASE_PROMPT;
        }
        return BASE_PROMPT + "\nAdditional context: " + hint.trim() + "\n";
    }
}
