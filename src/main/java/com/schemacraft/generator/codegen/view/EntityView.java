package com.schemacraft.generator.codegen.view;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Template view of one entity: every name the per-entity units need, resolved once.
 */
@Value
@Builder
public class EntityView {
    String name;
    String className;
    String variableName;
    String tableName;
    String resourcePath;

    String repositoryName;
    String serviceName;
    String handlerName;
    String handlerVariable;
    String routesName;

    @Singular
    List<FieldView> fields;

    /** Field names a create or update request must carry. */
    @Singular
    List<String> requiredFields;

    /** Field names covered by text search. */
    @Singular
    List<String> searchFields;

    /** Rendered {@code @Index} entries for the table, one per foreign-key column. */
    @Singular("index")
    List<String> indexes;

    /** Rendered import block of the entity class. */
    String modelImports;

    public boolean isSearchable() {
        return !searchFields.isEmpty();
    }
}
