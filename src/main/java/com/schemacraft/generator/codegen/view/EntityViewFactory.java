package com.schemacraft.generator.codegen.view;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.TypeMapping;
import com.schemacraft.generator.codegen.TypeMappingTable;
import com.schemacraft.generator.codegen.util.ImportManager;
import com.schemacraft.generator.codegen.util.NamingUtil;
import com.schemacraft.generator.codegen.util.SourceText;
import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.Entity;

/**
 * Resolves an {@link Entity} into the names, types and annotations its generated units use.
 *
 * <p>Every entity class gets an implicit {@code Long id} and two audit timestamps. A declared
 * attribute whose field name is one of those ({@code id}, {@code createdAt},
 * {@code updatedAt}) is represented by the implicit field and not emitted twice.
 */
public class EntityViewFactory {
    private static final Logger log = LoggerFactory.getLogger(EntityViewFactory.class);

    static final Set<String> IMPLICIT_FIELDS = Set.of("id", "createdAt", "updatedAt");

    private static final List<String> MODEL_IMPORTS = List.of(
            "jakarta.persistence.Column",
            "jakarta.persistence.Entity",
            "jakarta.persistence.GeneratedValue",
            "jakarta.persistence.GenerationType",
            "jakarta.persistence.Id",
            "jakarta.persistence.Table",
            "java.time.LocalDateTime",
            "lombok.Getter",
            "lombok.NoArgsConstructor",
            "lombok.Setter",
            "org.hibernate.annotations.CreationTimestamp",
            "org.hibernate.annotations.UpdateTimestamp");

    private final ProjectLayout layout;

    public EntityViewFactory(ProjectLayout layout) {
        this.layout = layout;
    }

    public EntityView create(Entity entity) {
        String className = NamingUtil.toEntityClassName(entity.getName());
        String storageName = storageName(entity);

        ImportManager imports = new ImportManager(layout.packageName("model")).addImports(MODEL_IMPORTS);
        List<FieldView> fields = new ArrayList<>();
        List<String> indexes = new ArrayList<>();
        for (Attribute attribute : entity.getAttributes()) {
            String fieldName = NamingUtil.toFieldName(attribute.getName());
            if (IMPLICIT_FIELDS.contains(fieldName)) {
                log.debug("{}.{} is covered by the implicit {} field", entity.getName(), attribute.getName(), fieldName);
                continue;
            }
            TypeMapping mapping = TypeMappingTable.get(attribute.getDataType());
            imports.addImport(mapping.getImportName());
            if (mapping.isLob()) {
                imports.addImport("jakarta.persistence.Lob");
            }
            FieldView field = toField(attribute, fieldName, mapping);
            fields.add(field);
            if (attribute.isForeignKey() && !attribute.isUnique() && !attribute.isPrimaryKey()) {
                indexes.add(indexAnnotation(storageName, field.getColumnName()));
            }
        }
        if (!indexes.isEmpty()) {
            imports.addImport("jakarta.persistence.Index");
        }

        EntityView.EntityViewBuilder view = EntityView.builder()
                .name(SourceText.comment(entity.getName()))
                .className(className)
                .variableName(NamingUtil.toFieldName(className))
                .tableName(SourceText.literal(storageName))
                .resourcePath(SourceText.literal("/" + storageName))
                .repositoryName(className + "Repository")
                .serviceName(className + "Service")
                .handlerName(className + "Handler")
                .handlerVariable(NamingUtil.toFieldName(className) + "Handler")
                .routesName(className + "Routes")
                .fields(fields)
                .indexes(indexes)
                .modelImports(imports.generateImports());

        for (FieldView field : fields) {
            if (field.isRequired()) {
                view.requiredField(field.getFieldName());
            }
            if (field.isTextual()) {
                view.searchField(field.getFieldName());
            }
        }
        return view.build();
    }

    /**
     * Table name and resource path segment: the explicit override, else snake_case of the name.
     */
    public static String storageName(Entity entity) {
        if (entity.hasTableName()) {
            String override = entity.getTableName().trim();
            return override.startsWith("/") ? override.substring(1) : override;
        }
        return NamingUtil.toSnakeCase(entity.getName());
    }

    private FieldView toField(Attribute attribute, String fieldName, TypeMapping mapping) {
        String columnName = NamingUtil.toSnakeCase(attribute.getName());
        boolean required = !attribute.isNullable() || attribute.isPrimaryKey();

        FieldView.FieldViewBuilder field = FieldView.builder()
                .attributeName(SourceText.comment(attribute.getName()))
                .fieldName(fieldName)
                .javaType(mapping.getJavaType())
                .columnName(columnName)
                .comment(comment(attribute))
                .getterName("get" + capitalize(fieldName))
                .setterName("set" + capitalize(fieldName))
                .required(required)
                .textual(mapping.isTextual());

        if (mapping.isLob()) {
            field.annotation("@Lob");
        }
        field.annotation(columnAnnotation(attribute, columnName, required, mapping));
        return field.build();
    }

    private static String columnAnnotation(Attribute attribute, String columnName, boolean required,
                                           TypeMapping mapping) {
        StringBuilder sb = new StringBuilder("@Column(name = \"").append(SourceText.literal(columnName)).append('"');
        if (required) {
            sb.append(", nullable = false");
        }
        if (attribute.isUnique() || attribute.isPrimaryKey()) {
            sb.append(", unique = true");
        }
        if (mapping.getColumnDefinition() != null) {
            sb.append(", columnDefinition = \"").append(mapping.getColumnDefinition()).append('"');
        } else if (mapping.isSized() && attribute.getMaxLength() != null && attribute.getMaxLength() > 0) {
            sb.append(", length = ").append(attribute.getMaxLength());
        } else if (mapping.isExactNumeric()) {
            sb.append(", precision = 19, scale = 4");
        }
        return sb.append(')').toString();
    }

    // unique and key columns are already indexed by their constraint
    private static String indexAnnotation(String storageName, String columnName) {
        return "@Index(name = \"" + SourceText.literal("idx_" + storageName + "_" + columnName)
                + "\", columnList = \"" + SourceText.literal(columnName) + "\")";
    }

    private static String comment(Attribute attribute) {
        List<String> notes = new ArrayList<>();
        if (attribute.isPrimaryKey()) {
            notes.add("Natural key");
        }
        if (attribute.hasReference()) {
            notes.add("References " + attribute.getReferencedEntity() + "." + attribute.getReferencedAttribute());
        }
        if (attribute.getDefaultValue() != null) {
            notes.add("Default: " + attribute.getDefaultValue());
        }
        return notes.isEmpty() ? null : SourceText.comment(String.join("; ", notes));
    }

    private static String capitalize(String fieldName) {
        return Character.toUpperCase(fieldName.charAt(0)) + fieldName.substring(1);
    }
}
