package com.schemacraft.generator.validation;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.codegen.util.NamingUtil;
import com.schemacraft.generator.codegen.view.EntityViewFactory;
import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Relationship;
import com.schemacraft.generator.model.Schema;

/**
 * Checks a schema in two phases and returns every problem found as data.
 *
 * <p>The structural phase looks at each element on its own (names present, types present,
 * lengths positive). The semantic phase looks across elements (uniqueness, relationship
 * endpoints, foreign-key targets, primary keys). Neither phase stops at the first problem and
 * neither throws for bad input.
 *
 * <p>Entities without attributes or without a name already carry a structural error and
 * never receive warnings.
 */
public class SchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private final ValidationOptions options;

    public SchemaValidator() {
        this(ValidationOptions.defaults());
    }

    public SchemaValidator(ValidationOptions options) {
        this.options = options;
    }

    public ValidationResult validate(Schema schema) {
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder()
                .statistics(SchemaStatistics.of(schema));

        validateStructure(schema, result);
        validateSemantics(schema, result);

        ValidationResult validation = result.build();
        log.info("Validation finished: {} errors, {} warnings",
                validation.getErrors().size(), validation.getWarnings().size());
        validation.getErrors().forEach(e -> log.debug("Error: {}", e.describe()));
        validation.getWarnings().forEach(w -> log.debug("Warning: {}", w.describe()));
        return validation;
    }

    // ---- structural phase ----

    private void validateStructure(Schema schema, ValidationResult.ValidationResultBuilder result) {
        if (schema.getEntities().isEmpty()) {
            result.error(issue(IssueCode.NO_ENTITIES, Severity.ERROR,
                    "Schema must contain at least one entity", null, null));
        }

        int entityIndex = 0;
        for (Entity entity : schema.getEntities()) {
            entityIndex++;
            String label = isBlank(entity.getName()) ? "Entity " + entityIndex : "Entity " + entity.getName();
            if (isBlank(entity.getName())) {
                result.error(issue(IssueCode.ENTITY_NAME_MISSING, Severity.ERROR,
                        label + ": name is required", null, null));
            }
            if (entity.getAttributes().isEmpty()) {
                result.error(issue(IssueCode.ENTITY_WITHOUT_ATTRIBUTES, Severity.ERROR,
                        label + ": must have at least one attribute", entity.getName(), null));
            }

            int attributeIndex = 0;
            for (Attribute attribute : entity.getAttributes()) {
                attributeIndex++;
                if (isBlank(attribute.getName())) {
                    result.error(issue(IssueCode.ATTRIBUTE_NAME_MISSING, Severity.ERROR,
                            label + ", attribute " + attributeIndex + ": name is required",
                            entity.getName(), null));
                }
                String attributeLabel = label + ", attribute "
                        + (isBlank(attribute.getName()) ? String.valueOf(attributeIndex) : attribute.getName());
                if (attribute.getDataType() == null) {
                    result.error(issue(IssueCode.ATTRIBUTE_TYPE_MISSING, Severity.ERROR,
                            attributeLabel + ": data type is required", entity.getName(), attribute.getName()));
                }
                if (attribute.getMaxLength() != null && attribute.getMaxLength() <= 0) {
                    result.error(issue(IssueCode.INVALID_MAX_LENGTH, Severity.ERROR,
                            attributeLabel + ": max length must be positive, got " + attribute.getMaxLength(),
                            entity.getName(), attribute.getName()));
                }
            }
        }

        int relationshipIndex = 0;
        for (Relationship relationship : schema.getRelationships()) {
            relationshipIndex++;
            String label = relationshipLabel(relationship, relationshipIndex);
            if (isBlank(relationship.getSourceEntity())) {
                result.error(issue(IssueCode.RELATIONSHIP_ENDPOINT_MISSING, Severity.ERROR,
                        label + ": source entity is required", null, null));
            }
            if (isBlank(relationship.getTargetEntity())) {
                result.error(issue(IssueCode.RELATIONSHIP_ENDPOINT_MISSING, Severity.ERROR,
                        label + ": target entity is required", null, null));
            }
            if (relationship.getType() == null) {
                result.error(issue(IssueCode.RELATIONSHIP_TYPE_MISSING, Severity.ERROR,
                        label + ": relationship type is required", null, null));
            }
        }
    }

    // ---- semantic phase ----

    private void validateSemantics(Schema schema, ValidationResult.ValidationResultBuilder result) {
        Set<String> entityNames = new HashSet<>();
        Map<String, String> classOwners = new LinkedHashMap<>();
        Map<String, String> storageOwners = new LinkedHashMap<>();
        for (Entity entity : schema.getEntities()) {
            if (isBlank(entity.getName())) {
                continue;
            }
            if (!entityNames.add(entity.getName())) {
                result.error(issue(IssueCode.DUPLICATE_ENTITY, Severity.ERROR,
                        "Duplicate entity name: " + entity.getName(), entity.getName(), null));
                continue;
            }
            String className = NamingUtil.toEntityClassName(entity.getName());
            String owner = classOwners.putIfAbsent(className, entity.getName());
            if (owner != null) {
                result.error(issue(IssueCode.CLASS_NAME_COLLISION, Severity.ERROR,
                        "Entities %s and %s both map to class %s".formatted(owner, entity.getName(), className),
                        entity.getName(), null));
                checkAttributeNames(entity, result);
                continue;
            }
            // table name and resource path share one key
            String storageName = EntityViewFactory.storageName(entity);
            String storageOwner = storageOwners.putIfAbsent(storageName.toLowerCase(Locale.ROOT), entity.getName());
            if (storageOwner != null) {
                result.error(issue(IssueCode.STORAGE_NAME_COLLISION, Severity.ERROR,
                        "Entities %s and %s both map to table %s".formatted(storageOwner, entity.getName(), storageName),
                        entity.getName(), null));
            }
            checkAttributeNames(entity, result);
        }

        int relationshipIndex = 0;
        for (Relationship relationship : schema.getRelationships()) {
            relationshipIndex++;
            checkRelationship(schema, relationship, relationshipIndex, result);
        }

        for (Entity entity : schema.getEntities()) {
            for (Attribute attribute : entity.getAttributes()) {
                checkReference(schema, entity, attribute, result);
            }
        }

        for (Entity entity : schema.getEntities()) {
            if (isBlank(entity.getName()) || entity.getAttributes().isEmpty()) {
                continue;
            }
            if (!entity.hasPrimaryKey()) {
                result.warning(issue(IssueCode.MISSING_PRIMARY_KEY, Severity.WARNING,
                        "Entity " + entity.getName() + " has no primary key attribute", entity.getName(), null));
            }
            boolean related = schema.getRelationships().stream().anyMatch(r -> r.involves(entity.getName()));
            if (!related) {
                result.warning(issue(IssueCode.UNRELATED_ENTITY, Severity.WARNING,
                        "Entity " + entity.getName() + " is not part of any relationship", entity.getName(), null));
            }
        }
    }

    private void checkAttributeNames(Entity entity, ValidationResult.ValidationResultBuilder result) {
        Set<String> names = new HashSet<>();
        Map<String, String> fieldOwners = new LinkedHashMap<>();
        for (Attribute attribute : entity.getAttributes()) {
            String name = attribute.getName();
            if (isBlank(name)) {
                continue;
            }
            if (!names.add(name)) {
                result.error(issue(IssueCode.DUPLICATE_ATTRIBUTE, Severity.ERROR,
                        "Entity " + entity.getName() + ": duplicate attribute name: " + name,
                        entity.getName(), name));
                continue;
            }
            String fieldName = NamingUtil.toFieldName(name);
            String owner = fieldOwners.putIfAbsent(fieldName, name);
            if (owner != null) {
                result.error(issue(IssueCode.FIELD_NAME_COLLISION, Severity.ERROR,
                        "Entity %s: attributes %s and %s both map to field %s"
                                .formatted(entity.getName(), owner, name, fieldName),
                        entity.getName(), name));
            }
        }
    }

    private void checkRelationship(Schema schema, Relationship relationship, int index,
                                   ValidationResult.ValidationResultBuilder result) {
        String label = relationshipLabel(relationship, index);
        String source = relationship.getSourceEntity();
        String target = relationship.getTargetEntity();

        if (!isBlank(source) && relationship.isSelfReference()) {
            String message = label + " (" + source + " -> " + target + "): self-referencing relationship";
            if (options.isAllowSelfReferences()) {
                result.warning(issue(IssueCode.SELF_REFERENCE, Severity.WARNING, message, source, null));
            } else {
                result.error(issue(IssueCode.SELF_REFERENCE, Severity.ERROR,
                        message + " is not allowed", source, null));
            }
        }

        for (String endpoint : List.of(nullToEmpty(source), nullToEmpty(target))) {
            if (!endpoint.isBlank() && schema.findEntity(endpoint).isEmpty()) {
                result.error(issue(IssueCode.UNKNOWN_RELATIONSHIP_ENTITY, Severity.ERROR,
                        label + ": entity " + endpoint + " does not exist", endpoint, null));
                if (relationship.isSelfReference()) {
                    break;
                }
            }
        }
    }

    private void checkReference(Schema schema, Entity entity, Attribute attribute,
                                ValidationResult.ValidationResultBuilder result) {
        if (!attribute.hasReference()) {
            return;
        }
        String targetEntity = attribute.getReferencedEntity();
        String targetAttribute = attribute.getReferencedAttribute();
        String prefix = "Entity %s, attribute %s: foreign key references %s.%s"
                .formatted(entity.getName(), attribute.getName(), targetEntity, targetAttribute);

        Optional<Entity> target = schema.findEntity(targetEntity);
        if (target.isEmpty()) {
            result.error(issue(IssueCode.DANGLING_REFERENCE, Severity.ERROR,
                    prefix + ", but entity " + targetEntity + " does not exist",
                    entity.getName(), attribute.getName()));
        } else if (target.get().findAttribute(targetAttribute).isEmpty()) {
            result.error(issue(IssueCode.DANGLING_REFERENCE, Severity.ERROR,
                    prefix + ", but " + targetEntity + " has no attribute " + targetAttribute,
                    entity.getName(), attribute.getName()));
        }
    }

    private static ValidationIssue issue(IssueCode code, Severity severity, String message,
                                         String entityName, String attributeName) {
        return ValidationIssue.builder()
                .code(code)
                .severity(severity)
                .message(message)
                .entityName(entityName)
                .attributeName(attributeName)
                .build();
    }

    private static String relationshipLabel(Relationship relationship, int index) {
        return isBlank(relationship.getName())
                ? "Relationship " + index
                : "Relationship " + relationship.getName();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
