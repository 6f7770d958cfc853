package com.schemacraft.generator.validation;

import org.junit.jupiter.api.Test;

import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.DataType;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Relationship;
import com.schemacraft.generator.model.RelationshipType;
import com.schemacraft.generator.model.Schema;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaValidator.
 */
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void testValidSchemaHasNoIssues() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id"), column("name")))
                .entity(entity("Order", pk("order_id"), reference("customer_id", "Customer", "customer_id")))
                .relationship(relationship("Customer", "Order"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testNoEntities() {
        ValidationResult result = validator.validate(Schema.builder().build());

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.NO_ENTITIES);
    }

    @Test
    void testEntityWithoutAttributesIsErrorWithoutWarnings() {
        Schema schema = Schema.builder()
                .entity(Entity.builder().name("Empty").build())
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getCode()).isEqualTo(IssueCode.ENTITY_WITHOUT_ATTRIBUTES);
            assertThat(error.getMessage()).isEqualTo("Entity Empty: must have at least one attribute");
        });
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testMissingPrimaryKeyIsSingleWarning() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id")))
                .entity(entity("Note", column("body")))
                .relationship(relationship("Customer", "Note"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getWarnings()).singleElement().satisfies(warning -> {
            assertThat(warning.getCode()).isEqualTo(IssueCode.MISSING_PRIMARY_KEY);
            assertThat(warning.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(warning.getMessage()).contains("Note");
        });
    }

    @Test
    void testUnrelatedEntityWarning() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id")))
                .entity(entity("Audit", pk("audit_id")))
                .relationship(relationship("Customer", "Customer"))
                .build();

        ValidationResult result = new SchemaValidator(ValidationOptions.builder().allowSelfReferences(true).build())
                .validate(schema);

        assertThat(result.getWarnings())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.SELF_REFERENCE, IssueCode.UNRELATED_ENTITY);
        assertThat(result.getWarningMessages().get(1)).isEqualTo("Entity Audit is not part of any relationship");
    }

    @Test
    void testSelfReferenceIsSingleErrorByDefault() {
        Schema schema = Schema.builder()
                .entity(entity("Employee", pk("employee_id"), column("manager_id")))
                .relationship(relationship("Employee", "Employee"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getCode()).isEqualTo(IssueCode.SELF_REFERENCE);
            assertThat(error.getMessage()).contains("Employee").contains("not allowed");
        });
    }

    @Test
    void testSelfReferenceToUnknownEntityIsReportedOnce() {
        Schema schema = Schema.builder()
                .entity(entity("Employee", pk("employee_id")))
                .relationship(relationship("Ghost", "Ghost"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.SELF_REFERENCE, IssueCode.UNKNOWN_RELATIONSHIP_ENTITY);
    }

    @Test
    void testSelfReferenceAllowedBecomesWarning() {
        Schema schema = Schema.builder()
                .entity(entity("Employee", pk("employee_id")))
                .relationship(relationship("Employee", "Employee"))
                .build();

        ValidationResult result = new SchemaValidator(ValidationOptions.builder().allowSelfReferences(true).build())
                .validate(schema);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.SELF_REFERENCE);
    }

    @Test
    void testUnknownRelationshipEntity() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id")))
                .relationship(relationship("Customer", "Invoice"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrorMessages()).containsExactly("Relationship 1: entity Invoice does not exist");
    }

    @Test
    void testMissingRelationshipEndpoint() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id")))
                .relationship(Relationship.builder().name("orphan").targetEntity("Customer")
                        .type(RelationshipType.ONE_TO_ONE).build())
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getCode()).isEqualTo(IssueCode.RELATIONSHIP_ENDPOINT_MISSING);
            assertThat(error.getPhase()).isEqualTo(ValidationPhase.STRUCTURAL);
            assertThat(error.getMessage()).isEqualTo("Relationship orphan: source entity is required");
        });
    }

    @Test
    void testStructuralAttributeChecks() {
        Schema schema = Schema.builder()
                .entity(entity("Customer",
                        pk("customer_id"),
                        Attribute.builder().dataType(DataType.STRING).build(),
                        Attribute.builder().name("nickname").build(),
                        Attribute.builder().name("code").dataType(DataType.VARCHAR).maxLength(0).build()))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.ATTRIBUTE_NAME_MISSING,
                        IssueCode.ATTRIBUTE_TYPE_MISSING,
                        IssueCode.INVALID_MAX_LENGTH);
        assertThat(result.getErrorMessages()).containsExactly(
                "Entity Customer, attribute 2: name is required",
                "Entity Customer, attribute nickname: data type is required",
                "Entity Customer, attribute code: max length must be positive, got 0");
    }

    @Test
    void testMissingEntityName() {
        Schema schema = Schema.builder()
                .entity(entity(" ", pk("id")))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrorMessages()).containsExactly("Entity 1: name is required");
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void testDuplicateEntities() {
        Schema schema = Schema.builder()
                .entity(entity("User", pk("user_id")))
                .entity(entity("User", pk("user_id")))
                .entity(entity("User", pk("user_id")))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.DUPLICATE_ENTITY, IssueCode.DUPLICATE_ENTITY);
    }

    @Test
    void testClassNameCollision() {
        Schema schema = Schema.builder()
                .entity(entity("order_item", pk("id")))
                .entity(entity("OrderItem", pk("id")))
                .relationship(relationship("order_item", "OrderItem"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrorMessages())
                .containsExactly("Entities order_item and OrderItem both map to class OrderItem");
    }

    @Test
    void testSharedTableNameOverride() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("id")).toBuilder().tableName("items").build())
                .entity(entity("Product", pk("id")).toBuilder().tableName("items").build())
                .relationship(relationship("Customer", "Product"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getCode()).isEqualTo(IssueCode.STORAGE_NAME_COLLISION);
            assertThat(error.getPhase()).isEqualTo(ValidationPhase.SEMANTIC);
            assertThat(error.getMessage()).isEqualTo("Entities Customer and Product both map to table items");
        });
    }

    @Test
    void testTableOverrideClashingWithDerivedName() {
        Schema schema = Schema.builder()
                .entity(entity("OrderLine", pk("id")))
                .entity(entity("Item", pk("id")).toBuilder().tableName("/Order_Line").build())
                .relationship(relationship("OrderLine", "Item"))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.STORAGE_NAME_COLLISION);
    }

    @Test
    void testDuplicateAttribute() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id"), column("email"), column("email")))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrorMessages()).containsExactly("Entity Customer: duplicate attribute name: email");
    }

    @Test
    void testFieldNameCollision() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id"), column("first_name"), column("firstName")))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getCode()).isEqualTo(IssueCode.FIELD_NAME_COLLISION);
            assertThat(error.getPhase()).isEqualTo(ValidationPhase.SEMANTIC);
            assertThat(error.getMessage()).contains("firstName");
        });
    }

    @Test
    void testDanglingReferenceToMissingEntity() {
        Schema schema = Schema.builder()
                .entity(entity("Order", pk("order_id"), reference("customer_id", "Customer", "customer_id")))
                .build();

        ValidationResult result = validator.validate(schema);

        assertThat(result.getErrorMessages()).containsExactly(
                "Entity Order, attribute customer_id: foreign key references Customer.customer_id,"
                        + " but entity Customer does not exist");
    }

    @Test
    void testStatistics() {
        Schema schema = Schema.builder()
                .entity(entity("Customer", pk("customer_id"), column("name"), column("email")))
                .entity(entity("Order", pk("order_id"), reference("customer_id", "Customer", "customer_id")))
                .relationship(relationship("Customer", "Order"))
                .build();

        SchemaStatistics statistics = validator.validate(schema).getStatistics();

        assertThat(statistics.getEntityCount()).isEqualTo(2);
        assertThat(statistics.getRelationshipCount()).isEqualTo(1);
        assertThat(statistics.getAttributeCount()).isEqualTo(5);
        assertThat(statistics.getPrimaryKeyCount()).isEqualTo(2);
        assertThat(statistics.getForeignKeyCount()).isEqualTo(1);
        assertThat(statistics.getAverageAttributesPerEntity()).isEqualTo(2.5);
    }

    @Test
    void testResultListsAreImmutable() {
        ValidationResult result = validator.validate(Schema.builder().build());

        assertThatThrownBy(() -> result.getErrors().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static Entity entity(String name, Attribute... attributes) {
        Entity.EntityBuilder builder = Entity.builder().name(name);
        for (Attribute attribute : attributes) {
            builder.attribute(attribute);
        }
        return builder.build();
    }

    private static Relationship relationship(String source, String target) {
        return Relationship.builder()
                .sourceEntity(source)
                .targetEntity(target)
                .type(RelationshipType.ONE_TO_MANY)
                .build();
    }

    private static Attribute pk(String name) {
        return Attribute.builder().name(name).dataType(DataType.INTEGER).primaryKey(true).nullable(false).build();
    }

    private static Attribute column(String name) {
        return Attribute.builder().name(name).dataType(DataType.STRING).build();
    }

    private static Attribute reference(String name, String entity, String column) {
        return Attribute.builder().name(name).dataType(DataType.INTEGER).foreignKey(true)
                .referencedEntity(entity).referencedAttribute(column).build();
    }
}
