package com.schemacraft.generator.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import com.schemacraft.generator.intake.JsonRepair;
import com.schemacraft.generator.reconcile.ReferenceMatch;
import com.schemacraft.generator.validation.IssueCode;
import com.schemacraft.generator.validation.ValidationIssue;
import com.schemacraft.generator.validation.ValidationOptions;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for SchemaCompiler across all stages.
 */
class SchemaCompilerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private static final String SHOP = """
            {
              "project_name": "Shop",
              "entities": [
                {"name": "Customer", "attributes": [
                  {"name": "customer_id", "data_type": "integer", "is_primary_key": true, "is_nullable": false},
                  {"name": "name", "data_type": "string", "is_nullable": false}
                ]},
                {"name": "Order", "attributes": [
                  {"name": "order_id", "data_type": "integer", "is_primary_key": true},
                  {"name": "customer_ref", "data_type": "integer", "is_foreign_key": true,
                   "references_table": "Customer", "references_column": "CustomerID"}
                ]}
              ],
              "relationships": [
                {"source_entity": "Customer", "target_entity": "Order", "relationship_type": "one-to-many"}
              ]
            }
            """;

    private final SchemaCompiler compiler = new SchemaCompiler(CompilerContext.builder()
            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
            .build());

    @Test
    void testRepairedResponseCompiles() {
        String text = "Here is the result: {\"entities\": [{\"name\":\"User\",\"attributes\":"
                + "[{\"name\":\"id\",\"data_type\":\"integer\",\"is_primary_key\":true}]}],}\nThanks";

        CompilationReport report = compiler.compile(text);

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.GENERATED);
        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getRepairs()).containsExactly(JsonRepair.Step.TRAILING_COMMAS);
        assertThat(report.getSchema().getTimestamp()).hasValue("2024-05-01T10:15:30Z");
        assertThat(report.getOutputIfGenerated()).hasValueSatisfying(output ->
                assertThat(output.contentOf("src/main/java/com/example/generatedapi/model/User.java")).isPresent());
    }

    @Test
    void testReferenceIsCorrectedBeforeValidation() {
        CompilationReport report = compiler.compile(SHOP);

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.GENERATED);
        assertThat(report.getCorrections()).singleElement().satisfies(correction -> {
            assertThat(correction.getCorrectedAttribute()).isEqualTo("customer_id");
            assertThat(correction.getMatch()).isEqualTo(ReferenceMatch.EXACT);
        });
        assertThat(report.getValidation().getErrors()).isEmpty();
        assertThat(report.getOutputIfGenerated().orElseThrow()
                .contentOf("src/main/java/com/example/shop/model/Order.java").orElseThrow())
                .contains("// References Customer.customer_id");
    }

    @Test
    void testCheckStopsBeforeSynthesis() {
        CompilationReport report = compiler.check(SHOP);

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.VALIDATED);
        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getOutputIfGenerated()).isEmpty();
        assertThat(report.getValidation()).isNotNull();
    }

    @Test
    void testIntakeFailure() {
        CompilationReport report = compiler.compile("I could not find a diagram.");

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.INTAKE_FAILED);
        assertThat(report.getStageError().getKind()).isEqualTo(StageErrorKind.INTAKE_PARSE);
        assertThat(report.getSchemaIfParsed()).isEmpty();
        assertThat(report.getValidation()).isNull();
        assertThat(report.getOutputIfGenerated()).isEmpty();
    }

    @Test
    void testNormalizationFailure() {
        CompilationReport report = compiler.compile("{\"tables\": []}");

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.NORMALIZATION_FAILED);
        assertThat(report.getStageError().getKind()).isEqualTo(StageErrorKind.NORMALIZATION);
        assertThat(report.isSuccess()).isFalse();
    }

    @Test
    void testValidationErrorsPreventOutput() {
        String selfReferencing = """
                {"entities": [{"name": "Employee", "attributes": [
                  {"name": "employee_id", "data_type": "integer", "is_primary_key": true}]}],
                 "relationships": [{"source_entity": "Employee", "target_entity": "Employee",
                                    "relationship_type": "1:N"}]}
                """;

        CompilationReport report = compiler.compile(selfReferencing);

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.INVALID);
        assertThat(report.getOutputIfGenerated()).isEmpty();
        assertThat(report.getSchemaIfParsed()).isPresent();
        assertThat(report.getValidation().getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.SELF_REFERENCE);
    }

    @Test
    void testSelfReferencesCanBeAllowed() {
        String selfReferencing = """
                {"entities": [{"name": "Employee", "attributes": [
                  {"name": "employee_id", "data_type": "integer", "is_primary_key": true}]}],
                 "relationships": [{"source_entity": "Employee", "target_entity": "Employee",
                                    "relationship_type": "1:N"}]}
                """;
        SchemaCompiler lenient = new SchemaCompiler(CompilerContext.builder()
                .validationOptions(ValidationOptions.builder().allowSelfReferences(true).build())
                .build());

        assertThat(lenient.compile(selfReferencing).getStatus()).isEqualTo(CompilationStatus.GENERATED);
    }

    @Test
    void testEmptyEntityListIsInvalid() {
        CompilationReport report = compiler.compile("{\"entities\": []}");

        assertThat(report.getStatus()).isEqualTo(CompilationStatus.INVALID);
        assertThat(report.getValidation().getErrors())
                .extracting(ValidationIssue::getCode)
                .containsExactly(IssueCode.NO_ENTITIES);
    }
}
