package com.schemacraft.generator.pipeline;

import java.util.List;
import java.util.Optional;

import com.schemacraft.generator.codegen.SynthesisOutput;
import com.schemacraft.generator.intake.JsonRepair;
import com.schemacraft.generator.model.Schema;
import com.schemacraft.generator.reconcile.ReconciliationGap;
import com.schemacraft.generator.reconcile.ReferenceCorrection;
import com.schemacraft.generator.validation.ValidationResult;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one compilation: how far it got and what each stage produced.
 *
 * Output is present only when the status is {@link CompilationStatus#GENERATED}; it is never
 * produced for a schema with validation errors.
 */
@Value
@Builder
public class CompilationReport {

    @NonNull
    CompilationStatus status;

    /** Terminal intake or normalization failure. */
    StageError stageError;

    @Singular
    List<JsonRepair.Step> repairs;

    /** The reconciled schema, once normalization succeeded. */
    Schema schema;

    @Singular
    List<ReferenceCorrection> corrections;

    @Singular
    List<ReconciliationGap> gaps;

    ValidationResult validation;

    SynthesisOutput output;

    public boolean isSuccess() {
        return status == CompilationStatus.GENERATED || status == CompilationStatus.VALIDATED;
    }

    public Optional<SynthesisOutput> getOutputIfGenerated() {
        return Optional.ofNullable(output);
    }

    public Optional<Schema> getSchemaIfParsed() {
        return Optional.ofNullable(schema);
    }
}
