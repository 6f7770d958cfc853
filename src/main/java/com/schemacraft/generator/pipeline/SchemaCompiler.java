package com.schemacraft.generator.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.codegen.ProjectSynthesizer;
import com.schemacraft.generator.codegen.SynthesisOutput;
import com.schemacraft.generator.intake.IntakeParser;
import com.schemacraft.generator.intake.RawDocument;
import com.schemacraft.generator.model.Schema;
import com.schemacraft.generator.normalize.SchemaNormalizer;
import com.schemacraft.generator.reconcile.ReconciliationResult;
import com.schemacraft.generator.reconcile.ReferenceReconciler;
import com.schemacraft.generator.validation.SchemaValidator;
import com.schemacraft.generator.validation.ValidationResult;

/**
 * Runs the stages in order: intake, normalization, reconciliation, validation, synthesis.
 *
 * <p>Each stage sees only the previous stage's output. Expected failures come back in the
 * {@link CompilationReport}; only a generator defect ({@code SynthesisException}) is thrown.
 * No state is kept between calls.
 */
public class SchemaCompiler {
    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    private final IntakeParser intakeParser;
    private final SchemaNormalizer normalizer;
    private final ReferenceReconciler reconciler;
    private final SchemaValidator validator;
    private final ProjectSynthesizer synthesizer;

    public SchemaCompiler(CompilerContext context) {
        this.intakeParser = new IntakeParser(context.getClock());
        this.normalizer = new SchemaNormalizer();
        this.reconciler = new ReferenceReconciler();
        this.validator = new SchemaValidator(context.getValidationOptions());
        this.synthesizer = new ProjectSynthesizer(context.getSynthesisOptions());
    }

    /**
     * Full pipeline, from upstream response text to generated files.
     */
    public CompilationReport compile(String responseText) {
        return run(responseText, true);
    }

    /**
     * Every stage except synthesis.
     */
    public CompilationReport check(String responseText) {
        return run(responseText, false);
    }

    private CompilationReport run(String responseText, boolean synthesize) {
        CompilationReport.CompilationReportBuilder report = CompilationReport.builder();

        log.info("Step 1: Parsing response text...");
        StageResult<RawDocument> parsed = intakeParser.parse(responseText);
        if (!parsed.isSuccess()) {
            return report.status(CompilationStatus.INTAKE_FAILED)
                    .stageError(parsed.getError().orElseThrow())
                    .build();
        }
        report.repairs(parsed.getValue().getAppliedRepairs());

        log.info("Step 2: Normalizing schema...");
        StageResult<Schema> normalized = normalizer.normalize(parsed.getValue());
        if (!normalized.isSuccess()) {
            return report.status(CompilationStatus.NORMALIZATION_FAILED)
                    .stageError(normalized.getError().orElseThrow())
                    .build();
        }

        log.info("Step 3: Reconciling foreign-key references...");
        ReconciliationResult reconciled = reconciler.reconcile(normalized.getValue());
        Schema schema = reconciled.getSchema();
        report.schema(schema)
                .corrections(reconciled.getCorrections())
                .gaps(reconciled.getGaps());

        log.info("Step 4: Validating schema...");
        ValidationResult validation = validator.validate(schema);
        report.validation(validation);
        if (validation.hasErrors()) {
            return report.status(CompilationStatus.INVALID).build();
        }
        if (!synthesize) {
            return report.status(CompilationStatus.VALIDATED).build();
        }

        log.info("Step 5: Synthesizing project...");
        SynthesisOutput output = synthesizer.synthesize(schema);
        return report.status(CompilationStatus.GENERATED).output(output).build();
    }
}
