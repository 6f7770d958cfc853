package com.schemacraft.generator.cli.output;

import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.cli.model.ValidatedGenerateOptions;
import com.schemacraft.generator.codegen.SynthesisOutput;
import com.schemacraft.generator.codegen.model.output.GeneratedFileType;
import com.schemacraft.generator.pipeline.CompilationReport;
import com.schemacraft.generator.reconcile.ReconciliationGap;
import com.schemacraft.generator.reconcile.ReferenceCorrection;
import com.schemacraft.generator.validation.SchemaStatistics;
import com.schemacraft.generator.validation.ValidationIssue;
import com.schemacraft.generator.validation.ValidationResult;

/**
 * Responsible only for printing CLI output for the "generate" and "validate" commands.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("SchemaCraft Generator");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Self References: {}",
                v.getContext().getValidationOptions().isAllowSelfReferences() ? "allowed (warning)" : "rejected");
        log.info("=================================================");
    }

    /**
     * Everything the stages reported: stage failure, repairs, corrections, validation issues.
     */
    public void printReport(CompilationReport report) {
        if (report.getStageError() != null) {
            log.error("Processing failed: {}", report.getStageError().describe());
        }

        if (!report.getRepairs().isEmpty()) {
            log.warn("Input needed repair before parsing: {}", report.getRepairs());
        }
        for (ReferenceCorrection correction : report.getCorrections()) {
            log.info("Auto-corrected reference: {}", correction.describe());
        }
        for (ReconciliationGap gap : report.getGaps()) {
            log.warn("Could not correct reference {}.{} -> {}.{}", gap.getEntityName(), gap.getAttributeName(),
                    gap.getTargetEntity(), gap.getTargetAttribute());
        }
        if (report.getValidation() != null) {
            printValidation(report.getValidation());
        }
    }

    public void printValidation(ValidationResult validation) {
        SchemaStatistics stats = validation.getStatistics();
        log.info("");
        log.info("Schema Summary:");
        log.info("  Entities: {}", stats.getEntityCount());
        log.info("  Relationships: {}", stats.getRelationshipCount());
        log.info("  Attributes: {} ({} primary keys, {} foreign keys)",
                stats.getAttributeCount(), stats.getPrimaryKeyCount(), stats.getForeignKeyCount());
        log.info("  Average Attributes per Entity: {}", String.format(Locale.ROOT, "%.1f", stats.getAverageAttributesPerEntity()));

        for (ValidationIssue warning : validation.getWarnings()) {
            log.warn("  WARNING {}", warning.describe());
        }
        for (ValidationIssue error : validation.getErrors()) {
            log.error("  ERROR {}", error.describe());
        }
        if (validation.hasErrors()) {
            log.error("Validation failed with {} error(s); no files were generated.", validation.getErrors().size());
        } else {
            log.info("Validation passed with {} warning(s).", validation.getWarnings().size());
        }
    }

    public void printSuccess(SynthesisOutput output, Path projectPath, Path irFile) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", projectPath);
        log.info("Files Generated: {}", output.size());
        log.info("  Java Sources: {}", output.count(GeneratedFileType.JAVA));
        log.info("  Resources: {}", output.count(GeneratedFileType.RESOURCE));
        if (irFile != null) {
            log.info("Schema IR: {}", irFile);
        }
        log.info("");
        log.info("=================================================");
        log.info("NEXT STEPS");
        log.info("=================================================");
        log.info("1. Build the generated project:");
        log.info("   cd {}", projectPath);
        log.info("   mvn clean package");
        log.info("");
        log.info("2. Run the application:");
        log.info("   mvn spring-boot:run");
        log.info("");
        log.info("3. See README.md for the endpoints.");
        log.info("=================================================");
    }
}
