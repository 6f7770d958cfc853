package com.schemacraft.generator.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.cli.exception.OptionsValidationException;
import com.schemacraft.generator.cli.model.GenerateOptions;
import com.schemacraft.generator.cli.model.ValidatedGenerateOptions;
import com.schemacraft.generator.cli.output.GenerateResultsPrinter;
import com.schemacraft.generator.cli.validation.GenerateOptionsValidator;
import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.SynthesisException;
import com.schemacraft.generator.codegen.SynthesisOutput;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.model.output.GeneratedFileType;
import com.schemacraft.generator.codegen.util.ProjectWriter;
import com.schemacraft.generator.model.Schema;
import com.schemacraft.generator.pipeline.CompilationReport;
import com.schemacraft.generator.pipeline.CompilationStatus;
import com.schemacraft.generator.pipeline.SchemaCompiler;
import com.schemacraft.generator.wire.SchemaJsonWriter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

/**
 * CLI command that compiles an analysis response into a Spring Boot project.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Parses, reconciles and validates a schema, then generates a Spring Boot project from it."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final String IR_FILE_NAME = "schema.json";

    @ParentCommand
    private SchemaCraftCommand parent;

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        printer.printBanner(validated);

        try {
            String responseText = Files.readString(validated.getInputFile(), StandardCharsets.UTF_8);
            CompilationReport report = new SchemaCompiler(validated.getContext()).compile(responseText);
            printer.printReport(report);

            if (report.getStatus() != CompilationStatus.GENERATED) {
                return 1;
            }

            Schema schema = report.getSchema();
            SynthesisOutput output = report.getOutput();
            ProjectLayout layout = ProjectLayout.of(schema, validated.getContext().getSynthesisOptions());
            Path projectPath = validated.getNormalizedOutputDir().resolve(layout.getArtifactId());

            if (options.isForce() && Files.exists(projectPath)) {
                log.warn("Force mode enabled, will overwrite: {}", projectPath);
            }

            Path irFile = null;
            if (options.isEmitIr()) {
                // travels with the project so both land in one move
                output = output.withFile(GeneratedFile.builder()
                        .path(IR_FILE_NAME)
                        .contents(new SchemaJsonWriter().toJson(schema))
                        .type(GeneratedFileType.SCHEMA)
                        .build());
                irFile = projectPath.resolve(IR_FILE_NAME);
            }
            new ProjectWriter().write(output, projectPath, options.isForce());

            printer.printSuccess(output, projectPath, irFile);
            return 0;
        } catch (IOException e) {
            log.error("Generation failed: {}", e.getMessage());
            log.debug("I/O failure", e);
            return 1;
        } catch (SynthesisException e) {
            log.error("Generation failed with an internal error", e);
            return 1;
        }
    }
}
