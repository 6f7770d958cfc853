package com.schemacraft.generator.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.cli.output.GenerateResultsPrinter;
import com.schemacraft.generator.pipeline.CompilationReport;
import com.schemacraft.generator.pipeline.CompilerContext;
import com.schemacraft.generator.pipeline.SchemaCompiler;
import com.schemacraft.generator.validation.ValidationOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Runs every stage except generation and reports the diagnostics.
 */
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Parses, reconciles and validates a schema without generating code."
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @ParentCommand
    private SchemaCraftCommand parent;

    @Option(names = {"--input", "-i"}, required = true,
            description = "File holding the analysis response text or schema JSON")
    private Path input;

    @Option(names = {"--allow-self-references"},
            description = "Report self-referencing relationships as warnings instead of errors")
    private boolean allowSelfReferences;

    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        if (!Files.isRegularFile(input)) {
            log.error("Input file does not exist or is not a file: {}", input);
            return 1;
        }

        CompilerContext context = CompilerContext.builder()
                .validationOptions(ValidationOptions.builder().allowSelfReferences(allowSelfReferences).build())
                .build();

        try {
            log.info("Validating schema: {}", input.toAbsolutePath().normalize());
            String responseText = Files.readString(input, StandardCharsets.UTF_8);
            CompilationReport report = new SchemaCompiler(context).check(responseText);
            printer.printReport(report);
            return report.isSuccess() ? 0 : 1;
        } catch (IOException e) {
            log.error("Could not read {}: {}", input, e.getMessage());
            return 1;
        }
    }
}
