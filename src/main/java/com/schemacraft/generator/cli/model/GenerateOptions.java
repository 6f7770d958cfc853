package com.schemacraft.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds the CLI options of the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

    @Option(names = {"--input", "-i"}, required = true,
            description = "File holding the analysis response text or schema JSON")
    private Path input;

    @Option(names = {"--output-dir", "-o"},
            description = "Directory the project folder is created in (defaults to current directory)")
    private Path outputDir;

    @Option(names = {"--project-name", "-n"},
            description = "Project name, overriding the one in the schema")
    private String projectName;

    @Option(names = {"--base-package"},
            description = "Java base package of the generated code (derived from the project name by default)")
    private String basePackage;

    @Option(names = {"--force", "-f"}, description = "Overwrite an existing project directory")
    private boolean force;

    @Option(names = {"--emit-ir"}, description = "Also write the reconciled schema as schema.json")
    private boolean emitIr;

    @Option(names = {"--allow-self-references"},
            description = "Report self-referencing relationships as warnings instead of errors")
    private boolean allowSelfReferences;
}
