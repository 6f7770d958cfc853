package com.schemacraft.generator.cli.model;

import java.nio.file.Path;

import com.schemacraft.generator.pipeline.CompilerContext;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path inputFile;
    Path normalizedOutputDir;
    CompilerContext context;
}
