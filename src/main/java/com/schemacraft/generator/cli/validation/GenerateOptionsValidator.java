package com.schemacraft.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.schemacraft.generator.cli.exception.OptionsValidationException;
import com.schemacraft.generator.cli.model.GenerateOptions;
import com.schemacraft.generator.cli.model.ValidatedGenerateOptions;
import com.schemacraft.generator.codegen.SynthesisOptions;
import com.schemacraft.generator.codegen.util.NamingUtil;
import com.schemacraft.generator.pipeline.CompilerContext;
import com.schemacraft.generator.validation.ValidationOptions;

public class GenerateOptionsValidator {

    private static final Pattern PACKAGE_NAME = Pattern.compile("[a-z_][a-z0-9_]*(\\.[a-z_][a-z0-9_]*)*");

    public ValidatedGenerateOptions validate(GenerateOptions o) {
        List<String> errors = new ArrayList<>();

        if (o.getInput() == null) {
            errors.add("Input file is required (--input / -i).");
        } else if (!Files.isRegularFile(o.getInput())) {
            errors.add("Input file does not exist or is not a file: " + o.getInput());
        } else if (!Files.isReadable(o.getInput())) {
            errors.add("Input file is not readable: " + o.getInput());
        }

        if (o.getProjectName() != null && NamingUtil.words(o.getProjectName()).isEmpty()) {
            errors.add("Project name must contain at least one letter or digit. Got: '" + o.getProjectName() + "'");
        }

        if (o.getBasePackage() != null && !isValidPackage(o.getBasePackage())) {
            errors.add("Base package is not a valid Java package name: " + o.getBasePackage());
        }

        Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir())
                .toAbsolutePath()
                .normalize();
        if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
            errors.add("Output directory is not a directory: " + normalizedOutputDir);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        CompilerContext context = CompilerContext.builder()
                .validationOptions(ValidationOptions.builder()
                        .allowSelfReferences(o.isAllowSelfReferences())
                        .build())
                .synthesisOptions(SynthesisOptions.builder()
                        .projectName(o.getProjectName())
                        .basePackage(o.getBasePackage())
                        .build())
                .build();

        return new ValidatedGenerateOptions(o.getInput().toAbsolutePath().normalize(), normalizedOutputDir, context);
    }

    private static boolean isValidPackage(String name) {
        if (!PACKAGE_NAME.matcher(name).matches()) {
            return false;
        }
        for (String segment : name.split("\\.")) {
            if (NamingUtil.isJavaKeyword(segment)) {
                return false;
            }
        }
        return true;
    }
}
