package com.schemacraft.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemacraft.generator.cli.exception.OptionsValidationException;
import com.schemacraft.generator.cli.model.GenerateOptions;
import com.schemacraft.generator.cli.model.ValidatedGenerateOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @Test
    void testValidOptionsBuildContext() throws Exception {
        Path input = Files.writeString(tempDir.resolve("schema.json"), "{}");

        ValidatedGenerateOptions validated = validator.validate(parse(
                "-i", input.toString(),
                "-o", tempDir.toString(),
                "-n", "Shop",
                "--base-package", "org.acme.shop",
                "--allow-self-references"));

        assertThat(validated.getInputFile()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getNormalizedOutputDir()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(validated.getContext().getValidationOptions().isAllowSelfReferences()).isTrue();
        assertThat(validated.getContext().getSynthesisOptions().getProjectName()).isEqualTo("Shop");
        assertThat(validated.getContext().getSynthesisOptions().getBasePackage()).isEqualTo("org.acme.shop");
    }

    @Test
    void testDefaults() throws Exception {
        Path input = Files.writeString(tempDir.resolve("schema.json"), "{}");

        ValidatedGenerateOptions validated = validator.validate(parse("-i", input.toString()));

        assertThat(validated.getNormalizedOutputDir()).isEqualTo(Path.of(".").toAbsolutePath().normalize());
        assertThat(validated.getContext().getValidationOptions().isAllowSelfReferences()).isFalse();
        assertThat(validated.getContext().getSynthesisOptions().getBasePackage()).isNull();
    }

    @Test
    void testMissingInputFile() {
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> validator.validate(parse("-i", missing.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Input file does not exist");
    }

    @Test
    void testAllErrorsAreReportedTogether() throws Exception {
        Path outputFile = Files.writeString(tempDir.resolve("out.txt"), "x");

        OptionsValidationException e = catchThrowableOfType(
                () -> validator.validate(parse(
                        "-i", tempDir.resolve("missing.json").toString(),
                        "-o", outputFile.toString(),
                        "-n", "!!!",
                        "--base-package", "com.Example")),
                OptionsValidationException.class);

        assertThat(e.getErrors()).hasSize(4);
    }

    @Test
    void testKeywordPackageSegmentIsRejected() throws Exception {
        Path input = Files.writeString(tempDir.resolve("schema.json"), "{}");

        assertThatThrownBy(() -> validator.validate(parse("-i", input.toString(), "--base-package", "com.class.app")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("com.class.app");
    }

    private static GenerateOptions parse(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
