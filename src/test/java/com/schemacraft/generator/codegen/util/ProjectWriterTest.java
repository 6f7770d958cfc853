package com.schemacraft.generator.codegen.util;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.schemacraft.generator.codegen.SynthesisException;
import com.schemacraft.generator.codegen.SynthesisOutput;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.model.output.GeneratedFileType;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ProjectWriter.
 */
class ProjectWriterTest {

    @TempDir
    Path tempDir;

    private final ProjectWriter writer = new ProjectWriter();

    @Test
    void testWritesAllFiles() throws Exception {
        Path target = tempDir.resolve("shop");

        writer.write(sampleOutput(), target, false);

        assertThat(target.resolve("src/main/java/com/example/A.java")).hasContent("class A {}");
        assertThat(target.resolve("README.md")).hasContent("# Shop");
        assertThat(siblings()).containsExactly("shop");
    }

    @Test
    void testRefusesNonEmptyTargetWithoutOverwrite() throws Exception {
        Path target = tempDir.resolve("shop");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "keep");

        assertThatThrownBy(() -> writer.write(sampleOutput(), target, false))
                .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(target.resolve("keep.txt")).exists();
        assertThat(target.resolve("README.md")).doesNotExist();
        assertThat(siblings()).containsExactly("shop");
    }

    @Test
    void testOverwriteReplacesTarget() throws Exception {
        Path target = tempDir.resolve("shop");
        Files.createDirectories(target);
        Files.writeString(target.resolve("stale.txt"), "stale");

        writer.write(sampleOutput(), target, true);

        assertThat(target.resolve("stale.txt")).doesNotExist();
        assertThat(target.resolve("README.md")).exists();
        assertThat(siblings()).containsExactly("shop");
    }

    @Test
    void testEmptyExistingDirectoryIsUsed() throws Exception {
        Path target = Files.createDirectories(tempDir.resolve("shop"));

        writer.write(sampleOutput(), target, false);

        assertThat(target.resolve("README.md")).exists();
    }

    @Test
    void testDuplicatePathIsRejected() {
        SynthesisOutput.Builder builder = SynthesisOutput.builder()
                .add(GeneratedFile.java("src/A.java", "class A {}"));

        assertThatThrownBy(() -> builder.add(GeneratedFile.java("src/A.java", "class B {}")))
                .isInstanceOf(SynthesisException.class);
    }

    @Test
    void testAppendedFileLandsWithTheProject() throws Exception {
        Path target = tempDir.resolve("shop");
        SynthesisOutput output = sampleOutput().withFile(GeneratedFile.builder()
                .path("schema.json")
                .contents("{}")
                .type(GeneratedFileType.SCHEMA)
                .build());

        writer.write(output, target, false);

        assertThat(output.paths()).containsExactly("src/main/java/com/example/A.java", "README.md", "schema.json");
        assertThat(target.resolve("schema.json")).hasContent("{}");
        assertThat(siblings()).containsExactly("shop");
    }

    @Test
    void testAppendedFileIsNotWrittenWhenTargetIsRefused() throws Exception {
        Path target = tempDir.resolve("shop");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "keep");
        SynthesisOutput output = sampleOutput().withFile(GeneratedFile.builder()
                .path("schema.json")
                .contents("{}")
                .type(GeneratedFileType.SCHEMA)
                .build());

        assertThatThrownBy(() -> writer.write(output, target, false))
                .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(target.resolve("schema.json")).doesNotExist();
    }

    @Test
    void testAppendingAnExistingPathIsRejected() {
        assertThatThrownBy(() -> sampleOutput().withFile(GeneratedFile.java("README.md", "again")))
                .isInstanceOf(SynthesisException.class);
    }

    private List<String> siblings() throws Exception {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.map(p -> p.getFileName().toString()).toList();
        }
    }

    private static SynthesisOutput sampleOutput() {
        return SynthesisOutput.builder()
                .add(GeneratedFile.java("src/main/java/com/example/A.java", "class A {}"))
                .add(GeneratedFile.builder()
                        .path("README.md")
                        .contents("# Shop")
                        .type(GeneratedFileType.DOCUMENTATION)
                        .build())
                .build();
    }
}
