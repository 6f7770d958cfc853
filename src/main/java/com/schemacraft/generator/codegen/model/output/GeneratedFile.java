package com.schemacraft.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated file: relative path plus contents.
 *
 * The path always uses {@code /} separators so output is identical on every platform.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    @NonNull
    String path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    public static GeneratedFile java(String path, String contents) {
        return new GeneratedFile(path, contents, GeneratedFileType.JAVA);
    }
}
