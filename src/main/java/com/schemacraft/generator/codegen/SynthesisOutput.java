package com.schemacraft.generator.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.model.output.GeneratedFileType;

/**
 * Ordered mapping of relative path to generated file, created fresh per synthesis run.
 */
public final class SynthesisOutput {

    private final Map<String, GeneratedFile> files;

    private SynthesisOutput(Map<String, GeneratedFile> files) {
        this.files = Collections.unmodifiableMap(files);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, GeneratedFile> getFiles() {
        return files;
    }

    public List<String> paths() {
        return new ArrayList<>(files.keySet());
    }

    public Optional<String> contentOf(String path) {
        GeneratedFile file = files.get(path);
        return file == null ? Optional.empty() : Optional.of(file.getContents());
    }

    /**
     * Plain path to content view, in output order.
     */
    public Map<String, String> asTextMap() {
        Map<String, String> text = new LinkedHashMap<>();
        files.forEach((path, file) -> text.put(path, file.getContents()));
        return text;
    }

    /**
     * Copy of this output with {@code file} appended after every existing file.
     */
    public SynthesisOutput withFile(GeneratedFile file) {
        Builder builder = builder();
        files.values().forEach(builder::add);
        return builder.add(file).build();
    }

    public long count(GeneratedFileType type) {
        return files.values().stream().filter(f -> f.getType() == type).count();
    }

    public int size() {
        return files.size();
    }

    public static final class Builder {
        private final Map<String, GeneratedFile> files = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a file. Two units claiming one path is a naming defect and aborts synthesis.
         */
        public Builder add(GeneratedFile file) {
            GeneratedFile previous = files.putIfAbsent(file.getPath(), file);
            if (previous != null) {
                throw new SynthesisException("Two generated units share the path " + file.getPath());
            }
            return this;
        }

        public SynthesisOutput build() {
            return new SynthesisOutput(new LinkedHashMap<>(files));
        }
    }
}
