package com.schemacraft.generator.codegen;

import lombok.Builder;
import lombok.Value;

/**
 * Fixed settings of the generated project that do not come from the schema.
 */
@Value
@Builder(toBuilder = true)
public class SynthesisOptions {

    public static final String DEFAULT_PROJECT_NAME = "generated-api";
    public static final String DEFAULT_GROUP_ID = "com.example";

    /**
     * Java base package of the generated code; derived from the project name when {@code null}.
     */
    String basePackage;

    /**
     * Replaces the schema's project name when set.
     */
    String projectName;

    /**
     * Used when neither the options nor the schema name the project.
     */
    @Builder.Default
    String defaultProjectName = DEFAULT_PROJECT_NAME;

    @Builder.Default
    String groupId = DEFAULT_GROUP_ID;

    @Builder.Default
    String springBootVersion = "3.2.1";

    @Builder.Default
    String javaVersion = "17";

    public static SynthesisOptions defaults() {
        return SynthesisOptions.builder().build();
    }
}
