package com.schemacraft.generator.codegen;

import java.util.Locale;

import com.schemacraft.generator.codegen.util.NamingUtil;
import com.schemacraft.generator.model.Schema;

import lombok.Builder;
import lombok.Value;

/**
 * Project-wide names of the generated service: coordinates, base package, main class.
 */
@Value
@Builder
public class ProjectLayout {
    String projectName;
    String groupId;
    String artifactId;
    String basePackage;
    String applicationClassName;
    String springBootVersion;
    String javaVersion;

    public static ProjectLayout of(Schema schema, SynthesisOptions options) {
        String projectName = options.getDefaultProjectName();
        if (!isBlank(options.getProjectName())) {
            projectName = options.getProjectName().trim();
        } else if (!isBlank(schema.getProjectName())) {
            projectName = schema.getProjectName().trim();
        }

        String artifactId = NamingUtil.toKebabCase(projectName);
        if (artifactId.isEmpty()) {
            artifactId = SynthesisOptions.DEFAULT_PROJECT_NAME;
        }

        String basePackage = options.getBasePackage() != null
                ? options.getBasePackage()
                : options.getGroupId() + "." + packageSegment(projectName);

        return ProjectLayout.builder()
                .projectName(projectName)
                .groupId(options.getGroupId())
                .artifactId(artifactId)
                .basePackage(basePackage)
                .applicationClassName(NamingUtil.toClassName(projectName) + "Application")
                .springBootVersion(options.getSpringBootVersion())
                .javaVersion(options.getJavaVersion())
                .build();
    }

    public String packageName(String subpackage) {
        return basePackage + "." + subpackage;
    }

    /**
     * Relative path of a source file in the generated project.
     */
    public String javaPath(String subpackage, String className) {
        String pkg = subpackage == null ? basePackage : packageName(subpackage);
        return "src/main/java/" + pkg.replace('.', '/') + "/" + className + ".java";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String packageSegment(String projectName) {
        String segment = String.join("", NamingUtil.words(projectName)).toLowerCase(Locale.ROOT);
        if (segment.isEmpty()) {
            return "app";
        }
        if (Character.isDigit(segment.charAt(0)) || NamingUtil.isJavaKeyword(segment)) {
            return "app" + segment;
        }
        return segment;
    }
}
