package com.schemacraft.generator.codegen.generator;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;

/**
 * Generates the Spring Boot main class.
 */
public class ApplicationClassGenerator {

    public GeneratedFile generate(ProjectLayout layout) {
        String className = layout.getApplicationClassName();
        String content = """
                package %s;

                import org.springframework.boot.SpringApplication;
                import org.springframework.boot.autoconfigure.SpringBootApplication;

                @SpringBootApplication
                public class %s {

                    public static void main(String[] args) {
                        SpringApplication.run(%s.class, args);
                    }
                }
                """.formatted(layout.getBasePackage(), className, className);

        return GeneratedFile.java(layout.javaPath(null, className), content);
    }
}
