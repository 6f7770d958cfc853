package com.schemacraft.generator.codegen.project;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.model.output.GeneratedFileType;

/**
 * Generates application.yml with an in-memory database for the generated service.
 */
public class ApplicationYamlGenerator {

    public GeneratedFile generate(ProjectLayout layout) {
        return GeneratedFile.builder()
                .path("src/main/resources/application.yml")
                .contents(generateMainYaml(layout))
                .type(GeneratedFileType.RESOURCE)
                .build();
    }

    public String generateMainYaml(ProjectLayout layout) {
        return """
                server:
                  port: 8080

                spring:
                  application:
                    name: %s
                  datasource:
                    url: jdbc:h2:mem:%s;DB_CLOSE_DELAY=-1
                    username: sa
                    password:
                  jpa:
                    open-in-view: false
                    hibernate:
                      ddl-auto: update
                    properties:
                      hibernate:
                        globally_quoted_identifiers: true

                logging:
                  level:
                    %s: DEBUG
                """.formatted(
                layout.getArtifactId(),
                layout.getArtifactId(),
                layout.getBasePackage()
        );
    }
}
