package com.schemacraft.generator.codegen.generator;

import java.util.List;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.util.ImportManager;
import com.schemacraft.generator.codegen.view.EntityView;

/**
 * Generates the top-level router that mounts every entity's routes under {@code /api}.
 */
public class ApiRouterGenerator {

    public GeneratedFile generate(ProjectLayout layout, List<EntityView> entities) {
        ImportManager imports = new ImportManager(layout.packageName("routes"))
                .addImport(layout.packageName("error") + ".ApiErrorHandler")
                .addImport("org.springframework.context.annotation.Bean")
                .addImport("org.springframework.context.annotation.Configuration")
                .addImport("org.springframework.web.servlet.function.RouterFunction")
                .addImport("org.springframework.web.servlet.function.RouterFunctions")
                .addImport("org.springframework.web.servlet.function.ServerResponse");

        StringBuilder parameters = new StringBuilder();
        StringBuilder mounts = new StringBuilder();
        for (EntityView entity : entities) {
            imports.addImport(layout.packageName("handler") + "." + entity.getHandlerName());
            parameters.append("            ").append(entity.getHandlerName()).append(' ')
                    .append(entity.getHandlerVariable()).append(",\n");
            mounts.append("\n                        .add(").append(entity.getRoutesName())
                    .append(".routes(").append(entity.getHandlerVariable()).append("))");
        }

        String content = """
                package %s;

                %s
                /**
                 * Mounts the routes of every resource under /api with shared error handling.
                 */
                @Configuration
                public class ApiRouter {

                    public static final String API_PREFIX = "/api";

                    @Bean
                    public RouterFunction<ServerResponse> apiRoutes(
                %s            ApiErrorHandler errorHandler) {
                        return RouterFunctions.route()
                                .path(API_PREFIX, builder -> builder%s)
                                .onError(Exception.class, errorHandler::handle)
                                .build();
                    }
                }
                """.formatted(layout.packageName("routes"), imports.generateImports(), parameters, mounts);

        return GeneratedFile.java(layout.javaPath("routes", "ApiRouter"), content);
    }
}
