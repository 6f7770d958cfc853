package com.schemacraft.generator.codegen.generator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.view.EntityView;

/**
 * Renders the per-entity units (model, repository, service, handler, routes) from templates.
 */
public class EntityUnitGenerator {

    private final TemplateRenderer renderer;

    public EntityUnitGenerator(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * The units of one entity, in fixed order.
     */
    public List<GeneratedFile> generate(ProjectLayout layout, EntityView entity) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("basePackage", layout.getBasePackage());
        model.put("entity", entity);

        List<GeneratedFile> files = new ArrayList<>();
        files.add(unit(layout, model, "model.ftl", "model", entity.getClassName()));
        files.add(unit(layout, model, "repository.ftl", "repository", entity.getRepositoryName()));
        files.add(unit(layout, model, "service.ftl", "service", entity.getServiceName()));
        files.add(unit(layout, model, "handler.ftl", "handler", entity.getHandlerName()));
        files.add(unit(layout, model, "routes.ftl", "routes", entity.getRoutesName()));
        return files;
    }

    private GeneratedFile unit(ProjectLayout layout, Map<String, Object> model, String template,
                               String subpackage, String className) {
        return GeneratedFile.java(layout.javaPath(subpackage, className), renderer.render(template, model));
    }
}
