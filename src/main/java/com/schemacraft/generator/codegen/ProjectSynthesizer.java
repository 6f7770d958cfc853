package com.schemacraft.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.codegen.generator.ApiRouterGenerator;
import com.schemacraft.generator.codegen.generator.ApplicationClassGenerator;
import com.schemacraft.generator.codegen.generator.EntityUnitGenerator;
import com.schemacraft.generator.codegen.generator.ErrorHandlerGenerator;
import com.schemacraft.generator.codegen.generator.ReadmeGenerator;
import com.schemacraft.generator.codegen.generator.RequestValidatorGenerator;
import com.schemacraft.generator.codegen.generator.TemplateRenderer;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.project.ApplicationYamlGenerator;
import com.schemacraft.generator.codegen.project.PomGenerator;
import com.schemacraft.generator.codegen.view.EntityView;
import com.schemacraft.generator.codegen.view.EntityViewFactory;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Schema;

/**
 * Maps a validated schema to the file tree of a Spring Boot service.
 *
 * <p>Output order is fixed: build and configuration files, then the units of each entity in
 * declaration order, then the shared code units and the README. The same schema and options
 * always produce byte-identical output.
 *
 * <p>Callers must not pass a schema whose validation reported errors. Any failure here is a
 * defect of the generator and surfaces as {@link SynthesisException}.
 */
public class ProjectSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(ProjectSynthesizer.class);

    private final SynthesisOptions options;
    private final PomGenerator pomGenerator = new PomGenerator();
    private final ApplicationYamlGenerator yamlGenerator = new ApplicationYamlGenerator();
    private final EntityUnitGenerator entityUnitGenerator;
    private final ApplicationClassGenerator applicationClassGenerator = new ApplicationClassGenerator();
    private final ErrorHandlerGenerator errorHandlerGenerator = new ErrorHandlerGenerator();
    private final RequestValidatorGenerator requestValidatorGenerator = new RequestValidatorGenerator();
    private final ApiRouterGenerator apiRouterGenerator = new ApiRouterGenerator();
    private final ReadmeGenerator readmeGenerator = new ReadmeGenerator();

    public ProjectSynthesizer() {
        this(SynthesisOptions.defaults());
    }

    public ProjectSynthesizer(SynthesisOptions options) {
        this.options = options;
        this.entityUnitGenerator = new EntityUnitGenerator(new TemplateRenderer());
    }

    public SynthesisOutput synthesize(Schema schema) {
        ProjectLayout layout = ProjectLayout.of(schema, options);
        log.info("Synthesizing project '{}' in package {}", layout.getProjectName(), layout.getBasePackage());

        SynthesisOutput.Builder output = SynthesisOutput.builder();

        log.info("Step 1: Generating pom.xml and application.yml...");
        output.add(pomGenerator.generate(layout));
        output.add(yamlGenerator.generate(layout));

        log.info("Step 2: Generating units for {} entities...", schema.getEntities().size());
        EntityViewFactory viewFactory = new EntityViewFactory(layout);
        List<EntityView> views = new ArrayList<>();
        for (Entity entity : schema.getEntities()) {
            EntityView view = viewFactory.create(entity);
            views.add(view);
            for (GeneratedFile file : entityUnitGenerator.generate(layout, view)) {
                log.debug("Generated {}", file.getPath());
                output.add(file);
            }
        }

        log.info("Step 3: Generating shared units...");
        output.add(applicationClassGenerator.generate(layout));
        output.add(errorHandlerGenerator.generate(layout));
        output.add(requestValidatorGenerator.generate(layout));
        output.add(apiRouterGenerator.generate(layout, views));
        output.add(readmeGenerator.generate(layout, views, schema.getRelationships()));

        SynthesisOutput result = output.build();
        log.info("Synthesis complete: {} files", result.size());
        return result;
    }
}
