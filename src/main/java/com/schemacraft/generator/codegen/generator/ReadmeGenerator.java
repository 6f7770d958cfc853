package com.schemacraft.generator.codegen.generator;

import java.util.List;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;
import com.schemacraft.generator.codegen.model.output.GeneratedFileType;
import com.schemacraft.generator.codegen.util.SourceText;
import com.schemacraft.generator.codegen.view.EntityView;
import com.schemacraft.generator.model.Relationship;

/**
 * Generates README.md listing every endpoint of the generated service.
 */
public class ReadmeGenerator {

    public GeneratedFile generate(ProjectLayout layout, List<EntityView> entities, List<Relationship> relationships) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(SourceText.comment(layout.getProjectName())).append("\n\n");
        sb.append("REST service generated from an entity-relationship schema.\n\n");
        sb.append("## Running\n\n");
        sb.append("```\nmvn spring-boot:run\n```\n\n");
        sb.append("The service listens on port 8080 and stores data in an in-memory H2 database.\n\n");

        sb.append("## Endpoints\n");
        for (EntityView entity : entities) {
            String base = "/api" + entity.getResourcePath();
            sb.append("\n### ").append(entity.getName()).append("\n\n");
            sb.append("| Method | Path | Description |\n");
            sb.append("|--------|------|-------------|\n");
            row(sb, "GET", base, "List all (add `page`/`size` for a page)");
            row(sb, "GET", base + "/search?q=", entity.isSearchable()
                    ? "Search " + String.join(", ", entity.getSearchFields())
                    : "Search (no text fields, always empty)");
            row(sb, "POST", base, "Create");
            row(sb, "GET", base + "/{id}", "Get by id");
            row(sb, "PUT", base + "/{id}", "Update");
            row(sb, "DELETE", base + "/{id}", "Delete");
            if (!entity.getRequiredFields().isEmpty()) {
                sb.append("\nRequired fields: ").append(String.join(", ", entity.getRequiredFields())).append('\n');
            }
        }

        if (!relationships.isEmpty()) {
            sb.append("\n## Relationships\n\n");
            for (Relationship relationship : relationships) {
                sb.append("- ").append(SourceText.comment(relationship.getSourceEntity()))
                        .append(' ').append(relationship.getType().getLabel()).append(' ')
                        .append(SourceText.comment(relationship.getTargetEntity()));
                if (relationship.getName() != null && !relationship.getName().isBlank()) {
                    sb.append(" (").append(SourceText.comment(relationship.getName())).append(')');
                }
                sb.append('\n');
            }
        }

        return GeneratedFile.builder()
                .path("README.md")
                .contents(sb.toString())
                .type(GeneratedFileType.DOCUMENTATION)
                .build();
    }

    private static void row(StringBuilder sb, String method, String path, String description) {
        sb.append("| ").append(method).append(" | `").append(path).append("` | ").append(description).append(" |\n");
    }
}
