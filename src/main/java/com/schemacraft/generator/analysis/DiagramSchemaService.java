package com.schemacraft.generator.analysis;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.pipeline.CompilationReport;
import com.schemacraft.generator.pipeline.SchemaCompiler;

/**
 * Sends a diagram to the analysis service and compiles the answer.
 */
public class DiagramSchemaService {
    private static final Logger log = LoggerFactory.getLogger(DiagramSchemaService.class);

    private final DiagramAnalysisClient client;
    private final SchemaCompiler compiler;

    public DiagramSchemaService(DiagramAnalysisClient client, SchemaCompiler compiler) {
        this.client = client;
        this.compiler = compiler;
    }

    /**
     * @throws IOException if the analysis service call fails; no compilation is attempted then
     */
    public CompilationReport process(byte[] image, String mediaType, String hint) throws IOException {
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("Diagram image is empty");
        }
        log.info("Requesting diagram analysis ({} bytes, {})", image.length, mediaType);
        String response = client.analyze(image, mediaType, ErdAnalysisPrompt.build(hint));
        log.debug("Analysis service answered with {} characters", response == null ? 0 : response.length());
        return compiler.compile(response);
    }
}
