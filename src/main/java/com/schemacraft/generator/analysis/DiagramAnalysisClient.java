package com.schemacraft.generator.analysis;

import java.io.IOException;

/**
 * The image-understanding service that reads a diagram and answers in free text.
 *
 * Implementations own transport, authentication and timeouts. The compiler never retries;
 * callers retry the whole analysis if they want to.
 */
@FunctionalInterface
public interface DiagramAnalysisClient {

    /**
     * @param image     encoded diagram image
     * @param mediaType image media type, e.g. {@code image/png}
     * @param prompt    the full instruction prompt
     * @return the service's raw response text
     */
    String analyze(byte[] image, String mediaType, String prompt) throws IOException;
}
