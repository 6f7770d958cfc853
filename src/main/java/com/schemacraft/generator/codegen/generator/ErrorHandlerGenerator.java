package com.schemacraft.generator.codegen.generator;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;

/**
 * Generates the central error handler every route delegates failures to.
 *
 * Validation and conversion failures become 400, constraint violations 409 and anything else
 * 500, all with the same JSON error body.
 */
public class ErrorHandlerGenerator {

    public GeneratedFile generate(ProjectLayout layout) {
        String content = """
                package %s.error;

                import %s.validation.RequestValidator.RequestValidationException;
                import org.slf4j.Logger;
                import org.slf4j.LoggerFactory;
                import org.springframework.dao.DataIntegrityViolationException;
                import org.springframework.http.HttpStatus;
                import org.springframework.http.converter.HttpMessageNotReadableException;
                import org.springframework.stereotype.Component;
                import org.springframework.web.servlet.function.ServerRequest;
                import org.springframework.web.servlet.function.ServerResponse;

                import java.time.Instant;
                import java.util.LinkedHashMap;
                import java.util.List;
                import java.util.Map;

                /**
                 * Converts handler failures into JSON error responses.
                 */
                @Component
                public class ApiErrorHandler {
                    private static final Logger log = LoggerFactory.getLogger(ApiErrorHandler.class);

                    public ServerResponse handle(Throwable error, ServerRequest request) {
                        if (error instanceof RequestValidationException invalid) {
                            return respond(HttpStatus.BAD_REQUEST, invalid.getMessage(), invalid.getErrors(), request);
                        }
                        if (error instanceof HttpMessageNotReadableException) {
                            return respond(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request);
                        }
                        if (error instanceof IllegalArgumentException) {
                            return respond(HttpStatus.BAD_REQUEST, error.getMessage(), List.of(), request);
                        }
                        if (error instanceof DataIntegrityViolationException) {
                            return respond(HttpStatus.CONFLICT, "Request conflicts with stored data", List.of(), request);
                        }
                        log.error("Unhandled error on {} {}", request.method(), request.path(), error);
                        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", List.of(), request);
                    }

                    private ServerResponse respond(HttpStatus status, String message, List<String> details,
                                                   ServerRequest request) {
                        Map<String, Object> body = new LinkedHashMap<>();
                        body.put("timestamp", Instant.now().toString());
                        body.put("status", status.value());
                        body.put("error", status.getReasonPhrase());
                        body.put("message", message);
                        if (!details.isEmpty()) {
                            body.put("details", details);
                        }
                        body.put("path", request.path());
                        return ServerResponse.status(status).body(body);
                    }
                }
                """.formatted(layout.getBasePackage(), layout.getBasePackage());

        return GeneratedFile.java(layout.javaPath("error", "ApiErrorHandler"), content);
    }
}
