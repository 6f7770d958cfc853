package com.schemacraft.generator.codegen.generator;

import com.schemacraft.generator.codegen.ProjectLayout;
import com.schemacraft.generator.codegen.model.output.GeneratedFile;

/**
 * Generates the shared request validator used by every handler.
 */
public class RequestValidatorGenerator {

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    public GeneratedFile generate(ProjectLayout layout) {
        String content = """
                package %s.validation;

                import org.springframework.stereotype.Component;
                import org.springframework.web.servlet.function.ServerRequest;

                import java.util.ArrayList;
                import java.util.List;
                import java.util.Map;

                /**
                 * Checks required body fields and parses path and query parameters.
                 */
                @Component
                public class RequestValidator {

                    public static final int DEFAULT_PAGE_SIZE = %d;
                    public static final int MAX_PAGE_SIZE = %d;

                    public void requireFields(Map<String, Object> body, List<String> fields) {
                        if (body == null) {
                            throw new RequestValidationException("Request body is required", List.of());
                        }
                        List<String> missing = new ArrayList<>();
                        for (String field : fields) {
                            Object value = body.get(field);
                            if (value == null || (value instanceof String text && text.isBlank())) {
                                missing.add(field + " is required");
                            }
                        }
                        if (!missing.isEmpty()) {
                            throw new RequestValidationException("Missing required fields", missing);
                        }
                    }

                    public String requireParam(ServerRequest request, String name) {
                        return request.param(name)
                                .filter(value -> !value.isBlank())
                                .orElseThrow(() -> new RequestValidationException(
                                        "Query parameter '" + name + "' is required", List.of()));
                    }

                    public Long id(ServerRequest request) {
                        String raw = request.pathVariable("id");
                        try {
                            return Long.valueOf(raw);
                        } catch (NumberFormatException e) {
                            throw new RequestValidationException("Invalid id: " + raw, List.of());
                        }
                    }

                    public int page(ServerRequest request) {
                        int page = intParam(request, "page", 0);
                        if (page < 0) {
                            throw new RequestValidationException("page must not be negative", List.of());
                        }
                        return page;
                    }

                    public int size(ServerRequest request) {
                        int size = intParam(request, "size", DEFAULT_PAGE_SIZE);
                        if (size < 1 || size > MAX_PAGE_SIZE) {
                            throw new RequestValidationException(
                                    "size must be between 1 and " + MAX_PAGE_SIZE, List.of());
                        }
                        return size;
                    }

                    private int intParam(ServerRequest request, String name, int defaultValue) {
                        String raw = request.param(name).orElse(null);
                        if (raw == null || raw.isBlank()) {
                            return defaultValue;
                        }
                        try {
                            return Integer.parseInt(raw.trim());
                        } catch (NumberFormatException e) {
                            throw new RequestValidationException(name + " must be a number", List.of());
                        }
                    }

                    /**
                     * A request that failed validation; carries one message per problem.
                     */
                    public static class RequestValidationException extends RuntimeException {
                        private final List<String> errors;

                        public RequestValidationException(String message, List<String> errors) {
                            super(message);
                            this.errors = List.copyOf(errors);
                        }

                        public List<String> getErrors() {
                            return errors;
                        }
                    }
                }
                """.formatted(layout.getBasePackage(), DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);

        return GeneratedFile.java(layout.javaPath("validation", "RequestValidator"), content);
    }
}
