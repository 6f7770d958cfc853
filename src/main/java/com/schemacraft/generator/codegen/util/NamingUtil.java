package com.schemacraft.generator.codegen.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Naming conventions shared by validation and code generation.
 *
 * Code-facing names are PascalCase (types) and camelCase (fields); storage-facing names
 * (tables, columns, resource paths) are lower snake_case. Every convention is derived from
 * the same word split, so {@code CustomerID}, {@code customer_id} and {@code customer-id}
 * all name the same thing.
 */
public final class NamingUtil {

    private static final Set<String> JAVA_KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
            "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
            "finally", "float", "for", "goto", "if", "implements", "import", "instanceof", "int",
            "interface", "long", "native", "new", "package", "private", "protected", "public",
            "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
            "throw", "throws", "transient", "try", "void", "volatile", "while",
            "true", "false", "null", "record", "yield", "sealed", "permits", "var");

    // Simple names the generated sources import or rely on unqualified
    private static final Set<String> RESERVED_TYPE_NAMES = Set.of(
            "Entity", "Table", "Column", "Id", "Lob", "GeneratedValue", "GenerationType",
            "Getter", "Setter", "NoArgsConstructor", "CreationTimestamp", "UpdateTimestamp",
            "Object", "String", "Integer", "Long", "Short", "Float", "Double", "Boolean", "Byte",
            "Character", "Number", "Void", "Class", "Record", "Exception", "Override", "System", "Math",
            "Thread", "Map", "List", "Optional", "Locale", "LocalDate", "LocalDateTime",
            "LocalTime", "BigDecimal", "Page", "PageRequest", "Pageable", "Sort", "Specification",
            "Service", "Component", "Configuration", "Bean", "Transactional", "ApiError",
            "RequestValidator");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Splits a name into words on separators and camel-case boundaries.
     * {@code HTTPServerLog} gives {@code [HTTP, Server, Log]}.
     */
    public static List<String> words(String name) {
        List<String> words = new ArrayList<>();
        if (name == null) {
            return words;
        }
        String spaced = name
                .replaceAll("([a-z0-9])([A-Z])", "$1 $2")
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2");
        for (String part : spaced.split("[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                words.add(part);
            }
        }
        return words;
    }

    /**
     * Converts any name to PascalCase, e.g. {@code order_item} to {@code OrderItem}.
     */
    public static String toPascalCase(String name) {
        return words(name).stream()
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts any name to camelCase.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Converts any name to lower snake_case, the storage naming convention.
     */
    public static String toSnakeCase(String name) {
        return words(name).stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
    }

    public static String toKebabCase(String name) {
        return words(name).stream()
                .map(w -> w.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("-"));
    }

    /**
     * Java type name for an entity or project name.
     */
    public static String toClassName(String name) {
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return "Entity";
        }
        return Character.isDigit(pascal.charAt(0)) ? "Entity" + pascal : pascal;
    }

    /**
     * Java type name for an entity, suffixed with {@code Entity} when the plain name would
     * clash with a type the generated sources use.
     */
    public static String toEntityClassName(String name) {
        String className = toClassName(name);
        return RESERVED_TYPE_NAMES.contains(className) ? className + "Entity" : className;
    }

    /**
     * Java field name for an attribute. Keywords get a {@code Value} suffix.
     */
    public static String toFieldName(String name) {
        String camel = toCamelCase(name);
        if (camel.isEmpty()) {
            return "field";
        }
        if (Character.isDigit(camel.charAt(0))) {
            return "field" + camel;
        }
        return JAVA_KEYWORDS.contains(camel) ? camel + "Value" : camel;
    }

    public static boolean isJavaKeyword(String name) {
        return JAVA_KEYWORDS.contains(name);
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1).toLowerCase(Locale.ROOT);
    }
}
