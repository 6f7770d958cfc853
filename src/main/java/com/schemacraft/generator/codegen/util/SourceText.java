package com.schemacraft.generator.codegen.util;

/**
 * Makes schema-supplied text safe to embed in generated Java source.
 */
public final class SourceText {

    private SourceText() {
        // Utility class
    }

    /**
     * Escapes a value for use inside a Java string literal (without the quotes).
     */
    public static String literal(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Flattens a value to one line that cannot close a comment.
     */
    public static String comment(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\r\\n]+", " ").replace("*/", "* /").trim();
    }
}
