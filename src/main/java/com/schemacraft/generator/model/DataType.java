package com.schemacraft.generator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of attribute type tags an extracted schema may use.
 */
public enum DataType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATETIME("datetime"),
    TEXT("text"),
    JSON("json"),

    /**
     * Identifier-like value (UUID).
     */
    UUID("uuid"),
    DECIMAL("decimal"),
    ENUM("enum"),
    ARRAY("array"),
    TIME("time"),
    BLOB("blob"),
    BINARY("binary"),
    CHAR("char"),
    VARCHAR("varchar"),
    LONGTEXT("longtext"),
    TINYINT("tinyint"),
    SMALLINT("smallint"),
    BIGINT("bigint"),
    DOUBLE("double"),
    REAL("real"),
    TIMESTAMP("timestamp"),
    YEAR("year"),
    SET("set");

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    /**
     * Wire label of this type, as it appears in the canonical IR.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Case-insensitive lookup by label or one of the accepted aliases.
     */
    public static Optional<DataType> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(switch (normalized) {
            case "int" -> INTEGER;
            case "bool" -> BOOLEAN;
            case "str" -> STRING;
            case "identifier" -> UUID;
            case "date_time" -> DATETIME;
            case "number" -> DECIMAL;
            default -> null;
        });
    }

    /**
     * Lookup that falls back to {@link #STRING} for anything unrecognised.
     */
    public static DataType coerce(String value) {
        return fromLabel(value).orElse(STRING);
    }
}
