package com.schemacraft.generator.codegen;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.schemacraft.generator.model.DataType;

/**
 * The single table mapping every {@link DataType} to its generated representation.
 *
 * {@link #mappingFor(DataType)} is a switch expression without a default branch, so adding a
 * data type without a mapping does not compile.
 */
public final class TypeMappingTable {

    private static final Map<DataType, TypeMapping> TABLE = build();

    private TypeMappingTable() {
        // Utility class
    }

    public static TypeMapping get(DataType type) {
        if (type == null) {
            throw new SynthesisException("Attribute reached synthesis without a data type");
        }
        TypeMapping mapping = TABLE.get(type);
        if (mapping == null) {
            throw new SynthesisException("No type mapping for data type " + type);
        }
        return mapping;
    }

    public static Map<DataType, TypeMapping> entries() {
        return Collections.unmodifiableMap(TABLE);
    }

    private static Map<DataType, TypeMapping> build() {
        Map<DataType, TypeMapping> table = new EnumMap<>(DataType.class);
        for (DataType type : DataType.values()) {
            table.put(type, mappingFor(type));
        }
        return table;
    }

    static TypeMapping mappingFor(DataType type) {
        return switch (type) {
            case STRING, VARCHAR, CHAR, ENUM -> sizedText();
            case TEXT, LONGTEXT -> longText(true);
            case JSON, ARRAY, SET -> longText(false);
            case INTEGER, YEAR -> plain("Integer", null);
            case TINYINT, SMALLINT -> plain("Short", null);
            case BIGINT -> plain("Long", null);
            case FLOAT, REAL -> plain("Float", null);
            case DOUBLE -> plain("Double", null);
            case BOOLEAN -> plain("Boolean", null);
            case DECIMAL -> TypeMapping.builder()
                    .javaType("BigDecimal")
                    .importName("java.math.BigDecimal")
                    .exactNumeric(true)
                    .build();
            case DATE -> plain("LocalDate", "java.time.LocalDate");
            case DATETIME, TIMESTAMP -> plain("LocalDateTime", "java.time.LocalDateTime");
            case TIME -> plain("LocalTime", "java.time.LocalTime");
            case UUID -> plain("UUID", "java.util.UUID");
            case BLOB, BINARY -> TypeMapping.builder()
                    .javaType("byte[]")
                    .lob(true)
                    .build();
        };
    }

    private static TypeMapping plain(String javaType, String importName) {
        return TypeMapping.builder().javaType(javaType).importName(importName).build();
    }

    private static TypeMapping sizedText() {
        return TypeMapping.builder().javaType("String").textual(true).sized(true).build();
    }

    // Structured values are stored as serialized text but not searched
    private static TypeMapping longText(boolean textual) {
        return TypeMapping.builder().javaType("String").textual(textual).columnDefinition("TEXT").build();
    }
}
