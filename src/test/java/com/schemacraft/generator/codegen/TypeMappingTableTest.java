package com.schemacraft.generator.codegen;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.schemacraft.generator.model.DataType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeMappingTable.
 */
class TypeMappingTableTest {

    @Test
    void testEveryDataTypeIsMapped() {
        assertThat(TypeMappingTable.entries().keySet()).isEqualTo(EnumSet.allOf(DataType.class));
        for (DataType type : DataType.values()) {
            assertThat(TypeMappingTable.get(type).getJavaType()).as(type.name()).isNotBlank();
        }
    }

    @Test
    void testTextualTypes() {
        Set<DataType> textual = TypeMappingTable.entries().entrySet().stream()
                .filter(e -> e.getValue().isTextual())
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());

        assertThat(textual).containsExactlyInAnyOrder(
                DataType.STRING, DataType.VARCHAR, DataType.CHAR, DataType.ENUM, DataType.TEXT, DataType.LONGTEXT);
    }

    @Test
    void testSelectedMappings() {
        assertThat(TypeMappingTable.get(DataType.DECIMAL).getJavaType()).isEqualTo("BigDecimal");
        assertThat(TypeMappingTable.get(DataType.DECIMAL).getImportName()).isEqualTo("java.math.BigDecimal");
        assertThat(TypeMappingTable.get(DataType.BIGINT).getJavaType()).isEqualTo("Long");
        assertThat(TypeMappingTable.get(DataType.UUID).getImportName()).isEqualTo("java.util.UUID");
        assertThat(TypeMappingTable.get(DataType.BLOB).isLob()).isTrue();
        assertThat(TypeMappingTable.get(DataType.JSON).getColumnDefinition()).isEqualTo("TEXT");
        assertThat(TypeMappingTable.get(DataType.JSON).isTextual()).isFalse();
        assertThat(TypeMappingTable.get(DataType.DATETIME).getJavaType()).isEqualTo("LocalDateTime");
    }

    @Test
    void testNullTypeIsRejected() {
        assertThatThrownBy(() -> TypeMappingTable.get(null))
                .isInstanceOf(SynthesisException.class);
    }
}
