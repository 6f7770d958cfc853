package com.schemacraft.generator.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingUtil.
 */
class NamingUtilTest {

    @Test
    void testWords() {
        assertThat(NamingUtil.words("HTTPServerLog")).containsExactly("HTTP", "Server", "Log");
        assertThat(NamingUtil.words("customer-id  code")).containsExactly("customer", "id", "code");
        assertThat(NamingUtil.words(null)).isEmpty();
    }

    @Test
    void testPascalCase() {
        assertThat(NamingUtil.toPascalCase("order_item")).isEqualTo("OrderItem");
        assertThat(NamingUtil.toPascalCase("CustomerID")).isEqualTo("CustomerId");
        assertThat(NamingUtil.toPascalCase("getHTTPResponse")).isEqualTo("GetHttpResponse");
    }

    @Test
    void testCamelCase() {
        assertThat(NamingUtil.toCamelCase("first_name")).isEqualTo("firstName");
        assertThat(NamingUtil.toCamelCase("OrderItem")).isEqualTo("orderItem");
    }

    @Test
    void testSnakeAndKebabCase() {
        assertThat(NamingUtil.toSnakeCase("CustomerID")).isEqualTo("customer_id");
        assertThat(NamingUtil.toSnakeCase("OrderItem")).isEqualTo("order_item");
        assertThat(NamingUtil.toSnakeCase("order-item")).isEqualTo("order_item");
        assertThat(NamingUtil.toSnakeCase("already_snake")).isEqualTo("already_snake");
        assertThat(NamingUtil.toKebabCase("Shop API")).isEqualTo("shop-api");
    }

    @Test
    void testClassNames() {
        assertThat(NamingUtil.toClassName("order_item")).isEqualTo("OrderItem");
        assertThat(NamingUtil.toClassName("3d_model")).isEqualTo("Entity3dModel");
        assertThat(NamingUtil.toClassName("")).isEqualTo("Entity");
        assertThat(NamingUtil.toEntityClassName("table")).isEqualTo("TableEntity");
        assertThat(NamingUtil.toEntityClassName("user")).isEqualTo("User");
    }

    @Test
    void testFieldNames() {
        assertThat(NamingUtil.toFieldName("Customer_Name")).isEqualTo("customerName");
        assertThat(NamingUtil.toFieldName("class")).isEqualTo("classValue");
        assertThat(NamingUtil.toFieldName("2fa_code")).isEqualTo("field2faCode");
        assertThat(NamingUtil.toFieldName("__")).isEqualTo("field");
    }

    @Test
    void testSpellingsOfOneNameAgree() {
        assertThat(NamingUtil.toSnakeCase("CustomerID"))
                .isEqualTo(NamingUtil.toSnakeCase("customer_id"))
                .isEqualTo(NamingUtil.toSnakeCase("customer-id"));
    }
}
