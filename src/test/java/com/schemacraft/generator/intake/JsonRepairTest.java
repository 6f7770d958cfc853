package com.schemacraft.generator.intake;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the individual JsonRepair transforms.
 */
class JsonRepairTest {

    @Test
    void testStripTrailingCommas() {
        assertThat(JsonRepair.stripTrailingCommas("{\"a\": [1, 2, ], }"))
                .isEqualTo("{\"a\": [1, 2]}");
    }

    @Test
    void testQuoteBareKeys() {
        assertThat(JsonRepair.quoteBareKeys("{name: \"x\", is_nullable: true}"))
                .isEqualTo("{\"name\": \"x\", \"is_nullable\": true}");
    }

    @Test
    void testQuotedKeysAreLeftAlone() {
        String json = "{\"name\": \"x\"}";
        assertThat(JsonRepair.quoteBareKeys(json)).isEqualTo(json);
    }

    @Test
    void testQuoteBareKeysSkipsStringValues() {
        String json = "{\"description\": \"Stores users, note: admins too\", flag: true}";
        assertThat(JsonRepair.quoteBareKeys(json))
                .isEqualTo("{\"description\": \"Stores users, note: admins too\", \"flag\": true}");
    }

    @Test
    void testStripTrailingCommasSkipsStringValues() {
        String json = "{\"note\": \"a, ]\", \"list\": [1,]}";
        assertThat(JsonRepair.stripTrailingCommas(json))
                .isEqualTo("{\"note\": \"a, ]\", \"list\": [1]}");
    }

    @Test
    void testEscapedQuoteDoesNotEndString() {
        String json = "{\"note\": \"say \\\"hi\\\", x: 1\"}";
        assertThat(JsonRepair.quoteBareKeys(json)).isEqualTo(json);
    }

    @Test
    void testNormalizeSingleQuotesEscapesInnerDoubleQuotes() {
        assertThat(JsonRepair.normalizeSingleQuotes("{'note': 'say \"hi\"'}"))
                .isEqualTo("{\"note\": \"say \\\"hi\\\"\"}");
    }

    @Test
    void testStepsRunInFixedOrder() {
        assertThat(JsonRepair.Step.values()).containsExactly(
                JsonRepair.Step.TRAILING_COMMAS,
                JsonRepair.Step.BARE_KEYS,
                JsonRepair.Step.SINGLE_QUOTES);
    }
}
