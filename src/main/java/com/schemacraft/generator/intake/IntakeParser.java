package com.schemacraft.generator.intake;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacraft.generator.model.Schema;
import com.schemacraft.generator.pipeline.StageError;
import com.schemacraft.generator.pipeline.StageErrorKind;
import com.schemacraft.generator.pipeline.StageResult;

/**
 * Turns free-text extraction output into a {@link RawDocument}.
 *
 * Parsing only:
 * - takes the span from the first '{' to the last '}'
 * - parses it strictly
 * - on failure applies each {@link JsonRepair.Step} once and parses again
 * - stamps the analysis timestamp into {@code metadata}
 *
 * It does NOT interpret the tree; that is the normalizer's job.
 */
public class IntakeParser {
    private static final Logger log = LoggerFactory.getLogger(IntakeParser.class);

    private static final ObjectMapper STRICT = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final Clock clock;

    public IntakeParser(Clock clock) {
        this.clock = clock;
    }

    public StageResult<RawDocument> parse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return failure("Response text is empty", null);
        }

        int start = responseText.indexOf('{');
        int end = responseText.lastIndexOf('}');
        if (start < 0 || end < start) {
            return failure("No JSON object found in response", null);
        }

        String candidate = responseText.substring(start, end + 1);
        List<JsonRepair.Step> applied = new ArrayList<>();

        JsonNode tree;
        try {
            tree = STRICT.readTree(candidate);
        } catch (JsonProcessingException first) {
            log.debug("Strict parse failed ({}), applying repairs", first.getOriginalMessage());
            String repaired = candidate;
            for (JsonRepair.Step step : JsonRepair.Step.values()) {
                String next = step.apply(repaired);
                if (!next.equals(repaired)) {
                    applied.add(step);
                }
                repaired = next;
            }
            try {
                tree = STRICT.readTree(repaired);
            } catch (JsonProcessingException second) {
                return failure("Invalid JSON in response after repair", second.getOriginalMessage());
            }
            log.info("Recovered JSON after repairs: {}", applied);
        }

        if (!(tree instanceof ObjectNode root)) {
            return failure("Response JSON is not an object", null);
        }

        stampTimestamp(root);

        return StageResult.success(RawDocument.builder()
                .root(root)
                .appliedRepairs(applied)
                .build());
    }

    private void stampTimestamp(ObjectNode root) {
        JsonNode metadata = root.get("metadata");
        ObjectNode target;
        if (metadata instanceof ObjectNode existing) {
            target = existing;
        } else {
            if (metadata != null && !metadata.isNull()) {
                log.debug("Replacing non-object metadata value: {}", metadata);
            }
            target = root.putObject("metadata");
        }
        target.put(Schema.TIMESTAMP_KEY, Instant.now(clock).toString());
    }

    private static StageResult<RawDocument> failure(String message, String detail) {
        log.warn("Intake parse failed: {}{}", message, detail == null ? "" : " - " + detail);
        return StageResult.failure(StageError.of(StageErrorKind.INTAKE_PARSE, message, detail));
    }
}
