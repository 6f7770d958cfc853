package com.schemacraft.generator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The canonical schema IR.
 *
 * Entity order is significant: it is the only signal for which entity is "primary" and it
 * fixes the order of everything the synthesizer emits.
 */
@Value
@Builder(toBuilder = true)
public class Schema {

    /**
     * Metadata key the intake parser stamps with an ISO-8601 instant.
     */
    public static final String TIMESTAMP_KEY = "analysisTimestamp";

    String projectName;

    @Singular
    List<Entity> entities;

    @Singular
    List<Relationship> relationships;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * First entity with the given name, in declaration order.
     */
    public Optional<Entity> findEntity(String entityName) {
        return entities.stream()
                .filter(e -> e.getName() != null && e.getName().equals(entityName))
                .findFirst();
    }

    public Optional<String> getTimestamp() {
        Object value = metadata.get(TIMESTAMP_KEY);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
