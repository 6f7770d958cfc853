package com.schemacraft.generator.reconcile;

import java.util.Locale;

import lombok.Builder;
import lombok.Value;

/**
 * One rewritten foreign-key reference.
 */
@Value
@Builder
public class ReferenceCorrection {
    String entityName;
    String attributeName;
    String targetEntity;
    String declaredAttribute;
    String correctedAttribute;
    ReferenceMatch match;

    public String describe() {
        return "%s.%s -> %s.%s corrected to %s.%s (%s)".formatted(
                entityName, attributeName,
                targetEntity, declaredAttribute,
                targetEntity, correctedAttribute,
                match.name().toLowerCase(Locale.ROOT));
    }
}
