package com.schemacraft.generator.reconcile;

import lombok.Builder;
import lombok.Value;

/**
 * A foreign-key reference no candidate matched. Left as declared; the validator reports it.
 */
@Value
@Builder
public class ReconciliationGap {
    String entityName;
    String attributeName;
    String targetEntity;
    String targetAttribute;
}
