package com.schemacraft.generator.intake;

import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Untyped JSON tree recovered from upstream text, before normalization.
 */
@Value
@Builder
public class RawDocument {

    @NonNull
    ObjectNode root;

    /**
     * Repair steps applied before the tree parsed; empty when the text parsed as-is.
     */
    @Singular
    List<JsonRepair.Step> appliedRepairs;

    public boolean isRepaired() {
        return !appliedRepairs.isEmpty();
    }
}
