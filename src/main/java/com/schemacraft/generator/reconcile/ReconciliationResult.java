package com.schemacraft.generator.reconcile;

import java.util.List;

import com.schemacraft.generator.model.Schema;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Corrected schema plus the log of what was changed and what could not be.
 */
@Value
@Builder
public class ReconciliationResult {

    @NonNull
    Schema schema;

    @Singular
    List<ReferenceCorrection> corrections;

    @Singular
    List<ReconciliationGap> gaps;

    public boolean hasCorrections() {
        return !corrections.isEmpty();
    }
}
