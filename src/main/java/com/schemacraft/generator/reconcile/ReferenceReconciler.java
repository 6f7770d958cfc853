package com.schemacraft.generator.reconcile;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schemacraft.generator.model.Attribute;
import com.schemacraft.generator.model.Entity;
import com.schemacraft.generator.model.Schema;

/**
 * Repairs foreign-key references whose column name does not exactly match an attribute
 * of the referenced entity.
 *
 * <p>Names are compared in a normalized form: lower-cased, underscores removed, and one
 * trailing {@code id} token dropped. Candidates are tried in the target entity's declared
 * attribute order; the first exact normalized match wins, otherwise the first candidate
 * where one normalized name contains the other. This is greedy and first-match on purpose,
 * so a given schema always reconciles the same way.
 *
 * <p>The input schema is never modified. A reference that already names an existing
 * attribute is left alone, which makes a second pass over the output a no-op.
 */
public class ReferenceReconciler {
    private static final Logger log = LoggerFactory.getLogger(ReferenceReconciler.class);

    private static final String IDENTIFIER_SUFFIX = "id";

    public ReconciliationResult reconcile(Schema schema) {
        ReconciliationResult.ReconciliationResultBuilder result = ReconciliationResult.builder();
        Schema.SchemaBuilder corrected = schema.toBuilder().clearEntities();

        for (Entity entity : schema.getEntities()) {
            Entity.EntityBuilder entityBuilder = entity.toBuilder().clearAttributes();
            for (Attribute attribute : entity.getAttributes()) {
                entityBuilder.attribute(reconcileAttribute(schema, entity, attribute, result));
            }
            corrected.entity(entityBuilder.build());
        }

        ReconciliationResult outcome = result.schema(corrected.build()).build();
        if (outcome.hasCorrections() || !outcome.getGaps().isEmpty()) {
            log.info("Reference reconciliation: {} corrected, {} unresolved",
                    outcome.getCorrections().size(), outcome.getGaps().size());
        }
        return outcome;
    }

    private Attribute reconcileAttribute(Schema schema, Entity owner, Attribute attribute,
                                         ReconciliationResult.ReconciliationResultBuilder result) {
        if (!attribute.hasReference()) {
            return attribute;
        }
        Optional<Entity> target = schema.findEntity(attribute.getReferencedEntity());
        if (target.isEmpty()) {
            // Missing entity is a validation error, nothing to match against
            return attribute;
        }
        String declared = attribute.getReferencedAttribute();
        if (target.get().findAttribute(declared).isPresent()) {
            return attribute;
        }

        List<Attribute> candidates = target.get().getAttributes();
        String wanted = normalize(declared);

        Optional<String> exact = candidates.stream()
                .map(Attribute::getName)
                .filter(name -> name != null && normalize(name).equals(wanted))
                .findFirst();
        if (exact.isPresent()) {
            return rewrite(owner, attribute, exact.get(), ReferenceMatch.EXACT, result);
        }

        Optional<String> partial = candidates.stream()
                .map(Attribute::getName)
                .filter(name -> name != null && containsEitherWay(normalize(name), wanted))
                .findFirst();
        if (partial.isPresent()) {
            return rewrite(owner, attribute, partial.get(), ReferenceMatch.SUBSTRING, result);
        }

        log.debug("No match for {}.{} -> {}.{}", owner.getName(), attribute.getName(),
                attribute.getReferencedEntity(), declared);
        result.gap(ReconciliationGap.builder()
                .entityName(owner.getName())
                .attributeName(attribute.getName())
                .targetEntity(attribute.getReferencedEntity())
                .targetAttribute(declared)
                .build());
        return attribute;
    }

    private Attribute rewrite(Entity owner, Attribute attribute, String replacement, ReferenceMatch match,
                              ReconciliationResult.ReconciliationResultBuilder result) {
        ReferenceCorrection correction = ReferenceCorrection.builder()
                .entityName(owner.getName())
                .attributeName(attribute.getName())
                .targetEntity(attribute.getReferencedEntity())
                .declaredAttribute(attribute.getReferencedAttribute())
                .correctedAttribute(replacement)
                .match(match)
                .build();
        log.debug("Corrected {}", correction.describe());
        result.correction(correction);
        return attribute.toBuilder().referencedAttribute(replacement).build();
    }

    /**
     * Comparison form of an attribute name: {@code CustomerID} and {@code customer_id} both
     * become {@code customer}.
     */
    static String normalize(String name) {
        String folded = name.toLowerCase(Locale.ROOT).replace("_", "");
        if (folded.endsWith(IDENTIFIER_SUFFIX)) {
            folded = folded.substring(0, folded.length() - IDENTIFIER_SUFFIX.length());
        }
        return folded;
    }

    // An empty form (a bare "id") would be contained in everything
    private static boolean containsEitherWay(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return a.contains(b) || b.contains(a);
    }
}
