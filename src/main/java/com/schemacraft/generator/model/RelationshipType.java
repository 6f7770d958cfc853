package com.schemacraft.generator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of relationship kinds.
 *
 * The set is deliberately redundant: extraction output uses many spellings for the same
 * cardinality, and each spelling is kept as its own constant so that the wire label survives
 * a round trip. {@link #getMultiplicity()} gives the folded base kind.
 */
public enum RelationshipType {
    ONE_TO_ONE("1:1", Multiplicity.ONE_TO_ONE),
    ONE_TO_MANY("1:N", Multiplicity.ONE_TO_MANY),
    MANY_TO_ONE("N:1", Multiplicity.MANY_TO_ONE),
    MANY_TO_MANY("M:N", Multiplicity.MANY_TO_MANY),

    ONE_TO_MANY_IDENTIFYING("1:N (Identifying)", Multiplicity.ONE_TO_MANY),
    ONE_TO_MANY_NON_IDENTIFYING("1:N (Non-Identifying)", Multiplicity.ONE_TO_MANY),
    MANY_TO_ONE_IDENTIFYING("N:1 (Identifying)", Multiplicity.MANY_TO_ONE),
    MANY_TO_ONE_NON_IDENTIFYING("N:1 (Non-Identifying)", Multiplicity.MANY_TO_ONE),
    ONE_TO_ONE_IDENTIFYING("1:1 (Identifying)", Multiplicity.ONE_TO_ONE),
    ONE_TO_ONE_NON_IDENTIFYING("1:1 (Non-Identifying)", Multiplicity.ONE_TO_ONE),
    MANY_TO_MANY_IDENTIFYING("M:N (Identifying)", Multiplicity.MANY_TO_MANY),
    MANY_TO_MANY_NON_IDENTIFYING("M:N (Non-Identifying)", Multiplicity.MANY_TO_MANY),
    ONE_TO_MANY_OPTIONAL("1:N (Optional)", Multiplicity.ONE_TO_MANY),
    ONE_TO_MANY_REQUIRED("1:N (Required)", Multiplicity.ONE_TO_MANY),
    MANY_TO_ONE_OPTIONAL("N:1 (Optional)", Multiplicity.MANY_TO_ONE),
    MANY_TO_ONE_REQUIRED("N:1 (Required)", Multiplicity.MANY_TO_ONE),

    MANY_TO_MANY_ALT("N:N", Multiplicity.MANY_TO_MANY),
    MANY_TO_MANY_ALT2("M:M", Multiplicity.MANY_TO_MANY),
    MANY_TO_ONE_ALT("M:1", Multiplicity.MANY_TO_ONE),
    ONE_TO_MANY_ALT("1:M", Multiplicity.ONE_TO_MANY);

    private final String label;
    private final Multiplicity multiplicity;

    RelationshipType(String label, Multiplicity multiplicity) {
        this.label = label;
        this.multiplicity = multiplicity;
    }

    public String getLabel() {
        return label;
    }

    public Multiplicity getMultiplicity() {
        return multiplicity;
    }

    /**
     * Matches a label exactly (ignoring case and surrounding whitespace) or one of the
     * natural-language phrasings.
     */
    public static Optional<RelationshipType> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (RelationshipType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(type);
            }
        }
        String phrase = trimmed.toLowerCase(Locale.ROOT)
                .replace('_', ' ')
                .replace('-', ' ')
                .replaceAll("\\s+", " ");
        return Optional.ofNullable(switch (phrase) {
            case "one to one", "1 to 1", "has one" -> ONE_TO_ONE;
            case "one to many", "1 to many", "1 to n", "has many" -> ONE_TO_MANY;
            case "many to one", "many to 1", "n to 1", "belongs to" -> MANY_TO_ONE;
            case "many to many", "n to n", "m to n", "m to m" -> MANY_TO_MANY;
            default -> null;
        });
    }

    /**
     * Lookup that falls back to the generic {@link #ONE_TO_MANY} kind.
     */
    public static RelationshipType coerce(String value) {
        return fromLabel(value).orElse(ONE_TO_MANY);
    }
}
