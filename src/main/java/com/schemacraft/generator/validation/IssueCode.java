package com.schemacraft.generator.validation;

/**
 * Every condition the validator can report, with the phase that detects it.
 */
public enum IssueCode {
    NO_ENTITIES(ValidationPhase.STRUCTURAL),
    ENTITY_NAME_MISSING(ValidationPhase.STRUCTURAL),
    ENTITY_WITHOUT_ATTRIBUTES(ValidationPhase.STRUCTURAL),
    ATTRIBUTE_NAME_MISSING(ValidationPhase.STRUCTURAL),
    ATTRIBUTE_TYPE_MISSING(ValidationPhase.STRUCTURAL),
    INVALID_MAX_LENGTH(ValidationPhase.STRUCTURAL),
    RELATIONSHIP_ENDPOINT_MISSING(ValidationPhase.STRUCTURAL),
    RELATIONSHIP_TYPE_MISSING(ValidationPhase.STRUCTURAL),

    DUPLICATE_ENTITY(ValidationPhase.SEMANTIC),
    CLASS_NAME_COLLISION(ValidationPhase.SEMANTIC),
    STORAGE_NAME_COLLISION(ValidationPhase.SEMANTIC),
    DUPLICATE_ATTRIBUTE(ValidationPhase.SEMANTIC),
    FIELD_NAME_COLLISION(ValidationPhase.SEMANTIC),
    SELF_REFERENCE(ValidationPhase.SEMANTIC),
    UNKNOWN_RELATIONSHIP_ENTITY(ValidationPhase.SEMANTIC),
    DANGLING_REFERENCE(ValidationPhase.SEMANTIC),
    MISSING_PRIMARY_KEY(ValidationPhase.SEMANTIC),
    UNRELATED_ENTITY(ValidationPhase.SEMANTIC);

    private final ValidationPhase phase;

    IssueCode(ValidationPhase phase) {
        this.phase = phase;
    }

    public ValidationPhase getPhase() {
        return phase;
    }
}
