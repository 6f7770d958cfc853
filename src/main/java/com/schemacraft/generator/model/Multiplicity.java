package com.schemacraft.generator.model;

/**
 * Base cardinality of a relationship, with all label variants folded away.
 */
public enum Multiplicity {
    ONE_TO_ONE,
    ONE_TO_MANY,
    MANY_TO_ONE,
    MANY_TO_MANY
}
