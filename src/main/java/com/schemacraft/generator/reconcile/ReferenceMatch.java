package com.schemacraft.generator.reconcile;

/**
 * Which rule picked a replacement reference target.
 */
public enum ReferenceMatch {

    /** Normalized names are equal. */
    EXACT,

    /** One normalized name contains the other. */
    SUBSTRING
}
