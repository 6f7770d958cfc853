package com.schemacraft.generator.validation;

public enum ValidationPhase {
    STRUCTURAL,
    SEMANTIC
}
