package com.schemacraft.generator.codegen.model.output;

/**
 * High-level file categories for generated artifacts.
 */
public enum GeneratedFileType {
    JAVA,
    RESOURCE,
    BUILD,
    DOCUMENTATION,
    SCHEMA
}
