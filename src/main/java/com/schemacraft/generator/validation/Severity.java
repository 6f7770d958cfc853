package com.schemacraft.generator.validation;

public enum Severity {
    ERROR,
    WARNING
}
