package com.schemacraft.generator;

import com.schemacraft.generator.cli.SchemaCraftCommand;

import picocli.CommandLine;

/**
 * Main entry point of the SchemaCraft generator.
 * Compiles the text an ERD analysis service returns into a validated schema and
 * generates a Spring Boot service from it.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return new CommandLine(new SchemaCraftCommand()).execute(args);
    }
}
