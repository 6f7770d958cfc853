package com.schemacraft.generator.cli;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Root command. Holds the global options; the work happens in the subcommands.
 */
@Command(
        name = "schemacraft",
        mixinStandardHelpOptions = true,
        version = "schemacraft-generator 1.0.0",
        description = "Compiles ERD analysis output into a validated schema and a Spring Boot service.",
        subcommands = {
                GenerateCommand.class,
                ValidateCommand.class
        }
)
public class SchemaCraftCommand implements Runnable {

    static final String LOGGER_NAME = "com.schemacraft";

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Raises the tool's log level when verbose output was requested. Without {@code -v} the
     * level configured in logback.xml applies.
     */
    void configureLogging() {
        if (verbose && LoggerFactory.getLogger(LOGGER_NAME) instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }
}
