package com.schemacraft.generator.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the root command's logging setup.
 */
class SchemaCraftCommandTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(SchemaCraftCommand.LOGGER_NAME);

    private Level configured;

    @BeforeEach
    void rememberLevel() {
        configured = logger.getLevel();
    }

    @AfterEach
    void restoreLevel() {
        logger.setLevel(configured);
    }

    @Test
    void testConfiguredLevelIsKeptWithoutVerbose() {
        SchemaCraftCommand command = new SchemaCraftCommand();
        new CommandLine(command).parseArgs();

        command.configureLogging();

        assertThat(logger.getLevel()).isEqualTo(configured);
    }

    @Test
    void testVerboseEnablesDebug() {
        SchemaCraftCommand command = new SchemaCraftCommand();
        new CommandLine(command).parseArgs("-v");

        command.configureLogging();

        assertThat(command.isVerbose()).isTrue();
        assertThat(logger.getLevel()).isEqualTo(Level.DEBUG);
    }
}
