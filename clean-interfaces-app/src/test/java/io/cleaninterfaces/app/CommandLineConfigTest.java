package io.cleaninterfaces.app;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineConfigTest {

    @Test
    void parse_collectsConfOverridesAndCommands() {
        var parsed = CommandLineConfig.parse(new String[]{
                "--conf", "clean_interfaces.observability.log_level=DEBUG",
                "--conf", "clean_interfaces.interface_type=cli",
                "help", "welcome"
        });

        assertEquals("DEBUG", parsed.config().getString("clean_interfaces.observability.log_level"));
        assertEquals("cli", parsed.config().getString("clean_interfaces.interface_type"));
        assertEquals(List.of("help", "welcome"), parsed.commands());
    }

    @Test
    void parse_helpFlagBecomesHelpCommand() {
        var parsed = CommandLineConfig.parse(new String[]{"--help"});

        assertEquals(List.of("help"), parsed.commands());
        assertTrue(parsed.config().isEmpty());
    }

    @Test
    void parse_noArguments() {
        var parsed = CommandLineConfig.parse(new String[0]);

        assertTrue(parsed.commands().isEmpty());
    }
}
