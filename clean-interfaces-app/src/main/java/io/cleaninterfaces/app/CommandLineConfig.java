package io.cleaninterfaces.app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code --conf key=value} overrides and the remaining command words.
 *
 * <pre>{@code
 * java -jar clean-interfaces-app.jar --conf clean_interfaces.observability.log_level=DEBUG help welcome
 * }</pre>
 */
public final class CommandLineConfig {

    public record ConfigWithCommands(Config config, List<String> commands) {}

    private CommandLineConfig() {
    }

    public static ConfigWithCommands parse(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        var buffer = new StringBuilder();
        if (argv.configs != null) {
            argv.configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }
        List<String> commands = new ArrayList<>();
        if (argv.help) {
            commands.add(CommandLineFrontEnd.HELP);
        }
        if (argv.commands != null) {
            commands.addAll(argv.commands);
        }
        return new ConfigWithCommands(ConfigFactory.parseString(buffer.toString()), List.copyOf(commands));
    }

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configuration overrides in HOCON syntax")
        private List<String> configs;

        @Parameter(names = {"--help", "-h"}, description = "Show available commands", help = true)
        private boolean help;

        @Parameter(description = "Command to run")
        private List<String> commands;
    }
}
