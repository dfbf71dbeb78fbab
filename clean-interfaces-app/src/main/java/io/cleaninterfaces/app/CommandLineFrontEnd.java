package io.cleaninterfaces.app;

import io.cleaninterfaces.observability.LoggerHandle;
import io.cleaninterfaces.observability.profile.Profiler;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line front-end. Without a command it prints the welcome message.
 */
public final class CommandLineFrontEnd implements FrontEnd {

    public static final String COMPONENT = "cli";

    public static final String WELCOME = "welcome";
    public static final String HELP = "help";

    static final String WELCOME_MESSAGE = "Welcome to Clean Interfaces!";
    static final String WELCOME_HINT = "Type --help for more information";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    private static final Map<String, String> COMMANDS = new LinkedHashMap<>();

    static {
        COMMANDS.put(WELCOME, "Display welcome message");
        COMMANDS.put(HELP, "Show available commands and their usage");
    }

    private final PrintStream out;
    private final LoggerHandle log;
    private final Profiler profiler;

    public CommandLineFrontEnd(PrintStream out, LoggerHandle log, Profiler profiler) {
        this.out = out;
        this.log = log;
        this.profiler = profiler;
    }

    @Override
    public String name() {
        return "CLI";
    }

    @Override
    public int run(List<String> commands) {
        String command = commands.isEmpty() ? WELCOME : commands.get(0);
        List<String> rest = commands.isEmpty() ? List.of() : commands.subList(1, commands.size());
        log.debug("command_received", Map.of("command", command, "arguments", rest));
        return switch (command) {
            case WELCOME -> profiler.get("cli.welcome", this::welcome);
            case HELP -> profiler.get("cli.help", () -> help(rest.isEmpty() ? null : rest.get(0)));
            default -> {
                log.warning("unknown_command", Map.of("command", command));
                out.println("Unknown command: " + command);
                out.println(WELCOME_HINT);
                yield EXIT_USAGE;
            }
        };
    }

    private int welcome() {
        out.println(WELCOME_MESSAGE);
        out.println(WELCOME_HINT);
        out.flush();
        return EXIT_OK;
    }

    private int help(String commandName) {
        if (commandName != null) {
            String description = COMMANDS.get(commandName);
            if (description == null) {
                out.println("Unknown command: " + commandName);
                return EXIT_USAGE;
            }
            out.println("Command: " + commandName);
            out.println("  " + description);
            return EXIT_OK;
        }
        out.println("Available Commands:");
        out.println();
        COMMANDS.forEach((name, description) -> out.println("  " + name + " - " + description));
        out.println();
        out.println("Use 'help <command>' for detailed help on a specific command.");
        out.flush();
        return EXIT_OK;
    }
}
