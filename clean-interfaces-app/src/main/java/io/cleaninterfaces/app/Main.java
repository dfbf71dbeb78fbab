package io.cleaninterfaces.app;

import com.typesafe.config.ConfigFactory;

public class Main {
    public static void main(String[] args) {
        var commandLine = CommandLineConfig.parse(args);
        var config = commandLine.config().withFallback(ConfigFactory.load()).resolve();
        int exitCode = new Application(config, System.out).run(commandLine.commands());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
