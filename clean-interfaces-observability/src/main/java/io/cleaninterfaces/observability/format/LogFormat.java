package io.cleaninterfaces.observability.format;

import io.cleaninterfaces.observability.ConfigurationException;

import java.util.Locale;

public enum LogFormat {
    JSON,
    CONSOLE,
    PLAIN;

    public RecordFormatter formatter() {
        return switch (this) {
            case JSON -> new JsonRecordFormatter();
            case CONSOLE -> new ConsoleRecordFormatter();
            case PLAIN -> new PlainRecordFormatter();
        };
    }

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "console" -> CONSOLE;
            case "plain" -> PLAIN;
            default -> throw new ConfigurationException(
                    "Unknown log format '" + raw + "', expected one of json, console, plain");
        };
    }
}
