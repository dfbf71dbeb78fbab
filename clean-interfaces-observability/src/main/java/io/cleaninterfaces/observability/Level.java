package io.cleaninterfaces.observability;

import java.util.Locale;

/**
 * Severity of a log record, ordered from least to most severe.
 */
public enum Level {
    DEBUG(5, "DEBUG"),
    INFO(9, "INFO"),
    WARNING(13, "WARN"),
    ERROR(17, "ERROR"),
    CRITICAL(21, "FATAL");

    private final int severityNumber;
    private final String severityText;

    Level(int severityNumber, String severityText) {
        this.severityNumber = severityNumber;
        this.severityText = severityText;
    }

    /**
     * OTLP severity number for this level.
     */
    public int severityNumber() {
        return severityNumber;
    }

    /**
     * OTLP severity text for this level.
     */
    public String severityText() {
        return severityText;
    }

    public boolean isAtLeast(Level threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Parse a level name. Matching is case-insensitive and accepts {@code WARN} and
     * {@code FATAL} as aliases.
     *
     * @throws ConfigurationException if the value is blank or unknown
     */
    public static Level parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Log level must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "DEBUG", "TRACE" -> DEBUG;
            case "INFO" -> INFO;
            case "WARNING", "WARN" -> WARNING;
            case "ERROR" -> ERROR;
            case "CRITICAL", "FATAL" -> CRITICAL;
            default -> throw new ConfigurationException("Unknown log level: " + raw);
        };
    }
}
