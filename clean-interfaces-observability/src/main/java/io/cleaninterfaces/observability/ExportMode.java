package io.cleaninterfaces.observability;

import java.util.Locale;

/**
 * Which sinks the export multiplexer drives.
 */
public enum ExportMode {
    FILE,
    OTLP,
    BOTH;

    public boolean includesFile() {
        return this == FILE || this == BOTH;
    }

    public boolean includesOtlp() {
        return this == OTLP || this == BOTH;
    }

    public static ExportMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Export mode must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "file" -> FILE;
            case "otlp" -> OTLP;
            case "both" -> BOTH;
            default -> throw new ConfigurationException(
                    "Unknown export mode '" + raw + "', expected one of file, otlp, both");
        };
    }
}
