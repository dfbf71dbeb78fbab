package io.cleaninterfaces.observability;

import java.util.Locale;

/**
 * Whether an emitting thread waits for every sink to answer ({@link #SYNC}) or hands the
 * record to the sink lanes and returns immediately ({@link #ASYNC}).
 */
public enum DispatchMode {
    SYNC,
    ASYNC;

    public static DispatchMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ASYNC;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "sync" -> SYNC;
            case "async" -> ASYNC;
            default -> throw new ConfigurationException(
                    "Unknown dispatch mode '" + raw + "', expected sync or async");
        };
    }
}
