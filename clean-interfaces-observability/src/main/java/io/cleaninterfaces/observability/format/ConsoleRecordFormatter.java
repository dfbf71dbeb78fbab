package io.cleaninterfaces.observability.format;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;

/**
 * Human readable line with ANSI colours, in the spirit of a developer console renderer:
 *
 * <pre>{@code
 * 2024-05-01 10:15:30.123 [info    ] started                  component=api port=8080
 * }</pre>
 */
public final class ConsoleRecordFormatter implements RecordFormatter {

    private static final DateTimeFormatter TS_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private static final String RESET = "\u001B[0m";
    private static final String DIM = "\u001B[2m";
    private static final String BOLD = "\u001B[1m";
    private static final String CYAN = "\u001B[36m";
    private static final String MAGENTA = "\u001B[35m";

    private static final int LEVEL_WIDTH = 8;
    private static final int MESSAGE_WIDTH = 24;

    private final boolean colors;

    public ConsoleRecordFormatter() {
        this(true);
    }

    public ConsoleRecordFormatter(boolean colors) {
        this.colors = colors;
    }

    @Override
    public String format(LogRecord record) {
        StringBuilder line = new StringBuilder(160);
        paint(line, DIM, TS_FORMAT.format(record.timestamp()));
        line.append(" [");
        paint(line, levelColor(record.level()), pad(record.level().name().toLowerCase(Locale.ROOT), LEVEL_WIDTH));
        line.append("] ");
        paint(line, BOLD, pad(record.message(), MESSAGE_WIDTH));

        appendPair(line, LogRecord.COMPONENT, record.component());
        if (record.traceId() != null) {
            appendPair(line, LogRecord.TRACE_ID, record.traceId());
        }
        if (record.spanId() != null) {
            appendPair(line, LogRecord.SPAN_ID, record.spanId());
        }
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            appendPair(line, field.getKey(), field.getValue());
        }
        return line.toString();
    }

    private void appendPair(StringBuilder line, String key, Object value) {
        line.append(' ');
        paint(line, CYAN, key);
        line.append('=');
        paint(line, MAGENTA, PlainRecordFormatter.renderValue(value));
    }

    private void paint(StringBuilder line, String color, String text) {
        if (colors) {
            line.append(color).append(text).append(RESET);
        } else {
            line.append(text);
        }
    }

    private static String levelColor(Level level) {
        return switch (level) {
            case DEBUG -> "\u001B[34m";
            case INFO -> "\u001B[32m";
            case WARNING -> "\u001B[33m";
            case ERROR -> "\u001B[31m";
            case CRITICAL -> "\u001B[1;31m";
        };
    }

    private static String pad(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }
}
