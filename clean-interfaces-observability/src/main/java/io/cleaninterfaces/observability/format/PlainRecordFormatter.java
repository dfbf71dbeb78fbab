package io.cleaninterfaces.observability.format;

import io.cleaninterfaces.observability.LogRecord;

import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * {@code key=value} pairs separated by spaces. Values containing whitespace, quotes or
 * {@code =} are double quoted with backslash escapes.
 *
 * <pre>{@code
 * timestamp=2024-05-01T10:15:30.123Z level=INFO message=started component=api port=8080
 * }</pre>
 */
public final class PlainRecordFormatter implements RecordFormatter {

    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ISO_INSTANT;

    @Override
    public String format(LogRecord record) {
        StringBuilder line = new StringBuilder(128);
        appendPair(line, LogRecord.TIMESTAMP, TS_FORMAT.format(record.timestamp()));
        appendPair(line, LogRecord.LEVEL, record.level().name());
        appendPair(line, LogRecord.MESSAGE, record.message());
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

    private static void appendPair(StringBuilder line, String key, Object value) {
        if (line.length() > 0) {
            line.append(' ');
        }
        line.append(key).append('=').append(renderValue(value));
    }

    static String renderValue(Object value) {
        String text = String.valueOf(value);
        if (!needsQuoting(text)) {
            return text;
        }
        StringBuilder quoted = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private static boolean needsQuoting(String text) {
        if (text.isEmpty()) {
            return true;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '"' || c == '=' || c == '\\') {
                return true;
            }
        }
        return false;
    }
}
