package io.cleaninterfaces.observability.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One JSON object per line. Canonical keys come first ({@code timestamp}, {@code level},
 * {@code message}, {@code component}, then {@code trace_id}/{@code span_id} when present),
 * followed by the record fields.
 *
 * <pre>{@code
 * {"timestamp":"2024-05-01T10:15:30.123Z","level":"INFO","message":"started","component":"api","port":8080}
 * }</pre>
 */
public final class JsonRecordFormatter implements RecordFormatter {

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final DateTimeFormatter TS_FORMAT = DateTimeFormatter.ISO_INSTANT;

    @Override
    public String format(LogRecord record) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(LogRecord.TIMESTAMP, TS_FORMAT.format(record.timestamp()));
        json.put(LogRecord.LEVEL, record.level().name());
        json.put(LogRecord.MESSAGE, record.message());
        json.put(LogRecord.COMPONENT, record.component());
        if (record.traceId() != null) {
            json.put(LogRecord.TRACE_ID, record.traceId());
        }
        if (record.spanId() != null) {
            json.put(LogRecord.SPAN_ID, record.spanId());
        }
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            json.put(field.getKey(), toJsonValue(field.getValue()));
        }
        try {
            return mapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize log record '" + record.message() + "'", e);
        }
    }

    /**
     * Read a line produced by {@link #format(LogRecord)} back into a record.
     *
     * @throws IllegalArgumentException if the line is not a JSON object with the canonical keys
     */
    public static LogRecord parse(String line) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON log line: " + line, e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Not a JSON object: " + line);
        }
        ObjectNode object = (ObjectNode) node;
        Instant timestamp = Instant.parse(required(object, LogRecord.TIMESTAMP));
        Level level = Level.parse(required(object, LogRecord.LEVEL));
        String message = required(object, LogRecord.MESSAGE);
        String component = object.hasNonNull(LogRecord.COMPONENT) ? object.get(LogRecord.COMPONENT).asText() : "";
        String traceId = object.hasNonNull(LogRecord.TRACE_ID) ? object.get(LogRecord.TRACE_ID).asText() : null;
        String spanId = object.hasNonNull(LogRecord.SPAN_ID) ? object.get(LogRecord.SPAN_ID).asText() : null;

        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!LogRecord.RESERVED_KEYS.contains(entry.getKey())) {
                fields.put(entry.getKey(), mapper.convertValue(entry.getValue(), Object.class));
            }
        }
        return new LogRecord(timestamp, level, message, fields, component, traceId, spanId);
    }

    private static String required(ObjectNode object, String key) {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("JSON log line is missing '" + key + "'");
        }
        return value.asText();
    }

    // Values Jackson cannot serialize without extra modules are rendered with toString()
    static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                converted.put(String.valueOf(entry.getKey()), toJsonValue(entry.getValue()));
            }
            return converted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> converted = new ArrayList<>(collection.size());
            for (Object item : collection) {
                converted.add(toJsonValue(item));
            }
            return converted;
        }
        if (value instanceof Object[] array) {
            List<Object> converted = new ArrayList<>(array.length);
            for (Object item : array) {
                converted.add(toJsonValue(item));
            }
            return converted;
        }
        return value.toString();
    }
}
