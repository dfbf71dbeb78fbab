package io.cleaninterfaces.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A single structured log record.
 *
 * <p>Caller supplied fields can never replace the canonical values: a field whose key is one
 * of {@link #RESERVED_KEYS} is dropped and the dropped keys are listed under
 * {@link #RESERVED_KEY_COLLISION}.</p>
 *
 * @param timestamp wall clock time in UTC
 * @param level     severity
 * @param message   short event name such as {@code "request_completed"}
 * @param fields    structured context, unmodifiable
 * @param component logical unit that emitted the record
 * @param traceId   optional correlation id, may be {@code null}
 * @param spanId    optional correlation id, may be {@code null}
 */
public record LogRecord(
        Instant timestamp,
        Level level,
        String message,
        Map<String, Object> fields,
        String component,
        String traceId,
        String spanId
) {

    public static final String TIMESTAMP = "timestamp";
    public static final String LEVEL = "level";
    public static final String MESSAGE = "message";
    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace_id";
    public static final String SPAN_ID = "span_id";

    public static final Set<String> RESERVED_KEYS = Set.of(TIMESTAMP, LEVEL, MESSAGE, COMPONENT, TRACE_ID, SPAN_ID);

    public static final String RESERVED_KEY_COLLISION = "reserved_key_collision";

    public LogRecord {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(component, "component must not be null");
        fields = sanitize(fields);
    }

    public LogRecord(Instant timestamp, Level level, String message, Map<String, ?> fields, String component) {
        this(timestamp, level, message, copyOf(fields), component, null, null);
    }

    public boolean hasTrace() {
        return traceId != null && !traceId.isEmpty();
    }

    private static Map<String, Object> copyOf(Map<String, ?> fields) {
        return fields == null ? Map.of() : new LinkedHashMap<>(fields);
    }

    private static Map<String, Object> sanitize(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        Set<String> dropped = new TreeSet<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            String key = Objects.requireNonNull(entry.getKey(), "field keys must not be null");
            if (RESERVED_KEYS.contains(key)) {
                dropped.add(key);
            } else {
                copy.put(key, entry.getValue());
            }
        }
        if (!dropped.isEmpty()) {
            copy.put(RESERVED_KEY_COLLISION, List.copyOf(dropped));
        }
        return Collections.unmodifiableMap(copy);
    }
}
