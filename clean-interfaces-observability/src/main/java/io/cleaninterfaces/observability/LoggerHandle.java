package io.cleaninterfaces.observability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable logger bound to a component and a set of context fields. {@link #bind} and
 * {@link #withTrace} return new handles; the receiver is never modified, so a handle can be
 * shared freely between threads.
 */
public final class LoggerHandle {

    public static final String ERROR_TYPE = "error.type";
    public static final String ERROR_MESSAGE = "error.message";

    private final Pipeline pipeline;
    private final String component;
    private final Map<String, Object> fields;
    private final String traceId;
    private final String spanId;

    LoggerHandle(Pipeline pipeline, String component, Map<String, ?> fields, String traceId, String spanId) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.component = Objects.requireNonNull(component, "component must not be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(fields));
        this.traceId = traceId;
        this.spanId = spanId;
    }

    public String component() {
        return component;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public String traceId() {
        return traceId;
    }

    public String spanId() {
        return spanId;
    }

    public LoggerHandle bind(Map<String, ?> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(fields);
        merged.putAll(extra);
        return new LoggerHandle(pipeline, component, merged, traceId, spanId);
    }

    public LoggerHandle bind(String key, Object value) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put(key, value);
        return bind(extra);
    }

    public LoggerHandle withTrace(String traceId, String spanId) {
        return new LoggerHandle(pipeline, component, fields, traceId, spanId);
    }

    public boolean isEnabled(Level level) {
        return pipeline.isEnabled(level);
    }

    public void emit(Level level, String message, Map<String, ?> callFields) {
        if (!pipeline.isEnabled(level)) {
            return;
        }
        Map<String, Object> merged;
        if (callFields == null || callFields.isEmpty()) {
            merged = fields;
        } else {
            merged = new LinkedHashMap<>(fields);
            merged.putAll(callFields);
        }
        pipeline.submit(new LogRecord(pipeline.clock().instant(), level, message, merged, component, traceId, spanId));
    }

    public void debug(String message) {
        emit(Level.DEBUG, message, null);
    }

    public void debug(String message, Map<String, ?> fields) {
        emit(Level.DEBUG, message, fields);
    }

    public void info(String message) {
        emit(Level.INFO, message, null);
    }

    public void info(String message, Map<String, ?> fields) {
        emit(Level.INFO, message, fields);
    }

    public void warning(String message) {
        emit(Level.WARNING, message, null);
    }

    public void warning(String message, Map<String, ?> fields) {
        emit(Level.WARNING, message, fields);
    }

    public void error(String message) {
        emit(Level.ERROR, message, null);
    }

    public void error(String message, Map<String, ?> fields) {
        emit(Level.ERROR, message, fields);
    }

    public void critical(String message) {
        emit(Level.CRITICAL, message, null);
    }

    public void critical(String message, Map<String, ?> fields) {
        emit(Level.CRITICAL, message, fields);
    }

    /**
     * Emit at ERROR with the throwable's type and message attached.
     */
    public void exception(String message, Throwable throwable, Map<String, ?> fields) {
        if (!pipeline.isEnabled(Level.ERROR)) {
            return;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        if (fields != null) {
            merged.putAll(fields);
        }
        if (throwable != null) {
            merged.put(ERROR_TYPE, throwable.getClass().getName());
            merged.put(ERROR_MESSAGE, String.valueOf(throwable.getMessage()));
        }
        emit(Level.ERROR, message, merged);
    }

    public void exception(String message, Throwable throwable) {
        exception(message, throwable, null);
    }

    @Override
    public String toString() {
        return "LoggerHandle{component=" + component + ", fields=" + fields.keySet() + "}";
    }
}
