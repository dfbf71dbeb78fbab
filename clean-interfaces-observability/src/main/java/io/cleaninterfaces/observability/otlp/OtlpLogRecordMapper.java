package io.cleaninterfaces.observability.otlp;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.logs.Severity;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanId;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.logs.data.Body;
import io.opentelemetry.sdk.logs.data.LogRecordData;
import io.opentelemetry.sdk.resources.Resource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Maps {@link LogRecord}s onto the SDK's {@link LogRecordData} so the OTLP exporters can
 * encode them. The message becomes the body, the component and fields become attributes and
 * valid trace/span ids become the span context. Ids that are not valid W3C hex ids are kept
 * as {@code trace_id}/{@code span_id} attributes instead.
 */
public final class OtlpLogRecordMapper {

    public static final String SCOPE_NAME = "io.cleaninterfaces.observability";

    private final Resource resource;
    private final InstrumentationScopeInfo scope;

    public OtlpLogRecordMapper(Resource resource) {
        this.resource = Objects.requireNonNull(resource, "resource must not be null");
        this.scope = InstrumentationScopeInfo.create(SCOPE_NAME);
    }

    public Resource resource() {
        return resource;
    }

    public List<LogRecordData> map(List<LogRecord> batch) {
        List<LogRecordData> data = new ArrayList<>(batch.size());
        for (LogRecord record : batch) {
            data.add(map(record));
        }
        return data;
    }

    public LogRecordData map(LogRecord record) {
        AttributesBuilder attributes = Attributes.builder();
        attributes.put(LogRecord.COMPONENT, record.component());
        for (Map.Entry<String, Object> field : record.fields().entrySet()) {
            putAttribute(attributes, field.getKey(), field.getValue());
        }
        SpanContext spanContext = spanContext(record);
        if (!spanContext.isValid()) {
            if (record.traceId() != null) {
                attributes.put(LogRecord.TRACE_ID, record.traceId());
            }
            if (record.spanId() != null) {
                attributes.put(LogRecord.SPAN_ID, record.spanId());
            }
        }
        return new MappedLogRecordData(resource, scope, toEpochNanos(record.timestamp()), spanContext,
                severity(record.level()), record.level().severityText(), record.message(), attributes.build());
    }

    static Severity severity(Level level) {
        return switch (level) {
            case DEBUG -> Severity.DEBUG;
            case INFO -> Severity.INFO;
            case WARNING -> Severity.WARN;
            case ERROR -> Severity.ERROR;
            case CRITICAL -> Severity.FATAL;
        };
    }

    static long toEpochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }

    private static SpanContext spanContext(LogRecord record) {
        if (!record.hasTrace()) {
            return SpanContext.getInvalid();
        }
        String spanId = record.spanId() == null ? SpanId.getInvalid() : record.spanId();
        SpanContext context = SpanContext.create(record.traceId(), spanId, TraceFlags.getDefault(), TraceState.getDefault());
        return context.isValid() ? context : SpanContext.getInvalid();
    }

    // null values carry no information on the wire
    static void putAttribute(AttributesBuilder attributes, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String s) {
            attributes.put(key, s);
        } else if (value instanceof Boolean b) {
            attributes.put(key, b);
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            attributes.put(key, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            attributes.put(key, ((Number) value).doubleValue());
        } else if (value instanceof Collection<?> collection && isAllStrings(collection)) {
            List<String> values = new ArrayList<>(collection.size());
            collection.forEach(v -> values.add((String) v));
            attributes.put(AttributeKey.stringArrayKey(key), values);
        } else {
            attributes.put(key, String.valueOf(value));
        }
    }

    private static boolean isAllStrings(Collection<?> collection) {
        for (Object v : collection) {
            if (!(v instanceof String)) {
                return false;
            }
        }
        return true;
    }

    private static final class MappedLogRecordData implements LogRecordData {
        private final Resource resource;
        private final InstrumentationScopeInfo scope;
        private final long epochNanos;
        private final SpanContext spanContext;
        private final Severity severity;
        private final String severityText;
        private final String body;
        private final Attributes attributes;

        private MappedLogRecordData(Resource resource, InstrumentationScopeInfo scope, long epochNanos,
                                    SpanContext spanContext, Severity severity, String severityText,
                                    String body, Attributes attributes) {
            this.resource = resource;
            this.scope = scope;
            this.epochNanos = epochNanos;
            this.spanContext = spanContext;
            this.severity = severity;
            this.severityText = severityText;
            this.body = body;
            this.attributes = attributes;
        }

        @Override
        public Resource getResource() {
            return resource;
        }

        @Override
        public InstrumentationScopeInfo getInstrumentationScopeInfo() {
            return scope;
        }

        @Override
        public long getTimestampEpochNanos() {
            return epochNanos;
        }

        @Override
        public long getObservedTimestampEpochNanos() {
            return epochNanos;
        }

        @Override
        public SpanContext getSpanContext() {
            return spanContext;
        }

        @Override
        public Severity getSeverity() {
            return severity;
        }

        @Override
        public String getSeverityText() {
            return severityText;
        }

        @Override
        @SuppressWarnings("deprecation")
        public Body getBody() {
            return Body.string(body);
        }

        @Override
        public Attributes getAttributes() {
            return attributes;
        }

        @Override
        public int getTotalAttributeCount() {
            return attributes.size();
        }
    }
}
