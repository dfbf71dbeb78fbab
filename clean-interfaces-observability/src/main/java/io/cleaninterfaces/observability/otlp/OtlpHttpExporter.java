package io.cleaninterfaces.observability.otlp;

import io.cleaninterfaces.observability.ConfigurationException;
import io.cleaninterfaces.observability.LogRecord;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.exporter.otlp.http.logs.OtlpHttpLogRecordExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Exports batches over OTLP/HTTP to {@code <endpoint>/v1/logs} with the OpenTelemetry SDK
 * exporter. The SDK's own retries are disabled: {@link io.cleaninterfaces.observability.sink.OtlpSink}
 * owns the retry budget.
 */
public final class OtlpHttpExporter implements LogRecordExporter {

    public static final String LOGS_PATH = "/v1/logs";
    public static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private static final Logger logger = LoggerFactory.getLogger(OtlpHttpExporter.class);

    // slack on top of the HTTP call timeout before giving up on the result code
    private static final long JOIN_GRACE_MS = 100;

    private final URI uri;
    private final Duration timeout;
    private final OtlpLogRecordMapper mapper;
    private final OtlpHttpLogRecordExporter delegate;

    public OtlpHttpExporter(String endpoint, String serviceName, Map<String, String> resourceAttributes, Duration timeout) {
        this.uri = logsUri(endpoint);
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.mapper = new OtlpLogRecordMapper(resource(serviceName, resourceAttributes));
        this.delegate = OtlpHttpLogRecordExporter.builder()
                .setEndpoint(uri.toString())
                .setTimeout(timeout)
                .setConnectTimeout(timeout)
                .setRetryPolicy(null)
                .build();
    }

    static URI logsUri(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("OTLP endpoint must not be blank");
        }
        String base = endpoint.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String full = base.endsWith(LOGS_PATH) ? base : base + LOGS_PATH;
        URI uri;
        try {
            uri = URI.create(full);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid OTLP endpoint: " + endpoint, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigurationException("OTLP endpoint must be an absolute http(s) URL: " + endpoint);
        }
        return uri;
    }

    /**
     * SDK defaults, then the extra attributes, then {@code service.name}, which the extras
     * cannot override.
     */
    static Resource resource(String serviceName, Map<String, String> extraAttributes) {
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        AttributesBuilder extras = Attributes.builder();
        if (extraAttributes != null) {
            extraAttributes.forEach(extras::put);
        }
        return Resource.getDefault()
                .merge(Resource.create(extras.build()))
                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
    }

    public URI uri() {
        return uri;
    }

    public Resource resource() {
        return mapper.resource();
    }

    @Override
    public void export(List<LogRecord> batch) throws ExportException {
        if (batch.isEmpty()) {
            return;
        }
        CompletableResultCode result = delegate.export(mapper.map(batch));
        result.join(timeout.toMillis() + JOIN_GRACE_MS, TimeUnit.MILLISECONDS);
        if (!result.isDone()) {
            throw new ExportException("OTLP export timed out after " + timeout.toMillis() + " ms");
        }
        if (!result.isSuccess()) {
            Throwable failure = result.getFailureThrowable();
            if (failure == null) {
                throw new ExportException("OTLP export to " + uri + " failed");
            }
            throw new ExportException("OTLP export to " + uri + " failed: " + failure.getMessage(), failure);
        }
        logger.debug("Exported {} records to {}", batch.size(), uri);
    }

    @Override
    public void close() {
        CompletableResultCode shutdown = delegate.shutdown();
        shutdown.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!shutdown.isSuccess()) {
            logger.warn("Timed out waiting for the OTLP exporter to shut down");
        }
    }
}
