package io.cleaninterfaces.observability;

import io.cleaninterfaces.observability.format.LogFormat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the observability settings. A pipeline is built from one snapshot
 * and never re-reads it; use the builder to create instances.
 */
public record ExportConfig(
        // Routing
        ExportMode mode,
        Level level,
        DispatchMode dispatch,
        int laneCapacity,

        // File sink
        Path filePath,
        LogFormat format,

        // OTLP sink
        String endpoint,
        String serviceName,
        Map<String, String> resourceAttributes,
        Duration timeout,
        int batchSize,
        int maxQueueSize,
        int maxRetries,
        Duration flushInterval,

        // Performance instrumentation
        boolean profilerEnabled,
        boolean profilerCollectMemory
) {
    public ExportConfig {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(dispatch, "dispatch must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(flushInterval, "flushInterval must not be null");
        resourceAttributes = resourceAttributes == null ? Map.of() : Map.copyOf(resourceAttributes);

        if (mode.includesFile() && filePath == null) {
            throw new ConfigurationException("A log file path is required when export mode is " + mode.name().toLowerCase(Locale.ROOT));
        }
        if (mode.includesOtlp() && (endpoint == null || endpoint.isBlank())) {
            throw new ConfigurationException("An OTLP endpoint is required when export mode is " + mode.name().toLowerCase(Locale.ROOT));
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("Export timeout must be positive, got: " + timeout);
        }
        if (flushInterval.isNegative() || flushInterval.isZero()) {
            throw new ConfigurationException("Flush interval must be positive, got: " + flushInterval);
        }
        if (batchSize <= 0) {
            throw new ConfigurationException("batchSize must be positive, got: " + batchSize);
        }
        if (maxQueueSize < batchSize) {
            throw new ConfigurationException("maxQueueSize must be >= batchSize, got: " + maxQueueSize + " < " + batchSize);
        }
        if (maxRetries < 0) {
            throw new ConfigurationException("maxRetries must be non-negative, got: " + maxRetries);
        }
        if (laneCapacity <= 0) {
            throw new ConfigurationException("laneCapacity must be positive, got: " + laneCapacity);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ExportMode mode = ExportMode.FILE;
        private Level level = Level.INFO;
        private DispatchMode dispatch = DispatchMode.ASYNC;
        private int laneCapacity = 10_000;
        private Path filePath;
        private LogFormat format = LogFormat.JSON;
        private String endpoint = "http://localhost:4318";
        private String serviceName = "clean-interfaces";
        private Map<String, String> resourceAttributes = Map.of();
        private Duration timeout = Duration.ofSeconds(5);
        private int batchSize = 64;
        private int maxQueueSize = 2048;
        private int maxRetries = 3;
        private Duration flushInterval = Duration.ofSeconds(5);
        private boolean profilerEnabled = true;
        private boolean profilerCollectMemory = false;

        private Builder() {
        }

        public Builder mode(ExportMode mode) {
            this.mode = Objects.requireNonNull(mode);
            return this;
        }

        public Builder level(Level level) {
            this.level = Objects.requireNonNull(level);
            return this;
        }

        public Builder dispatch(DispatchMode dispatch) {
            this.dispatch = Objects.requireNonNull(dispatch);
            return this;
        }

        public Builder laneCapacity(int laneCapacity) {
            this.laneCapacity = laneCapacity;
            return this;
        }

        public Builder filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder format(LogFormat format) {
            this.format = Objects.requireNonNull(format);
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = Objects.requireNonNull(serviceName);
            return this;
        }

        public Builder resourceAttributes(Map<String, String> resourceAttributes) {
            this.resourceAttributes = Objects.requireNonNull(resourceAttributes);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout);
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = Objects.requireNonNull(flushInterval);
            return this;
        }

        public Builder profilerEnabled(boolean profilerEnabled) {
            this.profilerEnabled = profilerEnabled;
            return this;
        }

        public Builder profilerCollectMemory(boolean profilerCollectMemory) {
            this.profilerCollectMemory = profilerCollectMemory;
            return this;
        }

        /**
         * @throws ConfigurationException if the combination of values is invalid
         */
        public ExportConfig build() {
            return new ExportConfig(
                    mode,
                    level,
                    dispatch,
                    laneCapacity,
                    filePath,
                    format,
                    endpoint,
                    serviceName,
                    resourceAttributes,
                    timeout,
                    batchSize,
                    maxQueueSize,
                    maxRetries,
                    flushInterval,
                    profilerEnabled,
                    profilerCollectMemory
            );
        }
    }
}
