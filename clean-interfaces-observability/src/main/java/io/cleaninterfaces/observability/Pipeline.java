package io.cleaninterfaces.observability;

import io.cleaninterfaces.observability.profile.Profiler;
import io.cleaninterfaces.observability.sink.DispatchResult;
import io.cleaninterfaces.observability.sink.ExportMultiplexer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One configured logging pipeline: the export multiplexer built from an {@link ExportConfig}
 * snapshot plus the dispatch policy used by every {@link LoggerHandle} it hands out.
 */
public final class Pipeline implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private final ExportConfig config;
    private final ExportMultiplexer multiplexer;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Pipeline(ExportConfig config, ExportMultiplexer multiplexer, MeterRegistry meterRegistry, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.multiplexer = Objects.requireNonNull(multiplexer, "multiplexer must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Pipeline(ExportConfig config, ExportMultiplexer multiplexer) {
        this(config, multiplexer, new SimpleMeterRegistry(), Clock.systemUTC());
    }

    /**
     * @throws ConfigurationException if a configured sink cannot be created
     */
    public static Pipeline create(ExportConfig config) {
        return create(config, new SimpleMeterRegistry());
    }

    public static Pipeline create(ExportConfig config, MeterRegistry meterRegistry) {
        ExportMultiplexer multiplexer = ExportMultiplexer.create(config, meterRegistry);
        logger.info("Observability pipeline created: mode={}, level={}, dispatch={}",
                config.mode(), config.level(), config.dispatch());
        return new Pipeline(config, multiplexer, meterRegistry, Clock.systemUTC());
    }

    public LoggerHandle getLogger(String component) {
        return new LoggerHandle(this, component, Map.of(), null, null);
    }

    public Profiler profiler(LoggerHandle handle) {
        return new Profiler(handle, config.profilerEnabled(), config.profilerCollectMemory());
    }

    public boolean isEnabled(Level level) {
        return !closed.get() && level.isAtLeast(config.level());
    }

    /**
     * Send a record to the sinks, waiting for them when dispatch is {@link DispatchMode#SYNC}.
     * Never throws; records submitted after close are dropped.
     */
    public void submit(LogRecord record) {
        if (closed.get()) {
            return;
        }
        if (config.dispatch() == DispatchMode.SYNC) {
            DispatchResult result = multiplexer.deliver(record);
            if (!result.isHandled()) {
                logger.debug("Record '{}' was not handled by any sink", record.message());
            }
        } else {
            multiplexer.dispatch(record);
        }
    }

    public void flush() {
        multiplexer.flush();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            multiplexer.close();
            logger.info("Observability pipeline closed");
        }
    }

    public ExportConfig config() {
        return config;
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public Clock clock() {
        return clock;
    }

    ExportMultiplexer multiplexer() {
        return multiplexer;
    }
}
