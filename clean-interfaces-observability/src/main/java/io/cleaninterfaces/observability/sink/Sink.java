package io.cleaninterfaces.observability.sink;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A destination for log records. Implementations never throw from {@link #deliver}; every
 * problem is reported as a failed {@link SinkOutcome}.
 */
public interface Sink extends Closeable {

    /**
     * Stable name used as the key of a {@link DispatchResult}, e.g. {@code "file"}.
     */
    String name();

    Level minimumLevel();

    SinkOutcome deliver(LogRecord record);

    /**
     * Push out everything buffered so far. Blocking, bounded by the sink's own timeouts.
     */
    void flush();

    /**
     * Upper bound for a single {@link #deliver} call, used by callers that wait on it.
     */
    Duration timeout();

    /**
     * Flush and release resources. Calling close more than once has no further effect.
     */
    @Override
    void close();

    abstract class AbstractSink implements Sink {

        private static final Logger logger = LoggerFactory.getLogger(AbstractSink.class);

        private final String name;
        private final Level minimumLevel;
        private final Duration timeout;
        private final SinkMetrics metrics;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        protected AbstractSink(String name, Level minimumLevel, Duration timeout, MeterRegistry registry) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel must not be null");
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            this.metrics = new SinkMetrics(name, registry);
        }

        @Override
        public final String name() {
            return name;
        }

        @Override
        public final Level minimumLevel() {
            return minimumLevel;
        }

        @Override
        public Duration timeout() {
            return timeout;
        }

        public final boolean isClosed() {
            return closed.get();
        }

        public final SinkMetrics metrics() {
            return metrics;
        }

        @Override
        public final SinkOutcome deliver(LogRecord record) {
            SinkOutcome outcome;
            if (!record.level().isAtLeast(minimumLevel)) {
                outcome = SinkOutcome.skipped();
            } else if (closed.get()) {
                outcome = SinkOutcome.failed("sink closed");
            } else {
                try {
                    outcome = doDeliver(record);
                } catch (RuntimeException e) {
                    logger.warn("Sink {} failed to deliver record", name, e);
                    outcome = SinkOutcome.failed(describe(e));
                }
            }
            metrics.record(outcome);
            return outcome;
        }

        @Override
        public final void close() {
            if (closed.compareAndSet(false, true)) {
                doClose();
                logger.debug("Sink {} closed", name);
            }
        }

        protected abstract SinkOutcome doDeliver(LogRecord record);

        protected abstract void doClose();

        protected static String describe(Throwable t) {
            String message = t.getMessage();
            return message == null || message.isBlank()
                    ? t.getClass().getSimpleName()
                    : t.getClass().getSimpleName() + ": " + message;
        }
    }
}
