package io.cleaninterfaces.observability.sink;

import io.cleaninterfaces.observability.ExportConfig;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.otlp.OtlpHttpExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans each record out to every configured sink.
 *
 * <p>Every sink has its own lane, a single worker thread fed by a bounded queue. Records
 * submitted in sequence by one thread reach each sink in that order, and a slow sink only
 * backs up its own lane.</p>
 */
public final class ExportMultiplexer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ExportMultiplexer.class);

    static final Duration GRACE = Duration.ofMillis(250);
    private static final int WARN_EVERY = 100;

    private final List<Lane> lanes;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong failureCount = new AtomicLong();

    public ExportMultiplexer(List<? extends Sink> sinks, int laneCapacity) {
        if (sinks.isEmpty()) {
            throw new IllegalArgumentException("At least one sink is required");
        }
        List<Lane> built = new ArrayList<>(sinks.size());
        for (Sink sink : sinks) {
            built.add(new Lane(sink, laneCapacity));
        }
        this.lanes = List.copyOf(built);
    }

    /**
     * Build the sinks selected by the export mode. Sinks created before a failing one are
     * closed again before the exception propagates.
     *
     * @throws io.cleaninterfaces.observability.ConfigurationException if a sink cannot be created
     */
    public static ExportMultiplexer create(ExportConfig config, MeterRegistry registry) {
        List<Sink> sinks = new ArrayList<>(2);
        try {
            if (config.mode().includesFile()) {
                sinks.add(new FileSink(config.filePath(), config.format().formatter(), config.level(),
                        config.timeout(), registry));
            }
            if (config.mode().includesOtlp()) {
                OtlpHttpExporter exporter = new OtlpHttpExporter(config.endpoint(), config.serviceName(),
                        config.resourceAttributes(), config.timeout());
                sinks.add(new OtlpSink(exporter, config.level(), config.timeout(), config.batchSize(),
                        config.maxQueueSize(), config.maxRetries(), config.flushInterval(), registry));
            }
        } catch (RuntimeException e) {
            sinks.forEach(Sink::close);
            throw e;
        }
        logger.info("Export multiplexer created for mode={} with sinks={}", config.mode(),
                sinks.stream().map(Sink::name).toList());
        return new ExportMultiplexer(sinks, config.laneCapacity());
    }

    public List<String> sinkNames() {
        return lanes.stream().map(l -> l.sink.name()).toList();
    }

    /**
     * Hand the record to every lane without waiting for the sinks.
     */
    public CompletableFuture<DispatchResult> dispatch(LogRecord record) {
        if (closed.get()) {
            return CompletableFuture.completedFuture(closedResult());
        }
        List<CompletableFuture<SinkOutcome>> futures = new ArrayList<>(lanes.size());
        for (Lane lane : lanes) {
            futures.add(lane.submit(record));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, SinkOutcome> outcomes = new LinkedHashMap<>();
                    for (int i = 0; i < lanes.size(); i++) {
                        outcomes.put(lanes.get(i).sink.name(), futures.get(i).join());
                    }
                    return report(record, new DispatchResult(outcomes));
                });
    }

    /**
     * Deliver to every sink and wait for the outcomes. Each lane is waited on for at most
     * its sink's timeout plus a short grace period.
     */
    public DispatchResult deliver(LogRecord record) {
        if (closed.get()) {
            return closedResult();
        }
        List<CompletableFuture<SinkOutcome>> futures = new ArrayList<>(lanes.size());
        for (Lane lane : lanes) {
            futures.add(lane.submit(record));
        }
        Map<String, SinkOutcome> outcomes = new LinkedHashMap<>();
        for (int i = 0; i < lanes.size(); i++) {
            Lane lane = lanes.get(i);
            outcomes.put(lane.sink.name(), await(futures.get(i), lane.sink.timeout().plus(GRACE)));
        }
        return report(record, new DispatchResult(outcomes));
    }

    private static SinkOutcome await(CompletableFuture<SinkOutcome> future, Duration limit) {
        try {
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return SinkOutcome.failed("timed out waiting for sink");
        } catch (ExecutionException e) {
            return SinkOutcome.failed(Sink.AbstractSink.describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SinkOutcome.failed("interrupted while waiting for sink");
        }
    }

    private DispatchResult report(LogRecord record, DispatchResult result) {
        Map<String, SinkOutcome> failures = result.failures();
        if (!failures.isEmpty()) {
            long n = failureCount.incrementAndGet();
            if (n == 1 || n % WARN_EVERY == 0) {
                logger.warn("Record '{}' from component {} failed on {} (failure #{})",
                        record.message(), record.component(), failures, n);
            }
        }
        return result;
    }

    private DispatchResult closedResult() {
        Map<String, SinkOutcome> outcomes = new LinkedHashMap<>();
        for (Lane lane : lanes) {
            outcomes.put(lane.sink.name(), SinkOutcome.failed("multiplexer closed"));
        }
        return new DispatchResult(outcomes);
    }

    /**
     * Flush every sink through its lane, so the flush happens after everything already queued.
     */
    public void flush() {
        if (closed.get()) {
            return;
        }
        List<CompletableFuture<Void>> pending = new ArrayList<>(lanes.size());
        for (Lane lane : lanes) {
            pending.add(lane.flush());
        }
        for (int i = 0; i < lanes.size(); i++) {
            Lane lane = lanes.get(i);
            try {
                pending.get(i).get(shutdownWindow(lane).toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warn("Timed out flushing sink {}", lane.sink.name());
            } catch (ExecutionException e) {
                logger.warn("Failed to flush sink {}", lane.sink.name(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Drain the lanes and close every sink. Later dispatches report "multiplexer closed".
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Lane lane : lanes) {
            lane.executor.shutdown();
        }
        for (Lane lane : lanes) {
            try {
                if (!lane.executor.awaitTermination(shutdownWindow(lane).toMillis(), TimeUnit.MILLISECONDS)) {
                    List<Runnable> abandoned = lane.executor.shutdownNow();
                    logger.warn("Sink {} did not drain in time, {} records abandoned",
                            lane.sink.name(), abandoned.size());
                }
            } catch (InterruptedException e) {
                lane.executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        for (Lane lane : lanes) {
            try {
                lane.sink.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close sink {}", lane.sink.name(), e);
            }
        }
        logger.info("Export multiplexer closed");
    }

    private static Duration shutdownWindow(Lane lane) {
        return lane.sink.timeout().multipliedBy(2).plus(GRACE);
    }

    private static final class Lane {
        private final Sink sink;
        private final ThreadPoolExecutor executor;

        private Lane(Sink sink, int capacity) {
            this.sink = sink;
            this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(capacity),
                    r -> {
                        Thread t = new Thread(r, "sink-lane-" + sink.name());
                        t.setDaemon(true);
                        return t;
                    });
        }

        private CompletableFuture<SinkOutcome> submit(LogRecord record) {
            try {
                return CompletableFuture.supplyAsync(() -> safeDeliver(record), executor);
            } catch (RejectedExecutionException e) {
                String reason = executor.isShutdown() ? "multiplexer closed" : "dispatch queue full";
                return CompletableFuture.completedFuture(SinkOutcome.failed(reason));
            }
        }

        private SinkOutcome safeDeliver(LogRecord record) {
            try {
                return sink.deliver(record);
            } catch (RuntimeException e) {
                logger.warn("Sink {} threw while delivering", sink.name(), e);
                return SinkOutcome.failed(Sink.AbstractSink.describe(e));
            }
        }

        private CompletableFuture<Void> flush() {
            try {
                return CompletableFuture.runAsync(sink::flush, executor);
            } catch (RejectedExecutionException e) {
                return CompletableFuture.completedFuture(null);
            }
        }
    }
}
