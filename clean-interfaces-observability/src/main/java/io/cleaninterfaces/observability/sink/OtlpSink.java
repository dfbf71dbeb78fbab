package io.cleaninterfaces.observability.sink;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.otlp.ExportException;
import io.cleaninterfaces.observability.otlp.LogRecordExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers records and exports them in batches through a {@link LogRecordExporter}.
 *
 * <p>An export is triggered when the buffer holds {@code batchSize} records, on
 * {@link #flush()}, on close and every {@code flushInterval}. At most one export runs at a
 * time. A batch that fails is retried on the next trigger ahead of newer records and dropped
 * once it has failed {@code maxRetries + 1} times.</p>
 */
public final class OtlpSink extends Sink.AbstractSink {

    public static final String NAME = "otlp";
    public static final String DROPPED_BATCHES_METER = "observability.otlp.batches.dropped";
    public static final String REJECTED_RECORDS_METER = "observability.otlp.records.rejected";

    private static final Logger logger = LoggerFactory.getLogger(OtlpSink.class);

    private final LogRecordExporter exporter;
    private final int batchSize;
    private final int maxQueueSize;
    private final int maxRetries;
    private final Duration flushInterval;

    private final Deque<LogRecord> buffer = new ArrayDeque<>();
    private final ReentrantLock exportLock = new ReentrantLock();
    // guarded by exportLock
    private PendingBatch retryBatch;
    private String lastFailure;

    private final Counter droppedBatches;
    private final Counter rejectedRecords;
    private final ScheduledExecutorService scheduler;

    public OtlpSink(LogRecordExporter exporter,
                    Level minimumLevel,
                    Duration exportTimeout,
                    int batchSize,
                    int maxQueueSize,
                    int maxRetries,
                    Duration flushInterval,
                    MeterRegistry registry) {
        // a deliver may run the retry batch and one fresh batch back to back
        super(NAME, minimumLevel, exportTimeout.multipliedBy(2), registry);
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        this.batchSize = batchSize;
        this.maxQueueSize = maxQueueSize;
        this.maxRetries = maxRetries;
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval must not be null");
        this.droppedBatches = Counter.builder(DROPPED_BATCHES_METER)
                .description("Batches dropped after exhausting the retry budget")
                .tag("sink", NAME)
                .register(registry);
        this.rejectedRecords = Counter.builder(REJECTED_RECORDS_METER)
                .description("Records rejected because the export buffer was full")
                .tag("sink", NAME)
                .register(registry);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "otlp-sink-flush");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = flushInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::periodicFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        logger.debug("OTLP sink started with batchSize={}, maxQueueSize={}, maxRetries={}, flushInterval={}",
                batchSize, maxQueueSize, maxRetries, flushInterval);
    }

    @Override
    protected SinkOutcome doDeliver(LogRecord record) {
        int buffered;
        synchronized (buffer) {
            if (buffer.size() >= maxQueueSize) {
                rejectedRecords.increment();
                return SinkOutcome.failed("buffer full");
            }
            buffer.addLast(record);
            buffered = buffer.size();
        }
        if (buffered < batchSize) {
            return SinkOutcome.queued();
        }
        if (!exportLock.tryLock()) {
            // another thread is exporting, it will pick this record up
            return SinkOutcome.queued();
        }
        try {
            if (retryBatch != null && !attempt(retryBatch)) {
                // the new record is still buffered behind the retry batch
                return SinkOutcome.queued();
            }
            PendingBatch batch = takeBatch();
            if (batch == null) {
                return SinkOutcome.queued();
            }
            if (!attempt(batch)) {
                return SinkOutcome.failed(lastFailure);
            }
            return batch.contains(record) ? SinkOutcome.delivered() : SinkOutcome.queued();
        } finally {
            exportLock.unlock();
        }
    }

    @Override
    public void flush() {
        if (isClosed()) {
            return;
        }
        exportLock.lock();
        try {
            drain();
        } finally {
            exportLock.unlock();
        }
    }

    private void periodicFlush() {
        if (!exportLock.tryLock()) {
            return;
        }
        try {
            drain();
        } finally {
            exportLock.unlock();
        }
    }

    /**
     * Export the retry batch and then the buffer until it is empty or an attempt fails.
     * Caller must hold the export lock.
     */
    private void drain() {
        if (retryBatch != null && !attempt(retryBatch)) {
            return;
        }
        PendingBatch batch;
        while ((batch = takeBatch()) != null) {
            if (!attempt(batch)) {
                return;
            }
        }
    }

    /**
     * Runs one export attempt, keeping the batch for retry or dropping it on failure.
     * Caller must hold the export lock.
     */
    private boolean attempt(PendingBatch batch) {
        try {
            exporter.export(batch.records);
            retryBatch = null;
            return true;
        } catch (ExportException | RuntimeException e) {
            batch.failedAttempts++;
            lastFailure = describe(e);
            if (batch.failedAttempts > maxRetries) {
                retryBatch = null;
                droppedBatches.increment();
                logger.warn("Dropping batch of {} records after {} failed export attempts: {}",
                        batch.records.size(), batch.failedAttempts, lastFailure);
            } else {
                retryBatch = batch;
                logger.warn("Export of {} records failed (attempt {} of {}), will retry: {}",
                        batch.records.size(), batch.failedAttempts, maxRetries + 1, lastFailure);
            }
            return false;
        }
    }

    private PendingBatch takeBatch() {
        synchronized (buffer) {
            if (buffer.isEmpty()) {
                return null;
            }
            List<LogRecord> records = new ArrayList<>(Math.min(batchSize, buffer.size()));
            while (records.size() < batchSize && !buffer.isEmpty()) {
                records.add(buffer.pollFirst());
            }
            return new PendingBatch(records);
        }
    }

    @Override
    protected void doClose() {
        scheduler.shutdown();
        exportLock.lock();
        try {
            drain();
            int remaining = pendingRecordCount() + (retryBatch == null ? 0 : retryBatch.records.size());
            if (remaining > 0) {
                logger.warn("OTLP sink closed with {} records not exported", remaining);
            }
        } finally {
            exportLock.unlock();
            exporter.close();
        }
        try {
            if (!scheduler.awaitTermination(flushInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public int pendingRecordCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public boolean hasRetryPending() {
        exportLock.lock();
        try {
            return retryBatch != null;
        } finally {
            exportLock.unlock();
        }
    }

    public long droppedBatchCount() {
        return (long) droppedBatches.count();
    }

    public long rejectedRecordCount() {
        return (long) rejectedRecords.count();
    }

    private static final class PendingBatch {
        private final List<LogRecord> records;
        private int failedAttempts;

        private PendingBatch(List<LogRecord> records) {
            this.records = List.copyOf(records);
        }

        private boolean contains(LogRecord record) {
            for (LogRecord r : records) {
                if (r == record) {
                    return true;
                }
            }
            return false;
        }
    }
}
