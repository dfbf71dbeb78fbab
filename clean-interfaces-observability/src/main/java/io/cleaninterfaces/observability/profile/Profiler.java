package io.cleaninterfaces.observability.profile;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LoggerHandle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Times units of work and emits one {@code performance} record per invocation through a
 * {@link LoggerHandle}. The wrapped work's result or exception is passed through unchanged.
 *
 * <pre>{@code
 * Profiler profiler = pipeline.profiler(log);
 * List<Row> rows = profiler.call("load_rows", () -> repository.load());
 * }</pre>
 */
public final class Profiler {

    public static final String MESSAGE = "performance";
    public static final String EVENT = "event";
    public static final String OPERATION = "operation";
    public static final String DURATION_MS = "duration_ms";
    public static final String OUTCOME = "outcome";
    public static final String ERROR = "error";
    public static final String HEAP_USED_MB = "heap_used_mb";
    public static final String HEAP_DELTA_MB = "heap_delta_mb";

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final LoggerHandle handle;
    private final boolean enabled;
    private final boolean collectMemory;

    public Profiler(LoggerHandle handle, boolean enabled, boolean collectMemory) {
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.enabled = enabled;
        this.collectMemory = collectMemory;
    }

    public <T> T call(String operation, Callable<T> work) throws Exception {
        if (!enabled) {
            return work.call();
        }
        long heapBefore = collectMemory ? usedHeap() : 0L;
        long start = System.nanoTime();
        Throwable failure = null;
        try {
            return work.call();
        } catch (Exception | Error e) {
            failure = e;
            throw e;
        } finally {
            report(operation, System.nanoTime() - start, failure, heapBefore);
        }
    }

    public <T> T get(String operation, Supplier<T> work) {
        if (!enabled) {
            return work.get();
        }
        long heapBefore = collectMemory ? usedHeap() : 0L;
        long start = System.nanoTime();
        Throwable failure = null;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } finally {
            report(operation, System.nanoTime() - start, failure, heapBefore);
        }
    }

    public void run(String operation, Runnable work) {
        get(operation, () -> {
            work.run();
            return null;
        });
    }

    public <T> Callable<T> wrap(String operation, Callable<T> work) {
        return () -> call(operation, work);
    }

    private void report(String operation, long elapsedNanos, Throwable failure, long heapBefore) {
        Level level = failure == null ? Level.INFO : Level.ERROR;
        if (!handle.isEnabled(level)) {
            return;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(EVENT, MESSAGE);
        fields.put(OPERATION, operation);
        fields.put(DURATION_MS, toMillis(elapsedNanos));
        fields.put(OUTCOME, failure == null ? "success" : "failure");
        if (failure != null) {
            fields.put(ERROR, failure.getClass().getSimpleName() + ": " + failure.getMessage());
        }
        if (collectMemory) {
            long heapAfter = usedHeap();
            fields.put(HEAP_USED_MB, toMb(heapAfter));
            fields.put(HEAP_DELTA_MB, toMb(heapAfter - heapBefore));
        }
        handle.emit(level, MESSAGE, fields);
    }

    static double toMillis(long nanos) {
        return BigDecimal.valueOf(nanos)
                .divide(BigDecimal.valueOf(1_000_000L), 3, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static double toMb(long bytes) {
        return BigDecimal.valueOf(bytes / BYTES_PER_MB).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }

    private static long usedHeap() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }
}
