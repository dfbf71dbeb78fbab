package io.cleaninterfaces.observability.testutil;

import io.cleaninterfaces.observability.Level;
import io.cleaninterfaces.observability.LogRecord;
import io.cleaninterfaces.observability.sink.Sink;
import io.cleaninterfaces.observability.sink.SinkOutcome;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Spy sink that remembers every record it is asked to deliver.
 */
public class RecordingSink implements Sink {

    private final String name;
    private final Level minimumLevel;
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final AtomicInteger deliverCalls = new AtomicInteger();
    private final AtomicInteger flushCalls = new AtomicInteger();
    private final AtomicInteger closeCalls = new AtomicInteger();
    private volatile Function<LogRecord, SinkOutcome> behaviour = r -> SinkOutcome.delivered();

    public RecordingSink(String name) {
        this(name, Level.DEBUG);
    }

    public RecordingSink(String name, Level minimumLevel) {
        this.name = name;
        this.minimumLevel = minimumLevel;
    }

    public RecordingSink behave(Function<LogRecord, SinkOutcome> behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Level minimumLevel() {
        return minimumLevel;
    }

    @Override
    public SinkOutcome deliver(LogRecord record) {
        deliverCalls.incrementAndGet();
        records.add(record);
        return behaviour.apply(record);
    }

    @Override
    public void flush() {
        flushCalls.incrementAndGet();
    }

    @Override
    public Duration timeout() {
        return Duration.ofMillis(500);
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
    }

    public List<LogRecord> records() {
        return records;
    }

    public List<String> messages() {
        return records.stream().map(LogRecord::message).toList();
    }

    public int deliverCalls() {
        return deliverCalls.get();
    }

    public int flushCalls() {
        return flushCalls.get();
    }

    public int closeCalls() {
        return closeCalls.get();
    }
}
