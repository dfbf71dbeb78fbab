package io.cleaninterfaces.observability.sink;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Micrometer counters for one sink: {@code observability.sink.records} tagged with the sink
 * name and the outcome status.
 */
public final class SinkMetrics {

    public static final String RECORDS_METER = "observability.sink.records";

    private final Map<SinkOutcome.Status, Counter> counters = new EnumMap<>(SinkOutcome.Status.class);

    public SinkMetrics(String sinkName, MeterRegistry registry) {
        for (SinkOutcome.Status status : SinkOutcome.Status.values()) {
            counters.put(status, Counter.builder(RECORDS_METER)
                    .description("Records handled by a sink, by outcome")
                    .tag("sink", sinkName)
                    .tag("outcome", status.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
    }

    public void record(SinkOutcome outcome) {
        counters.get(outcome.status()).increment();
    }

    public double count(SinkOutcome.Status status) {
        return counters.get(status).count();
    }
}
