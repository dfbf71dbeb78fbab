package io.cleaninterfaces.observability.sink;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-sink outcomes of one dispatch, keyed by sink name in registration order.
 */
public final class DispatchResult {

    private final Map<String, SinkOutcome> outcomes;

    public DispatchResult(Map<String, SinkOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public Map<String, SinkOutcome> outcomes() {
        return outcomes;
    }

    public SinkOutcome outcome(String sinkName) {
        return outcomes.get(sinkName);
    }

    /**
     * @return {@code true} when at least one sink did not fail
     */
    public boolean isHandled() {
        return outcomes.values().stream().anyMatch(o -> !o.isFailure());
    }

    public Map<String, SinkOutcome> failures() {
        return outcomes.entrySet().stream()
                .filter(e -> e.getValue().isFailure())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }

    @Override
    public String toString() {
        return "DispatchResult" + outcomes;
    }
}
