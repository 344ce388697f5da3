package fr.lapetina.modeltraffic.optimizer;

import fr.lapetina.modeltraffic.domain.model.AggregateWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reference aggregates of a model's endpoints, captured over a historical window.
 */
public record PerformanceBaseline(
        String model,
        Instant capturedAt,
        Duration window,
        Map<String, AggregateWindow> endpoints
) {
    public PerformanceBaseline {
        endpoints = endpoints != null ? new TreeMap<>(endpoints) : Map.of();
    }
}
