package fr.lapetina.modeltraffic.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;

/**
 * Rolling aggregate of request samples for one endpoint (or a group of endpoints)
 * over a time window.
 *
 * @param endpointId         endpoint id, or comma-joined ids for a group aggregate
 * @param windowStart        inclusive lower bound of the window
 * @param windowEnd          upper bound of the window
 * @param sampleCount        number of samples in the window
 * @param avgLatencyMs       mean latency, 0 when empty
 * @param p50LatencyMs       median latency (nearest rank), 0 when empty
 * @param p95LatencyMs       95th percentile latency (nearest rank), 0 when empty
 * @param errorRate          failed samples / sample count, 0 when empty
 * @param throughputPerSecond samples per second of window
 * @param totalTokens        sum of token counts
 * @param derivedCost        sum of tokens multiplied by the serving endpoint's cost per token
 */
public record AggregateWindow(
        String endpointId,
        Instant windowStart,
        Instant windowEnd,
        int sampleCount,
        double avgLatencyMs,
        double p50LatencyMs,
        double p95LatencyMs,
        double errorRate,
        double throughputPerSecond,
        long totalTokens,
        double derivedCost
) {

    public static AggregateWindow empty(String endpointId, Instant windowStart, Instant windowEnd) {
        return new AggregateWindow(endpointId, windowStart, windowEnd, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sampleCount == 0;
    }

    public Duration windowLength() {
        return Duration.between(windowStart, windowEnd);
    }

    /**
     * Cost per request in the window, 0 when empty.
     */
    public double costPerRequest() {
        return sampleCount == 0 ? 0 : derivedCost / sampleCount;
    }
}
