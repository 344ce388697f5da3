package fr.lapetina.modeltraffic.optimizer;

import java.time.Duration;

/**
 * Tunables of the performance optimizer.
 *
 * @param baselineWindow        history captured by a baseline
 * @param analysisWindow        recent window compared against the baseline
 * @param minSampleCount        samples an endpoint needs in a window to be considered
 * @param latencyTolerance      allowed relative p95 latency increase over the baseline
 * @param errorRateTolerance    allowed relative error-rate increase over the baseline
 * @param absoluteLatencyMs     allowed p95 latency when the baseline latency is zero
 * @param absoluteErrorRate     allowed error rate when the baseline error rate is zero
 * @param latencySlaMs          p95 latency a cheaper endpoint must meet to be recommended
 * @param highLoadThreshold     load from which a latency breach is blamed on capacity
 * @param cacheHitRatio         expected cache hit ratio used to estimate caching gains
 */
public record OptimizerSettings(
        Duration baselineWindow,
        Duration analysisWindow,
        int minSampleCount,
        double latencyTolerance,
        double errorRateTolerance,
        double absoluteLatencyMs,
        double absoluteErrorRate,
        double latencySlaMs,
        double highLoadThreshold,
        double cacheHitRatio
) {
    public static final OptimizerSettings DEFAULT = new OptimizerSettings(
            Duration.ofHours(1), Duration.ofMinutes(15), 30, 0.20, 0.50, 50.0, 0.01, 2000.0, 0.75, 0.30);

    public OptimizerSettings {
        if (baselineWindow == null || baselineWindow.isZero() || baselineWindow.isNegative()) {
            throw new IllegalArgumentException("Baseline window must be positive");
        }
        if (analysisWindow == null || analysisWindow.isZero() || analysisWindow.isNegative()) {
            throw new IllegalArgumentException("Analysis window must be positive");
        }
        if (minSampleCount < 1) {
            throw new IllegalArgumentException("Minimum sample count must be at least 1");
        }
    }
}
