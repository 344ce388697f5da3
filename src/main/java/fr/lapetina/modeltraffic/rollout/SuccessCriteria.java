package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.exception.ValidationException;

/**
 * Thresholds a canary must stay within, relative to its baseline.
 *
 * @param maxErrorRateIncrease      maximum relative error-rate increase, e.g. 0.1 for +10%
 * @param maxLatencyIncrease        maximum relative p95 latency increase
 * @param absoluteErrorRateThreshold canary error rate allowed when the baseline error rate is zero;
 *                                  non-positive means {@value #DEFAULT_ABSOLUTE_ERROR_RATE}
 * @param absoluteLatencyThresholdMs canary p95 latency allowed when the baseline latency is zero;
 *                                  non-positive means {@value #DEFAULT_ABSOLUTE_LATENCY_MS}
 */
public record SuccessCriteria(
        double maxErrorRateIncrease,
        double maxLatencyIncrease,
        double absoluteErrorRateThreshold,
        double absoluteLatencyThresholdMs
) {
    public static final double DEFAULT_ABSOLUTE_ERROR_RATE = 0.01;
    public static final double DEFAULT_ABSOLUTE_LATENCY_MS = 50.0;

    public static final SuccessCriteria DEFAULT = new SuccessCriteria(0.10, 0.20, 0, 0);

    public static SuccessCriteria of(double maxErrorRateIncrease, double maxLatencyIncrease) {
        return new SuccessCriteria(maxErrorRateIncrease, maxLatencyIncrease, 0, 0);
    }

    public void validate() {
        if (!(maxErrorRateIncrease >= 0) || !(maxLatencyIncrease >= 0)) {
            throw new ValidationException("Success criteria increases must be non-negative: errorRate="
                    + maxErrorRateIncrease + ", latency=" + maxLatencyIncrease);
        }
    }

    public double effectiveAbsoluteErrorRate() {
        return absoluteErrorRateThreshold > 0 ? absoluteErrorRateThreshold : DEFAULT_ABSOLUTE_ERROR_RATE;
    }

    public double effectiveAbsoluteLatencyMs() {
        return absoluteLatencyThresholdMs > 0 ? absoluteLatencyThresholdMs : DEFAULT_ABSOLUTE_LATENCY_MS;
    }
}
