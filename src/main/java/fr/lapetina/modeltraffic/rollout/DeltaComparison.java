package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.model.AggregateWindow;

import java.util.List;

/**
 * Compares a candidate metric against a reference value.
 *
 * The delta is relative, {@code (candidate - reference) / reference}, and must not exceed the
 * allowed increase. A zero reference has no meaningful relative delta, so the candidate value
 * itself is checked against an absolute threshold instead.
 *
 * Shared by the canary controller and the performance optimizer.
 */
public final class DeltaComparison {

    public static final String ERROR_RATE = "error_rate";
    public static final String P95_LATENCY = "p95_latency_ms";

    private DeltaComparison() {
    }

    public static CriterionResult compare(
            String metric,
            double reference,
            double candidate,
            double maxRelativeIncrease,
            double absoluteThreshold
    ) {
        if (reference <= 0) {
            return new CriterionResult(metric, reference, candidate, candidate, absoluteThreshold, false,
                    candidate <= absoluteThreshold);
        }
        double delta = (candidate - reference) / reference;
        return new CriterionResult(metric, reference, candidate, delta, maxRelativeIncrease, true,
                delta <= maxRelativeIncrease);
    }

    /**
     * Checks error rate and p95 latency of the canary against the baseline.
     */
    public static List<CriterionResult> evaluate(
            SuccessCriteria criteria,
            AggregateWindow baseline,
            AggregateWindow canary
    ) {
        return List.of(
                compare(ERROR_RATE, baseline.errorRate(), canary.errorRate(),
                        criteria.maxErrorRateIncrease(), criteria.effectiveAbsoluteErrorRate()),
                compare(P95_LATENCY, baseline.p95LatencyMs(), canary.p95LatencyMs(),
                        criteria.maxLatencyIncrease(), criteria.effectiveAbsoluteLatencyMs())
        );
    }

    public static boolean allPassed(List<CriterionResult> results) {
        return results.stream().allMatch(CriterionResult::passed);
    }

    /**
     * Outcome of one comparison.
     *
     * @param delta     relative delta, or the candidate value when {@code relative} is false
     * @param threshold allowed relative increase, or the absolute threshold
     */
    public record CriterionResult(
            String metric,
            double reference,
            double candidate,
            double delta,
            double threshold,
            boolean relative,
            boolean passed
    ) {
        @Override
        public String toString() {
            return metric + (passed ? " ok" : " breached") + " (reference=" + reference
                    + ", candidate=" + candidate + ", " + (relative ? "delta=" : "absolute=") + delta
                    + ", threshold=" + threshold + ")";
        }
    }
}
