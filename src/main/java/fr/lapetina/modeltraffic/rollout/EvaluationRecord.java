package fr.lapetina.modeltraffic.rollout;

import fr.lapetina.modeltraffic.domain.model.AggregateWindow;

import java.time.Instant;
import java.util.List;

/**
 * One entry of a rollout plan's evaluation history.
 */
public record EvaluationRecord(
        Instant evaluatedAt,
        int stepIndex,
        int canaryTraffic,
        AggregateWindow canary,
        AggregateWindow baseline,
        List<DeltaComparison.CriterionResult> criteria,
        Decision decision,
        String detail
) {
    public EvaluationRecord {
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public enum Decision {
        ADVANCE,
        PROMOTE,
        ROLLBACK,
        DEFER,
        ABORT
    }
}
