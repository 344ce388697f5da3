package fr.lapetina.modeltraffic.rollout;

/**
 * State of a canary rollout plan.
 *
 * PENDING → RAMPING → EVALUATING → (RAMPING | SUCCEEDED | ROLLED_BACK); ABORTED from any
 * non-terminal state.
 */
public enum RolloutState {
    PENDING,
    RAMPING,
    EVALUATING,
    SUCCEEDED,
    ROLLED_BACK,
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ROLLED_BACK || this == ABORTED;
    }
}
