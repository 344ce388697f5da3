package fr.lapetina.modeltraffic.rollout;

/**
 * State of a blue-green deployment.
 */
public enum BlueGreenState {
    /** Green created at weight 0, waiting for a passing smoke test */
    PENDING,
    /** Green serves all traffic, blue kept at weight 0 for the rollback window */
    MONITORING,
    SUCCEEDED,
    ROLLED_BACK,
    ABORTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == ROLLED_BACK || this == ABORTED;
    }
}
