package fr.lapetina.modeltraffic.domain.exception;

/**
 * Thrown when a rollout evaluation was deferred for lack of samples more times than allowed.
 *
 * The rollout has already been aborted and rolled back when this is raised.
 */
public final class EvaluationInconclusiveException extends ControllerException {

    private final String planId;
    private final int deferrals;

    public EvaluationInconclusiveException(String planId, int deferrals, String details) {
        super("Evaluation inconclusive for plan " + planId + " after " + deferrals + " deferrals: " + details);
        this.planId = planId;
        this.deferrals = deferrals;
    }

    public String getPlanId() {
        return planId;
    }

    public int getDeferrals() {
        return deferrals;
    }
}
