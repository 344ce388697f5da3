package fr.lapetina.modeltraffic.domain.exception;

/**
 * Thrown when a smoke test blocks a blue-green swap.
 *
 * The deployment stays PENDING and the swap may be retried.
 */
public final class SmokeTestFailureException extends ControllerException {

    private final String deploymentId;
    private final String endpointId;
    private final String report;

    public SmokeTestFailureException(String deploymentId, String endpointId, String report) {
        super("Smoke test failed for endpoint " + endpointId + " (deployment " + deploymentId + "): " + report);
        this.deploymentId = deploymentId;
        this.endpointId = endpointId;
        this.report = report;
    }

    public String getDeploymentId() {
        return deploymentId;
    }

    public String getEndpointId() {
        return endpointId;
    }

    public String getReport() {
        return report;
    }
}
