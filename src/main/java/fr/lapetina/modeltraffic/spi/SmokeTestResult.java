package fr.lapetina.modeltraffic.spi;

/**
 * Outcome of a smoke test run.
 */
public record SmokeTestResult(boolean passed, String report) {

    public static SmokeTestResult passed(String report) {
        return new SmokeTestResult(true, report);
    }

    public static SmokeTestResult failed(String report) {
        return new SmokeTestResult(false, report);
    }
}
