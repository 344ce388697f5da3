package fr.lapetina.modeltraffic.support;

import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.spi.SmokeTestResult;
import fr.lapetina.modeltraffic.spi.SmokeTestRunner;

import java.util.concurrent.atomic.AtomicInteger;

public final class StubSmokeTestRunner implements SmokeTestRunner {

    private volatile boolean passing = true;
    private final AtomicInteger runs = new AtomicInteger();

    @Override
    public SmokeTestResult run(ModelEndpoint endpoint) {
        runs.incrementAndGet();
        return passing
                ? SmokeTestResult.passed("200 OK from " + endpoint.address())
                : SmokeTestResult.failed("503 Service Unavailable from " + endpoint.address());
    }

    public void setPassing(boolean passing) {
        this.passing = passing;
    }

    public int runs() {
        return runs.get();
    }
}
