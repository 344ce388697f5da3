package fr.lapetina.modeltraffic.infrastructure.health;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.spi.SmokeTestResult;
import fr.lapetina.modeltraffic.support.TestEndpoints;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HttpEndpointProbeTest {

    private final AtomicInteger status = new AtomicInteger(200);
    private HttpServer server;
    private ModelEndpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> {
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        endpoint = ModelEndpoint.builder()
                .id("local")
                .model(TestEndpoints.MODEL)
                .version("v1")
                .address("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("should report healthy on a 2xx answer and unhealthy otherwise")
    void shouldMapStatusToHealth() {
        HttpEndpointProbe probe = new HttpEndpointProbe("/health", "/health", Duration.ofSeconds(2));

        assertThat(probe.check(endpoint).join()).isTrue();

        status.set(503);
        assertThat(probe.check(endpoint).join()).isFalse();
    }

    @Test
    @DisplayName("should report an unreachable endpoint as unhealthy instead of failing")
    void shouldTreatConnectionErrorsAsUnhealthy() {
        HttpEndpointProbe probe = new HttpEndpointProbe("/health", "/health", Duration.ofSeconds(2));
        server.stop(0);

        assertThat(probe.check(endpoint).join()).isFalse();
    }

    @Test
    @DisplayName("should run smoke tests with a status report")
    void shouldRunSmokeTests() {
        HttpEndpointProbe probe = new HttpEndpointProbe("/health", "health", Duration.ofSeconds(2));

        SmokeTestResult passed = probe.run(endpoint);
        status.set(500);
        SmokeTestResult failed = probe.run(endpoint);

        assertThat(passed.passed()).isTrue();
        assertThat(failed.passed()).isFalse();
        assertThat(failed.report()).contains("/health").contains("500");
    }

    @Test
    @DisplayName("should join the address and path with a single slash")
    void shouldResolvePaths() {
        assertThat(HttpEndpointProbe.resolve(endpoint, "health").getPath()).isEqualTo("/health");
        assertThat(HttpEndpointProbe.resolve(endpoint, "/health").getPath()).isEqualTo("/health");
    }
}
