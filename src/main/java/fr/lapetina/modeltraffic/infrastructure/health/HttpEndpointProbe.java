package fr.lapetina.modeltraffic.infrastructure.health;

import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.spi.HealthProbe;
import fr.lapetina.modeltraffic.spi.SmokeTestResult;
import fr.lapetina.modeltraffic.spi.SmokeTestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP probe for model endpoints.
 *
 * Health checks are asynchronous GETs on the health path; a 2xx answer means healthy.
 * Smoke tests are blocking GETs on the smoke test path and report status and latency.
 */
public final class HttpEndpointProbe implements HealthProbe, SmokeTestRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpEndpointProbe.class);

    private final HttpClient httpClient;
    private final String healthPath;
    private final String smokeTestPath;
    private final Duration timeout;

    public HttpEndpointProbe(String healthPath, String smokeTestPath, Duration timeout) {
        this.healthPath = healthPath;
        this.smokeTestPath = smokeTestPath;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public HttpEndpointProbe() {
        this("/health", "/health", Duration.ofSeconds(5));
    }

    @Override
    public CompletableFuture<Boolean> check(ModelEndpoint endpoint) {
        URI uri = resolve(endpoint, healthPath);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        log.debug("Health check started: endpointId={}, uri={}", endpoint.id(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = isSuccess(response.statusCode());
                    if (healthy) {
                        log.debug("Health check passed: endpointId={}, status={}", endpoint.id(), response.statusCode());
                    } else {
                        log.warn("Health check failed: endpointId={}, status={}", endpoint.id(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: endpointId={}, error={}", endpoint.id(), ex.getMessage());
                    return false;
                });
    }

    @Override
    public SmokeTestResult run(ModelEndpoint endpoint) {
        URI uri = resolve(endpoint, smokeTestPath);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        long start = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
            String report = "GET " + uri + " -> " + response.statusCode() + " in " + elapsedMs + "ms";
            if (isSuccess(response.statusCode())) {
                log.info("Smoke test passed: endpointId={}, {}", endpoint.id(), report);
                return SmokeTestResult.passed(report);
            }
            log.warn("Smoke test failed: endpointId={}, {}", endpoint.id(), report);
            return SmokeTestResult.failed(report);
        } catch (IOException e) {
            log.warn("Smoke test error: endpointId={}, uri={}, error={}", endpoint.id(), uri, e.getMessage());
            return SmokeTestResult.failed("GET " + uri + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SmokeTestResult.failed("GET " + uri + " interrupted");
        }
    }

    static URI resolve(ModelEndpoint endpoint, String path) {
        String base = endpoint.address().toString().replaceAll("/$", "");
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create(base + suffix);
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
