package fr.lapetina.modeltraffic.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.modeltraffic.ControllerFactory;
import fr.lapetina.modeltraffic.api.dto.BlueGreenRequest;
import fr.lapetina.modeltraffic.api.dto.CanaryRequest;
import fr.lapetina.modeltraffic.api.dto.OutcomeReport;
import fr.lapetina.modeltraffic.api.dto.RouteRequest;
import fr.lapetina.modeltraffic.api.dto.RouteResponse;
import fr.lapetina.modeltraffic.domain.exception.BackendOperationException;
import fr.lapetina.modeltraffic.domain.exception.EvaluationInconclusiveException;
import fr.lapetina.modeltraffic.domain.exception.NoHealthyEndpointException;
import fr.lapetina.modeltraffic.domain.exception.SmokeTestFailureException;
import fr.lapetina.modeltraffic.domain.exception.ValidationException;
import fr.lapetina.modeltraffic.domain.model.EndpointHealth;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.model.RequestContext;
import fr.lapetina.modeltraffic.domain.strategy.RoutingStrategy;
import fr.lapetina.modeltraffic.infrastructure.config.ControllerConfig;
import fr.lapetina.modeltraffic.infrastructure.registry.RegistrySnapshot;
import fr.lapetina.modeltraffic.optimizer.PerformanceBaseline;
import fr.lapetina.modeltraffic.rollout.BlueGreenController;
import fr.lapetina.modeltraffic.rollout.BlueGreenDeployment;
import fr.lapetina.modeltraffic.rollout.CanaryController;
import fr.lapetina.modeltraffic.rollout.RolloutPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admin and routing HTTP API on the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET  /health - Controller health and per-model endpoint health
 * - GET  /metrics - Prometheus metrics endpoint
 * - POST /v1/route - Select an endpoint for a request
 * - POST /v1/outcomes - Report the outcome of a routed request
 * - GET  /models - List models
 * - GET  /models/{model} - Registry snapshot and traffic statistics
 * - GET|POST /models/{model}/baseline - Read or capture the performance baseline
 * - GET|POST /models/{model}/recommendations - Latest recommendations, or analyze now
 * - GET|POST /rollouts/canary - List active plans, or start one
 * - GET  /rollouts/canary/{id} - Plan status with evaluation history
 * - POST /rollouts/canary/{id}/evaluate - Evaluate the current step now
 * - POST /rollouts/canary/{id}/cancel - Abort the plan
 * - GET|POST /rollouts/blue-green - List active deployments, or start one
 * - GET  /rollouts/blue-green/{id} - Deployment status
 * - POST /rollouts/blue-green/{id}/swap|rollback|cancel - Drive the deployment
 * - GET|POST /admin/strategy - Read or change the routing strategy
 * - POST /admin/reload - Reload configuration
 */
public final class AdminHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ControllerFactory factory;

    public AdminHttpServer(ControllerConfig.ServerConfig serverConfig, ControllerFactory factory) throws IOException {
        this.factory = factory;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()), serverConfig.getBacklog()
        );

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(serverConfig.getThreads(), r -> {
            Thread t = new Thread(r, "admin-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/v1/route", new RouteHandler());
        server.createContext("/v1/outcomes", new OutcomeHandler());
        server.createContext("/models", new JsonHandler(this::handleModels));
        server.createContext("/rollouts/canary", new JsonHandler(this::handleCanary));
        server.createContext("/rollouts/blue-green", new JsonHandler(this::handleBlueGreen));
        server.createContext("/admin", new JsonHandler(this::handleAdmin));

        log.info("HTTP server configured on {}:{}", serverConfig.getHost(), serverConfig.getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== ROUTING ====================

    private class RouteHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                RouteRequest routeRequest = readBody(exchange, RouteRequest.class);
                if (routeRequest.getModel() == null || routeRequest.getModel().isBlank()) {
                    sendError(exchange, 400, "Missing 'model' field");
                    return;
                }
                if (routeRequest.getRequestId() == null) {
                    routeRequest.setRequestId(UUID.randomUUID().toString());
                }
                String correlationId = exchange.getRequestHeaders().getFirst("X-Correlation-ID");
                if (correlationId != null && routeRequest.getCorrelationId() == null) {
                    routeRequest.setCorrelationId(correlationId);
                }
                MDC.put("requestId", routeRequest.getRequestId());
                MDC.put("model", routeRequest.getModel());

                RequestContext context = routeRequest.toRequestContext();
                try {
                    ModelEndpoint endpoint = factory.getRouter().route(context);
                    String strategy = factory.getRouter().getStrategy().getName();
                    factory.getMetricsRegistry().incrementRoutingDecision(
                            context.model(), endpoint.version(), endpoint.id(), strategy);
                    sendJson(exchange, 200, RouteResponse.of(context, endpoint, strategy));
                } catch (NoHealthyEndpointException e) {
                    factory.getMetricsRegistry().incrementRoutingFailure(context.model(), e.getReason().name());
                    log.warn("No healthy endpoint: requestId={}, model={}, reason={}",
                            context.requestId(), context.model(), e.getReason());
                    sendError(exchange, e.getReason() == NoHealthyEndpointException.Reason.UNKNOWN_MODEL ? 404 : 503,
                            e.getMessage());
                }
            } catch (JsonProcessingException | IllegalArgumentException e) {
                sendError(exchange, 400, "Invalid request: " + e.getMessage());
            } catch (Exception e) {
                log.error("Error handling route request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    private class OutcomeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }
                OutcomeReport report = readBody(exchange, OutcomeReport.class);
                if (report.getEndpointId() == null) {
                    sendError(exchange, 400, "Missing 'endpoint_id' field");
                    return;
                }
                Optional<ModelEndpoint> endpoint = factory.getRegistry().findEndpoint(report.getEndpointId());
                if (endpoint.isEmpty()) {
                    sendError(exchange, 404, "Endpoint not found: " + report.getEndpointId());
                    return;
                }
                factory.getCollector().record(report.getEndpointId(), report.getLatencyMs(),
                        report.isSuccess(), report.getTokens());
                sendJson(exchange, 202, Map.of("accepted", true));
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Invalid request: " + e.getMessage());
            } catch (Exception e) {
                log.error("Error handling outcome report", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            }
        }
    }

    // ==================== HEALTH & METRICS ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            List<ModelEndpoint> endpoints = factory.getRegistry().allEndpoints();
            health.put("status", determineOverallHealth(endpoints));
            health.put("timestamp", factory.getClock().millis());

            List<Map<String, Object>> endpointInfo = new ArrayList<>();
            for (ModelEndpoint endpoint : endpoints) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", endpoint.id());
                info.put("model", endpoint.model());
                info.put("version", endpoint.version());
                info.put("health", endpoint.health().name());
                info.put("state", endpoint.state().name());
                info.put("weight", endpoint.weight());
                info.put("inFlight", factory.getCollector().getInFlight(endpoint.id()));
                info.put("maxConcurrent", endpoint.maxConcurrentRequests());
                endpointInfo.add(info);
            }
            health.put("endpoints", endpointInfo);
            health.put("strategy", factory.getRouter().getStrategy().getName());
            health.put("activeCanaries", factory.getCanaryController().activePlans().size());
            health.put("activeBlueGreen", factory.getBlueGreenController().activeDeployments().size());

            int statusCode = "DOWN".equals(health.get("status")) ? 503 : 200;
            sendJson(exchange, statusCode, health);
        }

        private String determineOverallHealth(List<ModelEndpoint> endpoints) {
            List<ModelEndpoint> serving = endpoints.stream().filter(ModelEndpoint::isServing).toList();
            if (serving.isEmpty()) {
                return "DOWN";
            }
            long up = serving.stream().filter(e -> e.health() == EndpointHealth.UP).count();
            if (up == 0) {
                return "DOWN";
            } else if (up < serving.size()) {
                return "DEGRADED";
            }
            return "UP";
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            // Refresh point-in-time gauges
            factory.getMetricsRegistry().setGlobalInFlight(factory.getCollector().getTotalInFlight());
            factory.getMetricsRegistry().setActiveRollouts(factory.getCanaryController().activePlans().size()
                    + factory.getBlueGreenController().activeDeployments().size());
            factory.getPipeline().ifPresent(pipeline ->
                    factory.getMetricsRegistry().setRingBufferRemaining((int) pipeline.getRemainingCapacity()));

            String metrics = factory.getMetricsRegistry().scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== MODELS ====================

    private void handleModels(HttpExchange exchange, String method, List<String> segments) throws IOException {
        // segments: ["models", model?, sub?]
        if (segments.size() == 1 && "GET".equals(method)) {
            sendJson(exchange, 200, factory.getRegistry().models());
            return;
        }
        if (segments.size() < 2) {
            sendError(exchange, 404, "Not Found");
            return;
        }
        String model = segments.get(1);
        RegistrySnapshot snapshot = factory.getRegistry().getSnapshot(model);
        if (snapshot.endpoints().isEmpty()) {
            sendError(exchange, 404, "Unknown model: " + model);
            return;
        }

        if (segments.size() == 2 && "GET".equals(method)) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("snapshot", snapshot);
            body.put("traffic", factory.getRouter().trafficStatistics(model));
            body.put("rollouts", factory.getCanaryController().plansFor(model).stream()
                    .map(RolloutPlan::id).toList());
            sendJson(exchange, 200, body);
        } else if (segments.size() == 3 && "baseline".equals(segments.get(2))) {
            if ("POST".equals(method)) {
                sendJson(exchange, 201, factory.getOptimizer().establishBaseline(model));
            } else if ("GET".equals(method)) {
                Optional<PerformanceBaseline> baseline = factory.getOptimizer().getBaseline(model);
                if (baseline.isPresent()) {
                    sendJson(exchange, 200, baseline.get());
                } else {
                    sendError(exchange, 404, "No baseline for model: " + model);
                }
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
        } else if (segments.size() == 3 && "recommendations".equals(segments.get(2))) {
            if ("POST".equals(method)) {
                sendJson(exchange, 200, factory.getOptimizer().analyzeDegradation(model));
            } else if ("GET".equals(method)) {
                sendJson(exchange, 200, factory.getOptimizer().latestRecommendations(model));
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
        } else {
            sendError(exchange, 404, "Not Found");
        }
    }

    // ==================== CANARY ====================

    private void handleCanary(HttpExchange exchange, String method, List<String> segments) throws IOException {
        // segments: ["rollouts", "canary", id?, action?]
        CanaryController canary = factory.getCanaryController();
        if (segments.size() == 2) {
            if ("POST".equals(method)) {
                CanaryRequest request = readBody(exchange, CanaryRequest.class);
                RolloutPlan plan = canary.start(request.toRolloutConfig(factory.getConfig().getRollout()));
                sendJson(exchange, 201, plan);
            } else if ("GET".equals(method)) {
                sendJson(exchange, 200, canary.activePlans());
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
            return;
        }

        String planId = segments.get(2);
        Optional<RolloutPlan> plan = canary.getPlan(planId);
        if (plan.isEmpty()) {
            sendError(exchange, 404, "Rollout plan not found: " + planId);
            return;
        }
        if (segments.size() == 3 && "GET".equals(method)) {
            sendJson(exchange, 200, plan.get());
        } else if (segments.size() == 4 && "POST".equals(method) && "evaluate".equals(segments.get(3))) {
            sendJson(exchange, 200, canary.evaluate(planId));
        } else if (segments.size() == 4 && "POST".equals(method) && "cancel".equals(segments.get(3))) {
            boolean cancelled = canary.cancel(planId);
            sendJson(exchange, 200, Map.of("cancelled", cancelled, "plan", canary.getPlan(planId).orElseThrow()));
        } else {
            sendError(exchange, 404, "Not Found");
        }
    }

    // ==================== BLUE-GREEN ====================

    private void handleBlueGreen(HttpExchange exchange, String method, List<String> segments) throws IOException {
        // segments: ["rollouts", "blue-green", id?, action?]
        BlueGreenController blueGreen = factory.getBlueGreenController();
        if (segments.size() == 2) {
            if ("POST".equals(method)) {
                BlueGreenRequest request = readBody(exchange, BlueGreenRequest.class);
                BlueGreenDeployment deployment =
                        blueGreen.start(request.toBlueGreenConfig(factory.getConfig().getBlueGreen()));
                sendJson(exchange, 201, deployment);
            } else if ("GET".equals(method)) {
                sendJson(exchange, 200, blueGreen.activeDeployments());
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
            return;
        }

        String deploymentId = segments.get(2);
        if (blueGreen.getDeployment(deploymentId).isEmpty()) {
            sendError(exchange, 404, "Blue-green deployment not found: " + deploymentId);
            return;
        }
        if (segments.size() == 3 && "GET".equals(method)) {
            sendJson(exchange, 200, blueGreen.getDeployment(deploymentId).get());
            return;
        }
        if (segments.size() != 4 || !"POST".equals(method)) {
            sendError(exchange, 404, "Not Found");
            return;
        }
        switch (segments.get(3)) {
            case "swap" -> sendJson(exchange, 200, blueGreen.swap(deploymentId));
            case "rollback" -> sendJson(exchange, 200, blueGreen.rollback(deploymentId));
            case "cancel" -> {
                boolean cancelled = blueGreen.cancel(deploymentId);
                sendJson(exchange, 200, Map.of("cancelled", cancelled,
                        "deployment", blueGreen.getDeployment(deploymentId).orElseThrow()));
            }
            default -> sendError(exchange, 404, "Not Found");
        }
    }

    // ==================== ADMIN ====================

    private void handleAdmin(HttpExchange exchange, String method, List<String> segments) throws IOException {
        String path = String.join("/", segments);
        if ("admin/strategy".equals(path) && "GET".equals(method)) {
            sendJson(exchange, 200, Map.of(
                    "current", factory.getRouter().getStrategy().getName(),
                    "available", Arrays.stream(RoutingStrategy.values()).map(RoutingStrategy::getName).toList()
            ));
        } else if ("admin/strategy".equals(path) && "POST".equals(method)) {
            Map<?, ?> request = readBody(exchange, Map.class);
            Object name = request.get("strategy");
            Optional<RoutingStrategy> strategy = RoutingStrategy.fromName(name != null ? name.toString() : null);
            if (strategy.isEmpty()) {
                sendError(exchange, 400, "Unknown strategy: " + name);
                return;
            }
            factory.getRouter().setStrategy(strategy.get());
            sendJson(exchange, 200, Map.of(
                    "strategy", strategy.get().getName(),
                    "message", "Strategy changed successfully"
            ));
        } else if ("admin/reload".equals(path) && "POST".equals(method)) {
            ControllerConfig config = factory.getConfigLoader().reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "strategy", config.getRouting().getStrategy()
            ));
        } else {
            sendError(exchange, 404, "Not Found");
        }
    }

    // ==================== HELPER METHODS ====================

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange, String method, List<String> segments) throws IOException;
    }

    /**
     * Splits the path into segments and maps controller exceptions to HTTP statuses.
     */
    private class JsonHandler implements HttpHandler {
        private final Route route;

        JsonHandler(Route route) {
            this.route = route;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod().toUpperCase();
            List<String> segments = Arrays.stream(exchange.getRequestURI().getPath().split("/"))
                    .filter(s -> !s.isEmpty())
                    .toList();
            try {
                route.handle(exchange, method, segments);
            } catch (JsonProcessingException e) {
                sendError(exchange, 400, "Invalid request: " + e.getOriginalMessage());
            } catch (ValidationException | IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (SmokeTestFailureException | EvaluationInconclusiveException e) {
                sendError(exchange, 409, e.getMessage());
            } catch (BackendOperationException e) {
                sendError(exchange, 502, e.getMessage());
            } catch (NoHealthyEndpointException e) {
                sendError(exchange, 503, e.getMessage());
            } catch (Exception e) {
                log.error("Error handling {} {}", method, exchange.getRequestURI(), e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            }
        }
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return objectMapper.readValue(is, type);
        }
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown error");
        sendJson(exchange, statusCode, error);
    }
}
