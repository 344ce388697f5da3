package fr.lapetina.modeltraffic.infrastructure.config;

import fr.lapetina.modeltraffic.domain.model.EndpointState;
import fr.lapetina.modeltraffic.domain.model.ModelEndpoint;
import fr.lapetina.modeltraffic.domain.strategy.BalancedWeights;
import fr.lapetina.modeltraffic.domain.strategy.RoutingParameters;
import fr.lapetina.modeltraffic.optimizer.OptimizerSettings;
import fr.lapetina.modeltraffic.rollout.SuccessCriteria;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the traffic controller.
 * Designed to be populated from YAML.
 */
public class ControllerConfig {

    private ServerConfig server = new ServerConfig();
    private RoutingConfig routing = new RoutingConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private PipelineConfig pipeline = new PipelineConfig();
    private RolloutConfig rollout = new RolloutConfig();
    private BlueGreenConfig blueGreen = new BlueGreenConfig();
    private OptimizerConfig optimizer = new OptimizerConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private StoreConfig store = new StoreConfig();
    private List<ModelConfig> models = new ArrayList<>();
    private List<DeploymentConfig> deployments = new ArrayList<>();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public PipelineConfig getPipeline() { return pipeline; }
    public void setPipeline(PipelineConfig pipeline) { this.pipeline = pipeline; }

    public RolloutConfig getRollout() { return rollout; }
    public void setRollout(RolloutConfig rollout) { this.rollout = rollout; }

    public BlueGreenConfig getBlueGreen() { return blueGreen; }
    public void setBlueGreen(BlueGreenConfig blueGreen) { this.blueGreen = blueGreen; }

    public OptimizerConfig getOptimizer() { return optimizer; }
    public void setOptimizer(OptimizerConfig optimizer) { this.optimizer = optimizer; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public StoreConfig getStore() { return store; }
    public void setStore(StoreConfig store) { this.store = store; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public List<DeploymentConfig> getDeployments() { return deployments; }
    public void setDeployments(List<DeploymentConfig> deployments) { this.deployments = deployments; }

    /**
     * Admin HTTP server configuration.
     */
    public static class ServerConfig {
        private boolean enabled = true;
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 16;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Routing strategy configuration. Hot-reloadable.
     */
    public static class RoutingConfig {
        private String strategy = "balanced";
        private double loadThreshold = 0.8;
        private BalancedWeightsConfig balancedWeights = new BalancedWeightsConfig();
        private long latencyWindowMs = 60000;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public double getLoadThreshold() { return loadThreshold; }
        public void setLoadThreshold(double loadThreshold) { this.loadThreshold = loadThreshold; }

        public BalancedWeightsConfig getBalancedWeights() { return balancedWeights; }
        public void setBalancedWeights(BalancedWeightsConfig balancedWeights) { this.balancedWeights = balancedWeights; }

        public long getLatencyWindowMs() { return latencyWindowMs; }
        public void setLatencyWindowMs(long latencyWindowMs) { this.latencyWindowMs = latencyWindowMs; }

        public RoutingParameters toParameters() {
            return new RoutingParameters(loadThreshold, new BalancedWeights(
                    balancedWeights.getCost(), balancedWeights.getLatency(), balancedWeights.getLoad()));
        }
    }

    /**
     * Term weights of the BALANCED strategy.
     */
    public static class BalancedWeightsConfig {
        private double cost = 0.3;
        private double latency = 0.4;
        private double load = 0.3;

        public double getCost() { return cost; }
        public void setCost(double cost) { this.cost = cost; }

        public double getLatency() { return latency; }
        public void setLatency(double latency) { this.latency = latency; }

        public double getLoad() { return load; }
        public void setLoad(double load) { this.load = load; }
    }

    /**
     * Metrics collection and export configuration.
     */
    public static class MetricsConfig {
        private String prefix = "model_traffic";
        private int samplesPerEndpoint = 10000;
        private long retentionMs = 3600000;

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getSamplesPerEndpoint() { return samplesPerEndpoint; }
        public void setSamplesPerEndpoint(int samplesPerEndpoint) { this.samplesPerEndpoint = samplesPerEndpoint; }

        public long getRetentionMs() { return retentionMs; }
        public void setRetentionMs(long retentionMs) { this.retentionMs = retentionMs; }
    }

    /**
     * LMAX Disruptor configuration.
     */
    public static class PipelineConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "yielding";
        private int maxGlobalInFlight = 1000;
        private long requestTimeoutMs = 60000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getMaxGlobalInFlight() { return maxGlobalInFlight; }
        public void setMaxGlobalInFlight(int maxGlobalInFlight) { this.maxGlobalInFlight = maxGlobalInFlight; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Canary rollout defaults and endpoint draining.
     */
    public static class RolloutConfig {
        private List<Integer> trafficSteps = new ArrayList<>(List.of(5, 20, 50, 100));
        private long evaluationIntervalMs = 300000;
        private int minSampleCount = 50;
        private int maxDeferrals = 3;
        private double maxErrorRateIncrease = 0.10;
        private double maxLatencyIncrease = 0.20;
        private double absoluteErrorRate = 0.01;
        private double absoluteLatencyMs = 50;
        private long drainGracePeriodMs = 300000;
        private long drainSweepIntervalMs = 30000;

        public List<Integer> getTrafficSteps() { return trafficSteps; }
        public void setTrafficSteps(List<Integer> trafficSteps) { this.trafficSteps = trafficSteps; }

        public long getEvaluationIntervalMs() { return evaluationIntervalMs; }
        public void setEvaluationIntervalMs(long evaluationIntervalMs) { this.evaluationIntervalMs = evaluationIntervalMs; }

        public int getMinSampleCount() { return minSampleCount; }
        public void setMinSampleCount(int minSampleCount) { this.minSampleCount = minSampleCount; }

        public int getMaxDeferrals() { return maxDeferrals; }
        public void setMaxDeferrals(int maxDeferrals) { this.maxDeferrals = maxDeferrals; }

        public double getMaxErrorRateIncrease() { return maxErrorRateIncrease; }
        public void setMaxErrorRateIncrease(double maxErrorRateIncrease) { this.maxErrorRateIncrease = maxErrorRateIncrease; }

        public double getMaxLatencyIncrease() { return maxLatencyIncrease; }
        public void setMaxLatencyIncrease(double maxLatencyIncrease) { this.maxLatencyIncrease = maxLatencyIncrease; }

        public double getAbsoluteErrorRate() { return absoluteErrorRate; }
        public void setAbsoluteErrorRate(double absoluteErrorRate) { this.absoluteErrorRate = absoluteErrorRate; }

        public double getAbsoluteLatencyMs() { return absoluteLatencyMs; }
        public void setAbsoluteLatencyMs(double absoluteLatencyMs) { this.absoluteLatencyMs = absoluteLatencyMs; }

        public long getDrainGracePeriodMs() { return drainGracePeriodMs; }
        public void setDrainGracePeriodMs(long drainGracePeriodMs) { this.drainGracePeriodMs = drainGracePeriodMs; }

        public long getDrainSweepIntervalMs() { return drainSweepIntervalMs; }
        public void setDrainSweepIntervalMs(long drainSweepIntervalMs) { this.drainSweepIntervalMs = drainSweepIntervalMs; }

        public SuccessCriteria toSuccessCriteria() {
            return new SuccessCriteria(maxErrorRateIncrease, maxLatencyIncrease, absoluteErrorRate, absoluteLatencyMs);
        }
    }

    /**
     * Blue-green deployment defaults.
     */
    public static class BlueGreenConfig {
        private long rollbackWindowMs = 1800000;
        private double errorRateThreshold = 0.05;
        private int minSampleCount = 20;
        private long monitorIntervalMs = 30000;

        public long getRollbackWindowMs() { return rollbackWindowMs; }
        public void setRollbackWindowMs(long rollbackWindowMs) { this.rollbackWindowMs = rollbackWindowMs; }

        public double getErrorRateThreshold() { return errorRateThreshold; }
        public void setErrorRateThreshold(double errorRateThreshold) { this.errorRateThreshold = errorRateThreshold; }

        public int getMinSampleCount() { return minSampleCount; }
        public void setMinSampleCount(int minSampleCount) { this.minSampleCount = minSampleCount; }

        public long getMonitorIntervalMs() { return monitorIntervalMs; }
        public void setMonitorIntervalMs(long monitorIntervalMs) { this.monitorIntervalMs = monitorIntervalMs; }
    }

    /**
     * Performance optimizer configuration.
     */
    public static class OptimizerConfig {
        private boolean enabled = true;
        private long analysisIntervalMs = 900000;
        private long baselineWindowMs = 3600000;
        private long analysisWindowMs = 900000;
        private int minSampleCount = 30;
        private double latencyTolerance = 0.20;
        private double errorRateTolerance = 0.50;
        private double absoluteLatencyMs = 50;
        private double absoluteErrorRate = 0.01;
        private double latencySlaMs = 2000;
        private double highLoadThreshold = 0.75;
        private double cacheHitRatio = 0.30;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getAnalysisIntervalMs() { return analysisIntervalMs; }
        public void setAnalysisIntervalMs(long analysisIntervalMs) { this.analysisIntervalMs = analysisIntervalMs; }

        public long getBaselineWindowMs() { return baselineWindowMs; }
        public void setBaselineWindowMs(long baselineWindowMs) { this.baselineWindowMs = baselineWindowMs; }

        public long getAnalysisWindowMs() { return analysisWindowMs; }
        public void setAnalysisWindowMs(long analysisWindowMs) { this.analysisWindowMs = analysisWindowMs; }

        public int getMinSampleCount() { return minSampleCount; }
        public void setMinSampleCount(int minSampleCount) { this.minSampleCount = minSampleCount; }

        public double getLatencyTolerance() { return latencyTolerance; }
        public void setLatencyTolerance(double latencyTolerance) { this.latencyTolerance = latencyTolerance; }

        public double getErrorRateTolerance() { return errorRateTolerance; }
        public void setErrorRateTolerance(double errorRateTolerance) { this.errorRateTolerance = errorRateTolerance; }

        public double getAbsoluteLatencyMs() { return absoluteLatencyMs; }
        public void setAbsoluteLatencyMs(double absoluteLatencyMs) { this.absoluteLatencyMs = absoluteLatencyMs; }

        public double getAbsoluteErrorRate() { return absoluteErrorRate; }
        public void setAbsoluteErrorRate(double absoluteErrorRate) { this.absoluteErrorRate = absoluteErrorRate; }

        public double getLatencySlaMs() { return latencySlaMs; }
        public void setLatencySlaMs(double latencySlaMs) { this.latencySlaMs = latencySlaMs; }

        public double getHighLoadThreshold() { return highLoadThreshold; }
        public void setHighLoadThreshold(double highLoadThreshold) { this.highLoadThreshold = highLoadThreshold; }

        public double getCacheHitRatio() { return cacheHitRatio; }
        public void setCacheHitRatio(double cacheHitRatio) { this.cacheHitRatio = cacheHitRatio; }

        public OptimizerSettings toSettings() {
            return new OptimizerSettings(Duration.ofMillis(baselineWindowMs), Duration.ofMillis(analysisWindowMs),
                    minSampleCount, latencyTolerance, errorRateTolerance, absoluteLatencyMs, absoluteErrorRate,
                    latencySlaMs, highLoadThreshold, cacheHitRatio);
        }
    }

    /**
     * Endpoint health checking and smoke test configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private long timeoutMs = 5000;
        private int degradedThreshold = 3;
        private int downThreshold = 6;
        private String path = "/health";
        private String smokeTestPath = "/health";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getDegradedThreshold() { return degradedThreshold; }
        public void setDegradedThreshold(int degradedThreshold) { this.degradedThreshold = degradedThreshold; }

        public int getDownThreshold() { return downThreshold; }
        public void setDownThreshold(int downThreshold) { this.downThreshold = downThreshold; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getSmokeTestPath() { return smokeTestPath; }
        public void setSmokeTestPath(String smokeTestPath) { this.smokeTestPath = smokeTestPath; }
    }

    /**
     * Snapshot store configuration: {@code memory} or {@code file}.
     */
    public static class StoreConfig {
        private String type = "memory";
        private String directory = "data";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    /**
     * A model and its initial endpoints.
     */
    public static class ModelConfig {
        private String name;
        private List<EndpointConfig> endpoints = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<EndpointConfig> getEndpoints() { return endpoints; }
        public void setEndpoints(List<EndpointConfig> endpoints) { this.endpoints = endpoints; }
    }

    /**
     * A pre-existing endpoint of a model.
     */
    public static class EndpointConfig {
        private String id;
        private String version;
        private String url;
        private double costPerToken;
        private int maxConcurrentRequests = 10;
        private int weight;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public double getCostPerToken() { return costPerToken; }
        public void setCostPerToken(double costPerToken) { this.costPerToken = costPerToken; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public ModelEndpoint toEndpoint(String model) {
            return ModelEndpoint.builder()
                    .id(id)
                    .model(model)
                    .version(version)
                    .address(url)
                    .costPerToken(costPerToken)
                    .maxConcurrentRequests(maxConcurrentRequests)
                    .weight(weight)
                    .state(EndpointState.ACTIVE)
                    .build();
        }
    }

    /**
     * Pre-provisioned address of a model version, handed out by the configured deployment backend.
     */
    public static class DeploymentConfig {
        private String model;
        private String version;
        private String url;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
