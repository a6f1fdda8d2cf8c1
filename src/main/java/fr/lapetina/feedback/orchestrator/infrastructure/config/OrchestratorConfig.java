package fr.lapetina.feedback.orchestrator.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML; loaded once at process start.
 */
public class OrchestratorConfig {

    private ServerConfig server = new ServerConfig();
    private RemoteConfig remote = new RemoteConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private ThrottleConfig throttle = new ThrottleConfig();
    private BatchingConfig batching = new BatchingConfig();
    private CacheConfig cache = new CacheConfig();
    private ConcurrencyConfig concurrency = new ConcurrencyConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public RemoteConfig getRemote() { return remote; }
    public void setRemote(RemoteConfig remote) { this.remote = remote; }

    public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerConfig circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public ThrottleConfig getThrottle() { return throttle; }
    public void setThrottle(ThrottleConfig throttle) { this.throttle = throttle; }

    public BatchingConfig getBatching() { return batching; }
    public void setBatching(BatchingConfig batching) { this.batching = batching; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public ConcurrencyConfig getConcurrency() { return concurrency; }
    public void setConcurrency(ConcurrencyConfig concurrency) { this.concurrency = concurrency; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Checks cross-field constraints.
     *
     * @throws ConfigLoader.ConfigurationException describing the first violation
     */
    public OrchestratorConfig validate() {
        require(circuitBreaker.getFailureThreshold() > 0, "circuitBreaker.failureThreshold must be positive");
        require(circuitBreaker.getResetTimeoutMs() > 0, "circuitBreaker.resetTimeoutMs must be positive");
        require(throttle.getFloorMs() > 0, "throttle.floorMs must be positive");
        require(throttle.getCeilingMs() >= throttle.getFloorMs(), "throttle.ceilingMs must be >= throttle.floorMs");
        require(throttle.getFailureMultiplier() >= 1.0, "throttle.failureMultiplier must be >= 1");
        require(throttle.getSuccessMultiplier() > 0 && throttle.getSuccessMultiplier() <= 1.0,
                "throttle.successMultiplier must be in (0, 1]");
        require(throttle.getQuotaMultiplier() >= 1.0, "throttle.quotaMultiplier must be >= 1");

        List<Integer> thresholds = batching.getLengthThresholds();
        require(thresholds.size() == 3, "batching.lengthThresholds must list 3 thresholds");
        for (int i = 1; i < thresholds.size(); i++) {
            require(thresholds.get(i) > thresholds.get(i - 1), "batching.lengthThresholds must be increasing");
        }
        validateSizes(batching.getRemoteBatchSizes(), "batching.remoteBatchSizes");
        validateSizes(batching.getLocalBatchSizes(), "batching.localBatchSizes");

        require(cache.getSentimentCapacity() > 0, "cache.sentimentCapacity must be positive");
        require(cache.getInsightCapacity() > 0, "cache.insightCapacity must be positive");
        require(cache.getSummaryCapacity() > 0, "cache.summaryCapacity must be positive");
        require(concurrency.getWorkerThreads() >= 0, "concurrency.workerThreads must not be negative");
        require(concurrency.getMaxConcurrentRemoteCalls() > 0, "concurrency.maxConcurrentRemoteCalls must be positive");
        require(concurrency.getSubmitTimeoutMs() > 0, "concurrency.submitTimeoutMs must be positive");
        return this;
    }

    private static void validateSizes(List<Integer> sizes, String name) {
        require(sizes.size() == 4, name + " must list 4 batch sizes");
        for (int i = 0; i < sizes.size(); i++) {
            require(sizes.get(i) > 0, name + " must be positive");
            if (i > 0) {
                require(sizes.get(i) <= sizes.get(i - 1), name + " must not increase");
            }
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigLoader.ConfigurationException("Invalid configuration: " + message);
        }
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 8;

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
     * Remote analysis service (Gemini) configuration.
     * The API key is read from {@code apiKeyEnv} unless {@code apiKey} is set directly.
     */
    public static class RemoteConfig {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-2.0-flash";
        private String apiKeyEnv = "GEMINI_API_KEY";
        private String apiKey;
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 30000;
        private double temperature = 0.2;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        /**
         * Explicit key if configured, otherwise the value of the configured environment variable.
         */
        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey;
            }
            return apiKeyEnv != null ? System.getenv(apiKeyEnv) : null;
        }
    }

    /**
     * Circuit breaker configuration.
     */
    public static class CircuitBreakerConfig {
        private int failureThreshold = 3;
        private long resetTimeoutMs = 120000;
        private int quotaFailureWeight = 2;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getResetTimeoutMs() { return resetTimeoutMs; }
        public void setResetTimeoutMs(long resetTimeoutMs) { this.resetTimeoutMs = resetTimeoutMs; }

        public int getQuotaFailureWeight() { return quotaFailureWeight; }
        public void setQuotaFailureWeight(int quotaFailureWeight) { this.quotaFailureWeight = quotaFailureWeight; }
    }

    /**
     * Adaptive throttle configuration.
     */
    public static class ThrottleConfig {
        private long floorMs = 100;
        private long ceilingMs = 1000;
        private double failureMultiplier = 1.5;
        private double successMultiplier = 0.9;
        private double quotaMultiplier = 2.25;
        private long quotaCooldownInitialMs = 5000;
        private long quotaCooldownMaxMs = 300000;

        public long getFloorMs() { return floorMs; }
        public void setFloorMs(long floorMs) { this.floorMs = floorMs; }

        public long getCeilingMs() { return ceilingMs; }
        public void setCeilingMs(long ceilingMs) { this.ceilingMs = ceilingMs; }

        public double getFailureMultiplier() { return failureMultiplier; }
        public void setFailureMultiplier(double failureMultiplier) { this.failureMultiplier = failureMultiplier; }

        public double getSuccessMultiplier() { return successMultiplier; }
        public void setSuccessMultiplier(double successMultiplier) { this.successMultiplier = successMultiplier; }

        public double getQuotaMultiplier() { return quotaMultiplier; }
        public void setQuotaMultiplier(double quotaMultiplier) { this.quotaMultiplier = quotaMultiplier; }

        public long getQuotaCooldownInitialMs() { return quotaCooldownInitialMs; }
        public void setQuotaCooldownInitialMs(long ms) { this.quotaCooldownInitialMs = ms; }

        public long getQuotaCooldownMaxMs() { return quotaCooldownMaxMs; }
        public void setQuotaCooldownMaxMs(long ms) { this.quotaCooldownMaxMs = ms; }
    }

    /**
     * Batch size selection by average text length.
     * Three increasing length thresholds split inputs into four buckets, each mapped to a batch size.
     */
    public static class BatchingConfig {
        private List<Integer> lengthThresholds = new ArrayList<>(List.of(100, 200, 500));
        private List<Integer> remoteBatchSizes = new ArrayList<>(List.of(20, 15, 10, 5));
        private List<Integer> localBatchSizes = new ArrayList<>(List.of(200, 100, 50, 25));

        public List<Integer> getLengthThresholds() { return lengthThresholds; }
        public void setLengthThresholds(List<Integer> lengthThresholds) { this.lengthThresholds = lengthThresholds; }

        public List<Integer> getRemoteBatchSizes() { return remoteBatchSizes; }
        public void setRemoteBatchSizes(List<Integer> remoteBatchSizes) { this.remoteBatchSizes = remoteBatchSizes; }

        public List<Integer> getLocalBatchSizes() { return localBatchSizes; }
        public void setLocalBatchSizes(List<Integer> localBatchSizes) { this.localBatchSizes = localBatchSizes; }
    }

    /**
     * Result cache configuration.
     */
    public static class CacheConfig {
        private int sentimentCapacity = 10000;
        private int insightCapacity = 5000;
        private int summaryCapacity = 5000;
        private long ttlMs = 0;

        public int getSentimentCapacity() { return sentimentCapacity; }
        public void setSentimentCapacity(int sentimentCapacity) { this.sentimentCapacity = sentimentCapacity; }

        public int getInsightCapacity() { return insightCapacity; }
        public void setInsightCapacity(int insightCapacity) { this.insightCapacity = insightCapacity; }

        public int getSummaryCapacity() { return summaryCapacity; }
        public void setSummaryCapacity(int summaryCapacity) { this.summaryCapacity = summaryCapacity; }

        public long getTtlMs() { return ttlMs; }
        public void setTtlMs(long ttlMs) { this.ttlMs = ttlMs; }
    }

    /**
     * Worker pool and deadline configuration.
     */
    public static class ConcurrencyConfig {
        private int workerThreads = 0;
        private int maxConcurrentRemoteCalls = 2;
        private long submitTimeoutMs = 60000;

        /** 0 means one worker per available processor. */
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public int getMaxConcurrentRemoteCalls() { return maxConcurrentRemoteCalls; }
        public void setMaxConcurrentRemoteCalls(int max) { this.maxConcurrentRemoteCalls = max; }

        public long getSubmitTimeoutMs() { return submitTimeoutMs; }
        public void setSubmitTimeoutMs(long submitTimeoutMs) { this.submitTimeoutMs = submitTimeoutMs; }

        public int resolveWorkerThreads() {
            return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "feedback_orchestrator";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
