package fr.lapetina.feedback.orchestrator;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.infrastructure.cache.ResultCache;
import fr.lapetina.feedback.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.feedback.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.feedback.orchestrator.infrastructure.http.AdaptiveThrottle;
import fr.lapetina.feedback.orchestrator.infrastructure.http.CircuitBreaker;
import fr.lapetina.feedback.orchestrator.infrastructure.http.GeminiHttpClient;
import fr.lapetina.feedback.orchestrator.infrastructure.http.RemoteInferenceClient;
import fr.lapetina.feedback.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.feedback.orchestrator.orchestration.AnalysisOrchestrator;
import fr.lapetina.feedback.orchestrator.orchestration.BatchPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 * Owns the per-process object graph: configuration, metrics, cache, breaker, throttle,
 * remote client and orchestrator.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("orchestrator.yaml")) {
 *     AnalysisOrchestrator orchestrator = factory.getOrchestrator();
 *     // use orchestrator...
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ResultCache cache;
    private final CircuitBreaker circuitBreaker;
    private final AdaptiveThrottle throttle;
    private final RemoteInferenceClient remoteClient;
    private final AnalysisOrchestrator orchestrator;

    protected OrchestratorFactory(OrchestratorConfig config, RemoteInferenceClient remoteClientOverride, Clock clock) {
        this.config = config;

        // Initialize metrics
        OrchestratorConfig.MetricsConfig metricsConfig = config.getMetrics();
        this.metricsRegistry = new MetricsRegistry(metricsConfig.getPrefix(), metricsConfig.isEnabled());

        OrchestratorConfig.CacheConfig cacheConfig = config.getCache();
        this.cache = new ResultCache(
                Map.of(
                        AnalysisKind.SENTIMENT, cacheConfig.getSentimentCapacity(),
                        AnalysisKind.INSIGHT, cacheConfig.getInsightCapacity(),
                        AnalysisKind.SUMMARY, cacheConfig.getSummaryCapacity()
                ),
                Duration.ofMillis(cacheConfig.getTtlMs()),
                clock
        );

        OrchestratorConfig.CircuitBreakerConfig breakerConfig = config.getCircuitBreaker();
        this.circuitBreaker = new CircuitBreaker(
                "remote-analysis",
                breakerConfig.getFailureThreshold(),
                Duration.ofMillis(breakerConfig.getResetTimeoutMs()),
                clock
        );

        OrchestratorConfig.ThrottleConfig throttleConfig = config.getThrottle();
        this.throttle = AdaptiveThrottle.builder()
                .floor(Duration.ofMillis(throttleConfig.getFloorMs()))
                .ceiling(Duration.ofMillis(throttleConfig.getCeilingMs()))
                .failureMultiplier(throttleConfig.getFailureMultiplier())
                .successMultiplier(throttleConfig.getSuccessMultiplier())
                .quotaMultiplier(throttleConfig.getQuotaMultiplier())
                .quotaCooldown(Duration.ofMillis(throttleConfig.getQuotaCooldownInitialMs()),
                        Duration.ofMillis(throttleConfig.getQuotaCooldownMaxMs()))
                .clock(clock)
                .build();

        // Initialize remote client (allow override for testing)
        this.remoteClient = remoteClientOverride != null ? remoteClientOverride : createRemoteClient();

        OrchestratorConfig.ConcurrencyConfig concurrency = config.getConcurrency();
        this.orchestrator = AnalysisOrchestrator.builder()
                .remoteClient(remoteClient)
                .cache(cache)
                .circuitBreaker(circuitBreaker)
                .throttle(throttle)
                .metricsRegistry(metricsRegistry)
                .batchPlanner(new BatchPlanner(config.getBatching()))
                .workerThreads(concurrency.resolveWorkerThreads())
                .maxConcurrentRemoteCalls(concurrency.getMaxConcurrentRemoteCalls())
                .remoteCallTimeout(Duration.ofMillis(config.getRemote().getRequestTimeoutMs()))
                .defaultDeadline(Duration.ofMillis(concurrency.getSubmitTimeoutMs()))
                .quotaFailureWeight(breakerConfig.getQuotaFailureWeight())
                .build();

        log.info("OrchestratorFactory initialized: model={}, remoteAvailable={}",
                remoteClient.getModelName(), remoteClient.isAvailable());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);
        return new OrchestratorFactory(new ConfigLoader(configPath).load(), null, Clock.systemUTC());
    }

    /**
     * Creates a factory from the default configuration (orchestrator.yaml).
     */
    public static OrchestratorFactory create() {
        return create(ConfigLoader.DEFAULT_CONFIG_PATH);
    }

    public AnalysisOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ResultCache getCache() {
        return cache;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public AdaptiveThrottle getThrottle() {
        return throttle;
    }

    public RemoteInferenceClient getRemoteClient() {
        return remoteClient;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    private RemoteInferenceClient createRemoteClient() {
        OrchestratorConfig.RemoteConfig remote = config.getRemote();
        return new GeminiHttpClient(
                remote.getBaseUrl(),
                remote.getModel(),
                remote.resolveApiKey(),
                Duration.ofMillis(remote.getConnectTimeoutMs()),
                Duration.ofMillis(remote.getRequestTimeoutMs()),
                remote.getTemperature()
        );
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            orchestrator.close();
        } catch (Exception e) {
            log.warn("Error closing orchestrator", e);
        }

        try {
            remoteClient.close();
        } catch (Exception e) {
            log.warn("Error closing remote client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}
