package fr.lapetina.feedback.orchestrator.infrastructure.metrics;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;
import fr.lapetina.feedback.orchestrator.domain.model.PerformanceMetrics;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Remote call counters and latency timers per analysis kind
 * - Cache hit/miss counters per partition
 * - Fallback counters by kind and reason
 * - Gauges for breaker, throttle and cache state
 * - JVM and system metrics
 * - Prometheus exposition
 *
 * Also keeps the plain process-wide totals behind {@link #snapshot()}.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String OUTCOME_SUCCESS = "success";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> remoteCallCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AnalysisKind, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> cacheCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();

    // Totals for the status snapshot
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("feedback_orchestrator");
    }

    /**
     * Records one remote call attempt with its outcome ({@link #OUTCOME_SUCCESS} or an error type name).
     */
    public void recordRemoteCall(AnalysisKind kind, String outcome, Duration latency) {
        totalCalls.incrementAndGet();
        totalLatencyNanos.addAndGet(latency.toNanos());

        String key = kind.name() + ":" + outcome;
        remoteCallCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_remote_calls_total")
                        .description("Total number of remote analysis calls")
                        .tag("kind", kind.wireName())
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(kind, k ->
                Timer.builder(prefix + "_remote_latency")
                        .description("Remote analysis call latency")
                        .tag("kind", kind.wireName())
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void recordRemoteFailure(AnalysisKind kind, ErrorType errorType, Duration latency) {
        recordRemoteCall(kind, errorType.name().toLowerCase(), latency);
    }

    /**
     * Records a cache lookup for one input.
     */
    public void recordCacheLookup(AnalysisKind partition, boolean hit) {
        (hit ? cacheHits : cacheMisses).incrementAndGet();
        String result = hit ? "hit" : "miss";
        cacheCounters.computeIfAbsent(partition.name() + ":" + result, k ->
                Counter.builder(prefix + "_cache_requests_total")
                        .description("Result cache lookups")
                        .tag("partition", partition.wireName())
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }

    /**
     * Records items served by the local path instead of the remote service.
     */
    public void recordFallback(AnalysisKind kind, ErrorType reason, int items) {
        if (items <= 0) {
            return;
        }
        fallbacks.addAndGet(items);
        fallbackCounters.computeIfAbsent(kind.name() + ":" + reason.name(), k ->
                Counter.builder(prefix + "_fallbacks_total")
                        .description("Inputs analyzed locally instead of remotely")
                        .tag("kind", kind.wireName())
                        .tag("reason", reason.name().toLowerCase())
                        .register(registry)
        ).increment(items);
    }

    /**
     * Registers a gauge backed by a supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier, String... tags) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .tags(tags)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Process-wide totals since start.
     */
    public PerformanceMetrics snapshot() {
        long calls = totalCalls.get();
        double averageLatencyMs = calls == 0 ? 0.0 : totalLatencyNanos.get() / 1_000_000.0 / calls;
        return new PerformanceMetrics(calls, cacheHits.get(), cacheMisses.get(), fallbacks.get(), averageLatencyMs);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
