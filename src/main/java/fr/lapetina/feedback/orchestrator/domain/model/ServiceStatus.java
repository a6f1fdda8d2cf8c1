package fr.lapetina.feedback.orchestrator.domain.model;

import fr.lapetina.feedback.orchestrator.infrastructure.cache.CacheStats;

/**
 * Read-only snapshot of the orchestrator for health and monitoring displays.
 *
 * @param available             remote service is configured
 * @param circuitOpen           circuit breaker currently bypasses the remote service
 * @param rateLimited           quota cooldown in effect
 * @param circuitResetInSeconds seconds until the breaker closes again, 0 when closed
 * @param throttleIntervalMs    current minimum interval between remote calls
 */
public record ServiceStatus(
        boolean available,
        boolean circuitOpen,
        boolean rateLimited,
        long circuitResetInSeconds,
        long throttleIntervalMs,
        CacheStats cacheStats,
        PerformanceMetrics performanceMetrics
) {
    /**
     * True when misses are currently served by the local path.
     */
    public boolean usingLocalProcessing() {
        return !available || circuitOpen || rateLimited;
    }
}
