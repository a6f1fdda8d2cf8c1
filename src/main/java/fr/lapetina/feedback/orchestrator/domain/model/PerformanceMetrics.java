package fr.lapetina.feedback.orchestrator.domain.model;

/**
 * Process-wide counters since start.
 */
public record PerformanceMetrics(
        long totalCalls,
        long cacheHits,
        long cacheMisses,
        long fallbacks,
        double averageLatencyMs
) {
}
