package fr.lapetina.feedback.orchestrator.infrastructure.cache;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;

import java.util.Map;

/**
 * Point-in-time cache counters, overall and per partition.
 */
public record CacheStats(
        long hits,
        long misses,
        Map<AnalysisKind, PartitionStats> partitions
) {
    public CacheStats {
        partitions = Map.copyOf(partitions);
    }

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public int size(AnalysisKind partition) {
        PartitionStats stats = partitions.get(partition);
        return stats != null ? stats.size() : 0;
    }

    public record PartitionStats(
            int size,
            int capacity,
            long hits,
            long misses,
            long evictions
    ) {
    }
}
