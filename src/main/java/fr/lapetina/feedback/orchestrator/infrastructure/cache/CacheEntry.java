package fr.lapetina.feedback.orchestrator.infrastructure.cache;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;

import java.time.Instant;

/**
 * Cached result for one input text. Owned by {@link ResultCache}.
 */
public record CacheEntry(
        String key,
        AnalysisResult value,
        AnalysisKind partition,
        Instant createdAt,
        Instant lastAccess
) {
    CacheEntry touch(Instant now) {
        return new CacheEntry(key, value, partition, createdAt, now);
    }
}
