package fr.lapetina.feedback.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Insight or summary extracted from feedback text.
 *
 * <p>{@code degraded} is set when the result was produced without the remote service,
 * in which case the lists are empty and the summary only describes the situation.
 */
public record InsightResult(
        AnalysisKind kind,
        String summary,
        @JsonProperty("key_points") List<String> keyPoints,
        @JsonProperty("pain_points") List<String> painPoints,
        @JsonProperty("feature_requests") List<String> featureRequests,
        @JsonProperty("positive_aspects") List<String> positiveAspects,
        boolean degraded
) implements AnalysisResult {

    public InsightResult {
        Objects.requireNonNull(kind, "Kind is required");
        if (kind == AnalysisKind.SENTIMENT) {
            throw new IllegalArgumentException("Insight result cannot carry kind " + kind);
        }
        summary = summary != null ? summary : "";
        keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
        painPoints = painPoints != null ? List.copyOf(painPoints) : List.of();
        featureRequests = featureRequests != null ? List.copyOf(featureRequests) : List.of();
        positiveAspects = positiveAspects != null ? List.copyOf(positiveAspects) : List.of();
    }

    /**
     * Result surfaced when no remote analysis is available for this kind.
     */
    public static InsightResult degraded(AnalysisKind kind, String summary) {
        return new InsightResult(kind, summary, List.of(), List.of(), List.of(), List.of(), true);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return keyPoints.isEmpty() && painPoints.isEmpty()
                && featureRequests.isEmpty() && positiveAspects.isEmpty();
    }
}
