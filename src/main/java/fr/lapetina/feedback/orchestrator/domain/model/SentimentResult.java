package fr.lapetina.feedback.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Sentiment of a single text.
 *
 * @param score      normalized polarity in [0, 1], 0.5 being neutral
 * @param label      polarity label
 * @param confidence confidence in [0, 1]
 */
public record SentimentResult(
        double score,
        SentimentLabel label,
        double confidence
) implements AnalysisResult {

    private static final SentimentResult NEUTRAL = new SentimentResult(0.5, SentimentLabel.NEUTRAL, 0.0);

    public SentimentResult {
        Objects.requireNonNull(label, "Label is required");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be within [0, 1]: " + score);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
    }

    /**
     * Builds a result from a compound score in [-1, 1].
     */
    public static SentimentResult fromCompound(double compound) {
        double bounded = Math.max(-1.0, Math.min(1.0, compound));
        return new SentimentResult((bounded + 1.0) / 2.0, SentimentLabel.fromCompound(bounded), Math.abs(bounded));
    }

    /**
     * Neutral default used when nothing better is known.
     */
    public static SentimentResult neutral() {
        return NEUTRAL;
    }

    @Override
    @JsonIgnore
    public AnalysisKind kind() {
        return AnalysisKind.SENTIMENT;
    }
}
