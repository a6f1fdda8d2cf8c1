package fr.lapetina.feedback.orchestrator.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Polarity label attached to a sentiment result.
 */
public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    /** Compound scores at or beyond this magnitude carry a polarity. */
    public static final double POLARITY_THRESHOLD = 0.05;

    /**
     * Labels a compound score in [-1, 1].
     */
    public static SentimentLabel fromCompound(double compound) {
        if (compound >= POLARITY_THRESHOLD) {
            return POSITIVE;
        }
        if (compound <= -POLARITY_THRESHOLD) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }

    /**
     * Labels a normalized score in [0, 1], the inverse of {@code (compound + 1) / 2}.
     */
    public static SentimentLabel fromScore(double score) {
        return fromCompound(score * 2.0 - 1.0);
    }

    public static Optional<SentimentLabel> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
