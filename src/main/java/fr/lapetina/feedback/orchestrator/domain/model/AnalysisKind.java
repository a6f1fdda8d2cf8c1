package fr.lapetina.feedback.orchestrator.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of analysis requested for a batch of feedback texts.
 * Each kind owns its own cache partition.
 */
public enum AnalysisKind {
    SENTIMENT,
    INSIGHT,
    SUMMARY;

    /**
     * Resolves a kind from its wire name ("sentiment", "insight", "summary"), case-insensitive.
     */
    public static Optional<AnalysisKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
