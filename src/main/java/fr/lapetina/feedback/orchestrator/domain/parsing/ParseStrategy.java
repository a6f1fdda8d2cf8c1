package fr.lapetina.feedback.orchestrator.domain.parsing;

/**
 * Extraction step that produced a parsed value, in the order they are attempted.
 */
public enum ParseStrategy {
    DIRECT,
    FENCED_BLOCK,
    BRACKET_SPAN,
    QUOTE_NORMALIZED
}
