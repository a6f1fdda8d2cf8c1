package fr.lapetina.feedback.orchestrator.domain.model;

/**
 * Per-input analysis outcome. Exactly one result is produced for every input text,
 * at the same index as the input.
 *
 * @see SentimentResult
 * @see InsightResult
 */
public interface AnalysisResult {

    AnalysisKind kind();
}
