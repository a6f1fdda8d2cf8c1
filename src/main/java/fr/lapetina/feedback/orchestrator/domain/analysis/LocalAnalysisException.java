package fr.lapetina.feedback.orchestrator.domain.analysis;

/**
 * The local analysis path itself failed. No analysis path remains when this is thrown,
 * so it is the only failure callers of the orchestrator can observe.
 */
public final class LocalAnalysisException extends RuntimeException {

    public LocalAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
