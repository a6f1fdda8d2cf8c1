package fr.lapetina.feedback.orchestrator.domain.model;

/**
 * Receives progress events for an analysis request.
 * Invoked from worker threads; implementations must be thread-safe.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = event -> { };

    void onProgress(ProgressEvent event);
}
