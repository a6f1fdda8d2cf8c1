package fr.lapetina.feedback.orchestrator.domain.model;

/**
 * Progress of a single analysis request, emitted each time a batch completes.
 */
public record ProgressEvent(
        String requestId,
        int batchesDone,
        int batchesTotal,
        int itemsProcessed,
        int itemsTotal
) {
    public boolean isComplete() {
        return batchesDone >= batchesTotal;
    }
}
