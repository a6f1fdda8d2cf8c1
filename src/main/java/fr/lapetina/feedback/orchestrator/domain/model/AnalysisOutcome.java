package fr.lapetina.feedback.orchestrator.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Results of one request together with how they were produced.
 *
 * @param results       one result per input, in input order
 * @param fallbackItems inputs analyzed locally because the remote path was skipped or failed
 * @param localProcessing true when any input of this request was analyzed locally, either as the
 *                      normal route (sentiment) or as a fallback
 */
public record AnalysisOutcome(
        List<AnalysisResult> results,
        int fallbackItems,
        boolean localProcessing
) {
    public AnalysisOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "Results are required"));
    }
}
