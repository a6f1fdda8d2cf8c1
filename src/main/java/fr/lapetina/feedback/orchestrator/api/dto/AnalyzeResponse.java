package fr.lapetina.feedback.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisRequest;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;

import java.util.List;

/**
 * API response DTO for the analysis endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyzeResponse {

    @JsonProperty("request_id")
    private String requestId;

    private String kind;
    private int count;
    private List<AnalysisResult> results;

    @JsonProperty("local_processing")
    private boolean localProcessing;

    @JsonProperty("duration_ms")
    private long durationMs;

    // Getters and setters
    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public int getCount() { return count; }
    public void setCount(int count) { this.count = count; }

    public List<AnalysisResult> getResults() { return results; }
    public void setResults(List<AnalysisResult> results) { this.results = results; }

    public boolean isLocalProcessing() { return localProcessing; }
    public void setLocalProcessing(boolean localProcessing) { this.localProcessing = localProcessing; }

    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }

    /**
     * Creates an API response from the results of a request.
     */
    public static AnalyzeResponse from(AnalysisRequest request, List<AnalysisResult> results,
                                       boolean localProcessing, long durationMs) {
        AnalyzeResponse response = new AnalyzeResponse();
        response.setRequestId(request.requestId());
        response.setKind(request.kind().wireName());
        response.setCount(results.size());
        response.setResults(results);
        response.setLocalProcessing(localProcessing);
        response.setDurationMs(durationMs);
        return response;
    }
}
