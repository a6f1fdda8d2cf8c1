package fr.lapetina.feedback.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisRequest;

import java.time.Duration;
import java.util.List;

/**
 * API request DTO for the analysis endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzeRequest {

    private String kind;
    private List<String> texts;

    @JsonProperty("timeout_ms")
    private Long timeoutMs;

    @JsonProperty("request_id")
    private String requestId;

    // Getters and setters
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public List<String> getTexts() { return texts; }
    public void setTexts(List<String> texts) { this.texts = texts; }

    public Long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(Long timeoutMs) { this.timeoutMs = timeoutMs; }

    public String getRequestId() { return requestId; }
    public void setRequestId(String requestId) { this.requestId = requestId; }

    /**
     * Converts to a domain AnalysisRequest.
     *
     * @param defaultKind kind used when the body names none
     * @throws IllegalArgumentException if the body is invalid
     */
    public AnalysisRequest toAnalysisRequest(AnalysisKind defaultKind) {
        AnalysisKind analysisKind = defaultKind;
        if (kind != null) {
            analysisKind = AnalysisKind.fromName(kind)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown kind: " + kind));
        }
        if (analysisKind == null) {
            throw new IllegalArgumentException("Missing 'kind' field");
        }
        if (texts == null) {
            throw new IllegalArgumentException("Missing 'texts' field");
        }
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("'timeout_ms' must be positive");
        }

        return AnalysisRequest.builder()
                .requestId(requestId)
                .kind(analysisKind)
                .texts(texts)
                .timeout(timeoutMs != null ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }
}
