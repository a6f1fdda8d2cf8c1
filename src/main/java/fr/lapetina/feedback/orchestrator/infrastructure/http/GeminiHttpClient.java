package fr.lapetina.feedback.orchestrator.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the Gemini {@code generateContent} endpoint.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Failures complete the returned
 * future with a {@link RemoteCallException}; HTTP 429, {@code RESOURCE_EXHAUSTED} and
 * quota or rate wording map to {@link QuotaExceededException}.
 */
public class GeminiHttpClient implements RemoteInferenceClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiHttpClient.class);

    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;
    private final double temperature;

    public GeminiHttpClient(
            String baseUrl,
            String model,
            String apiKey,
            Duration connectTimeout,
            Duration requestTimeout,
            double temperature
    ) {
        this.model = model;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.temperature = temperature;
        this.endpoint = buildUri(baseUrl, model);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        if (!isAvailable()) {
            log.warn("Remote analysis not available: no API key configured for model {}", model);
        } else {
            log.info("Gemini client initialized: model={}, endpoint={}", model, endpoint);
        }
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getModelName() {
        return model;
    }

    @Override
    public CompletableFuture<String> generate(String prompt) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(
                    new RemoteCallException(ErrorType.UNAVAILABLE, "Remote analysis is not configured"));
        }

        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(prompt);
        } catch (JsonProcessingException e) {
            log.error("Failed to build request: model={}", model, e);
            return CompletableFuture.failedFuture(
                    new RemoteCallException(ErrorType.INTERNAL_ERROR, -1, "Failed to build request", e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: model={}, promptChars={}", model, prompt.length());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        RemoteCallException failure = RemoteCallException.classify(ex);
                        log.warn("Remote call failed: model={}, errorType={}, error={}",
                                model, failure.getErrorType(), failure.getMessage());
                        throw failure;
                    }
                    return handleResponse(response, startTime);
                });
    }

    private HttpRequest buildHttpRequest(String prompt) throws JsonProcessingException {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", prompt))
                )),
                "generationConfig", Map.of("temperature", temperature)
        );

        return HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header(API_KEY_HEADER, apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
    }

    private static URI buildUri(String baseUrl, String model) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(base + "/models/" + model + ":generateContent");
    }

    private String handleResponse(HttpResponse<String> response, Instant startTime) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            String message = extractErrorMessage(response.body(), statusCode);
            log.warn("Remote call failed with HTTP error: model={}, status={}, latencyMs={}, error={}",
                    model, statusCode, latencyMs, message);
            if (RemoteCallException.isQuotaSignal(statusCode, message)) {
                throw new QuotaExceededException(statusCode, message, null);
            }
            throw new RemoteCallException(ErrorType.HTTP_ERROR, statusCode, message, null);
        }

        String text = extractText(response.body());
        log.debug("Remote call successful: model={}, status={}, latencyMs={}, replyChars={}",
                model, statusCode, latencyMs, text.length());
        return text;
    }

    private String extractText(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteCallException(ErrorType.PARSE_ERROR, 200, "Malformed response envelope", e);
        }

        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("");
            throw new RemoteCallException(ErrorType.HTTP_ERROR, 200,
                    blockReason.isEmpty() ? "Response contained no candidates" : "Prompt blocked: " + blockReason,
                    null);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        if (text.length() == 0) {
            throw new RemoteCallException(ErrorType.HTTP_ERROR, 200, "Response contained no text", null);
        }
        return text.toString();
    }

    private String extractErrorMessage(String body, int statusCode) {
        String errorMessage = "HTTP " + statusCode;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            String status = error.path("status").asText("");
            String message = error.path("message").asText("");
            if (!message.isEmpty()) {
                errorMessage = status.isEmpty() ? message : status + ": " + message;
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Error body is not JSON: status={}", statusCode);
        }
        return errorMessage;
    }

    @Override
    public void close() {
        // HttpClient doesn't need explicit closing in Java 17
    }
}
