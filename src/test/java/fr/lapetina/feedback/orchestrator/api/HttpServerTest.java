package fr.lapetina.feedback.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.feedback.orchestrator.MutableClock;
import fr.lapetina.feedback.orchestrator.StubRemoteClient;
import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;
import fr.lapetina.feedback.orchestrator.infrastructure.cache.ResultCache;
import fr.lapetina.feedback.orchestrator.infrastructure.http.AdaptiveThrottle;
import fr.lapetina.feedback.orchestrator.infrastructure.http.CircuitBreaker;
import fr.lapetina.feedback.orchestrator.infrastructure.http.RemoteCallException;
import fr.lapetina.feedback.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.feedback.orchestrator.orchestration.AnalysisOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    private StubRemoteClient remote;
    private CircuitBreaker breaker;
    private MetricsRegistry metrics;
    private AnalysisOrchestrator orchestrator;
    private HttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        MutableClock clock = new MutableClock();
        remote = new StubRemoteClient();
        breaker = new CircuitBreaker("test", 3, Duration.ofMinutes(2), clock);
        metrics = new MetricsRegistry("test_http", false);
        orchestrator = AnalysisOrchestrator.builder()
                .remoteClient(remote)
                .cache(new ResultCache(100))
                .circuitBreaker(breaker)
                .throttle(AdaptiveThrottle.builder().clock(clock).sleeper(d -> { }).build())
                .metricsRegistry(metrics)
                .workerThreads(2)
                .remoteCallTimeout(Duration.ofSeconds(1))
                .build();
        server = new HttpServer("127.0.0.1", 0, 10, 2, orchestrator, metrics, true);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        orchestrator.close();
        metrics.close();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(Duration.ofSeconds(10))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().timeout(Duration.ofSeconds(10)).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    @Nested
    @DisplayName("POST /api/analyze")
    class Analyze {

        @Test
        @DisplayName("should return one sentiment result per text")
        void shouldAnalyzeSentiment() throws Exception {
            HttpResponse<String> response = post("/api/analyze",
                    "{\"kind\": \"sentiment\", \"texts\": [\"great app\", \"crashes constantly\"], \"request_id\": \"req-1\"}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("request_id").asText()).isEqualTo("req-1");
            assertThat(body.get("kind").asText()).isEqualTo("sentiment");
            assertThat(body.get("count").asInt()).isEqualTo(2);
            assertThat(body.get("local_processing").asBoolean()).isTrue();
            assertThat(body.get("results").get(0).get("label").asText()).isEqualTo("POSITIVE");
            assertThat(body.get("results").get(1).get("label").asText()).isEqualTo("NEGATIVE");
        }

        @Test
        @DisplayName("should return remote insight results")
        void shouldAnalyzeInsights() throws Exception {
            HttpResponse<String> response = post("/api/analyze",
                    "{\"kind\": \"insight\", \"texts\": [\"needs offline mode\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("local_processing").asBoolean()).isFalse();
            assertThat(body.get("request_id").asText()).isNotBlank();
            JsonNode result = body.get("results").get(0);
            assertThat(result.get("summary").asText()).isEqualTo("Remote: needs offline mode");
            assertThat(result.get("key_points").get(0).asText()).isEqualTo("needs offline mode");
        }

        @Test
        @DisplayName("should flag local processing when a remote batch fell back below the breaker threshold")
        void shouldFlagFallbackOfThisRequest() throws Exception {
            remote.failWith(new RemoteCallException(ErrorType.HTTP_ERROR, 503, "HTTP 503", null));

            HttpResponse<String> response = post("/api/analyze",
                    "{\"kind\": \"insight\", \"texts\": [\"needs offline mode\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("results").get(0).get("degraded").asBoolean()).isTrue();
            assertThat(body.get("local_processing").asBoolean()).isTrue();
            assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("should reject unknown kinds, missing texts and malformed bodies")
        void shouldRejectInvalidRequests() throws Exception {
            HttpResponse<String> unknownKind = post("/api/analyze", "{\"kind\": \"translation\", \"texts\": []}");
            HttpResponse<String> missingTexts = post("/api/analyze", "{\"kind\": \"sentiment\"}");
            HttpResponse<String> malformed = post("/api/analyze", "{\"kind\": ");
            HttpResponse<String> badTimeout = post("/api/analyze",
                    "{\"kind\": \"sentiment\", \"texts\": [\"a\"], \"timeout_ms\": 0}");

            assertThat(unknownKind.statusCode()).isEqualTo(400);
            assertThat(mapper.readTree(unknownKind.body()).get("error").asText()).contains("Unknown kind");
            assertThat(missingTexts.statusCode()).isEqualTo(400);
            assertThat(malformed.statusCode()).isEqualTo(400);
            assertThat(badTimeout.statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should only accept POST")
        void shouldRejectGet() throws Exception {
            assertThat(get("/api/analyze").statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("POST /api/insights")
    class Insights {

        @Test
        @DisplayName("should return a merged report")
        void shouldReturnReport() throws Exception {
            HttpResponse<String> response = post("/api/insights", "{\"texts\": [\"slow sync\", \"nice widgets\"]}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("degraded").asBoolean()).isFalse();
            assertThat(body.get("key_points")).hasSize(2);
            assertThat(body.get("summary").asText()).isEqualTo("Remote: slow sync Remote: nice widgets");
        }

        @Test
        @DisplayName("should reject other kinds")
        void shouldRejectOtherKinds() throws Exception {
            HttpResponse<String> response = post("/api/insights", "{\"kind\": \"sentiment\", \"texts\": [\"a\"]}");

            assertThat(response.statusCode()).isEqualTo(400);
        }
    }

    @Nested
    @DisplayName("Monitoring endpoints")
    class Monitoring {

        @Test
        @DisplayName("should report status")
        void shouldReportStatus() throws Exception {
            HttpResponse<String> response = get("/api/status");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.get("available").asBoolean()).isTrue();
            assertThat(body.get("circuitOpen").asBoolean()).isFalse();
            assertThat(body.get("throttleIntervalMs").asLong()).isEqualTo(100);
            assertThat(body.has("cacheStats")).isTrue();
            assertThat(body.has("performanceMetrics")).isTrue();
        }

        @Test
        @DisplayName("should report UP, then DEGRADED while the circuit is open")
        void shouldReportHealth() throws Exception {
            JsonNode up = mapper.readTree(get("/health").body());
            assertThat(up.get("status").asText()).isEqualTo("UP");
            assertThat(up.has("message")).isFalse();

            breaker.forceState(CircuitBreaker.State.OPEN);
            HttpResponse<String> response = get("/health");
            JsonNode degraded = mapper.readTree(response.body());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(degraded.get("status").asText()).isEqualTo("DEGRADED");
            assertThat(degraded.get("circuitOpen").asBoolean()).isTrue();
            assertThat(degraded.get("circuitResetInSeconds").asLong()).isEqualTo(120);
            assertThat(degraded.get("message").asText()).contains("API reliability issues");
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            post("/api/analyze", "{\"kind\": \"summary\", \"texts\": [\"ok\"]}");

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                    type -> assertThat(type).startsWith("text/plain"));
            assertThat(response.body()).contains("test_http_remote_calls_total").contains("test_http_circuit_open");
        }
    }
}
