package fr.lapetina.feedback.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.feedback.orchestrator.api.dto.AnalyzeRequest;
import fr.lapetina.feedback.orchestrator.api.dto.AnalyzeResponse;
import fr.lapetina.feedback.orchestrator.domain.analysis.LocalAnalysisException;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisOutcome;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisRequest;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import fr.lapetina.feedback.orchestrator.domain.model.ServiceStatus;
import fr.lapetina.feedback.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.feedback.orchestrator.orchestration.AnalysisOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/analyze - Analyze texts, one result per text in input order
 * - POST /api/insights - Merged insight report over all texts
 * - GET /api/status - Orchestrator status snapshot
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final AnalysisOrchestrator orchestrator;
    private final MetricsRegistry metricsRegistry;
    private final boolean metricsEnabled;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            AnalysisOrchestrator orchestrator,
            MetricsRegistry metricsRegistry,
            boolean metricsEnabled
    ) throws IOException {
        this.orchestrator = orchestrator;
        this.metricsRegistry = metricsRegistry;
        this.metricsEnabled = metricsEnabled;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        this.executor = Executors.newFixedThreadPool(threads, new HandlerThreadFactory("http-handler"));
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/api/analyze", new AnalyzeHandler());
        server.createContext("/api/insights", new InsightsHandler());
        server.createContext("/api/status", new StatusHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        log.info("HTTP server stopped");
    }

    // ==================== ANALYZE HANDLER ====================

    private class AnalyzeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                if (!allowMethod(exchange, "POST")) {
                    return;
                }

                AnalysisRequest request;
                try {
                    request = readRequest(exchange, requestId, null);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    sendError(exchange, 400, "Invalid request: " + e.getMessage());
                    return;
                }
                MDC.put("requestId", request.requestId());

                long start = System.nanoTime();
                AnalysisOutcome outcome = orchestrator.analyze(request);
                long durationMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

                sendJson(exchange, 200, AnalyzeResponse.from(request, outcome.results(),
                        outcome.localProcessing(), durationMs));

            } catch (LocalAnalysisException e) {
                log.error("No analysis path available", e);
                sendError(exchange, 503, "Analysis unavailable: " + e.getMessage());
            } catch (Exception e) {
                log.error("Error handling analyze request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== INSIGHTS HANDLER ====================

    private class InsightsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                if (!allowMethod(exchange, "POST")) {
                    return;
                }

                AnalysisRequest request;
                try {
                    request = readRequest(exchange, requestId, AnalysisKind.INSIGHT);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    sendError(exchange, 400, "Invalid request: " + e.getMessage());
                    return;
                }
                if (request.kind() != AnalysisKind.INSIGHT) {
                    sendError(exchange, 400, "Insights endpoint only accepts kind 'insight'");
                    return;
                }

                InsightResult report = orchestrator.extractInsights(request.texts(), request.timeout());
                sendJson(exchange, 200, report);

            } catch (LocalAnalysisException e) {
                log.error("No analysis path available", e);
                sendError(exchange, 503, "Analysis unavailable: " + e.getMessage());
            } catch (Exception e) {
                log.error("Error handling insights request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }
    }

    // ==================== STATUS HANDLER ====================

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!allowMethod(exchange, "GET")) {
                return;
            }
            sendJson(exchange, 200, orchestrator.status());
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!allowMethod(exchange, "GET")) {
                return;
            }

            ServiceStatus status = orchestrator.status();
            Map<String, Object> health = new LinkedHashMap<>();
            // The local path always answers, so a process serving requests is never DOWN.
            health.put("status", status.usingLocalProcessing() ? "DEGRADED" : "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("remoteAvailable", status.available());
            health.put("circuitOpen", status.circuitOpen());
            health.put("rateLimited", status.rateLimited());
            if (status.circuitOpen()) {
                health.put("circuitResetInSeconds", status.circuitResetInSeconds());
            }
            if (status.usingLocalProcessing()) {
                health.put("message", degradedMessage(status));
            }
            sendJson(exchange, 200, health);
        }

        private String degradedMessage(ServiceStatus status) {
            if (!status.available()) {
                return "Remote analysis not configured. Using local processing.";
            }
            if (status.circuitOpen()) {
                return "Using local processing due to API reliability issues";
            }
            return "Rate limit exceeded. Using local processing temporarily.";
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!allowMethod(exchange, "GET")) {
                return;
            }
            if (!metricsEnabled) {
                sendError(exchange, 404, "Metrics disabled");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private boolean allowMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        sendError(exchange, 405, "Method " + exchange.getRequestMethod() + " not allowed");
        return false;
    }

    private AnalysisRequest readRequest(HttpExchange exchange, String requestId, AnalysisKind defaultKind)
            throws IOException {
        AnalyzeRequest apiRequest;
        try (InputStream is = exchange.getRequestBody()) {
            apiRequest = objectMapper.readValue(is, AnalyzeRequest.class);
        }
        if (apiRequest == null) {
            throw new IllegalArgumentException("Empty body");
        }
        if (apiRequest.getRequestId() == null) {
            apiRequest.setRequestId(requestId);
        }
        return apiRequest.toAnalysisRequest(defaultKind);
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message);
        sendJson(exchange, statusCode, error);
    }

    /**
     * Thread factory for request handler threads.
     */
    private static class HandlerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        HandlerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
