package fr.lapetina.feedback.orchestrator.orchestration;

import fr.lapetina.feedback.orchestrator.MutableClock;
import fr.lapetina.feedback.orchestrator.StubRemoteClient;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisOutcome;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisRequest;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;
import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import fr.lapetina.feedback.orchestrator.domain.model.ProgressEvent;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentLabel;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentResult;
import fr.lapetina.feedback.orchestrator.domain.model.ServiceStatus;
import fr.lapetina.feedback.orchestrator.infrastructure.cache.ResultCache;
import fr.lapetina.feedback.orchestrator.infrastructure.http.AdaptiveThrottle;
import fr.lapetina.feedback.orchestrator.infrastructure.http.CircuitBreaker;
import fr.lapetina.feedback.orchestrator.infrastructure.http.QuotaExceededException;
import fr.lapetina.feedback.orchestrator.infrastructure.http.RemoteCallException;
import fr.lapetina.feedback.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisOrchestratorTest {

    private MutableClock clock;
    private StubRemoteClient remote;
    private ResultCache cache;
    private CircuitBreaker breaker;
    private AdaptiveThrottle throttle;
    private MetricsRegistry metrics;
    private AnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        remote = new StubRemoteClient();
        cache = new ResultCache(100);
        breaker = new CircuitBreaker("test", 3, Duration.ofMinutes(2), clock);
        throttle = AdaptiveThrottle.builder()
                .clock(clock)
                .sleeper(duration -> { })
                .build();
        metrics = new MetricsRegistry("test", false);
        orchestrator = AnalysisOrchestrator.builder()
                .remoteClient(remote)
                .cache(cache)
                .circuitBreaker(breaker)
                .throttle(throttle)
                .metricsRegistry(metrics)
                .workerThreads(4)
                .maxConcurrentRemoteCalls(2)
                .remoteCallTimeout(Duration.ofSeconds(1))
                .defaultDeadline(Duration.ofSeconds(10))
                .build();
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        metrics.close();
    }

    private static List<String> reviews(int count) {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            texts.add("review " + i);
        }
        return texts;
    }

    private List<AnalysisResult> submit(AnalysisKind kind, List<String> texts) {
        return orchestrator.submit(AnalysisRequest.of(kind, texts));
    }

    private static List<String> summaries(List<AnalysisResult> results) {
        List<String> summaries = new ArrayList<>();
        for (AnalysisResult result : results) {
            summaries.add(((InsightResult) result).summary());
        }
        return summaries;
    }

    @Nested
    @DisplayName("Remote route")
    class RemoteRoute {

        @Test
        @DisplayName("should return remote results in input order")
        void shouldReturnRemoteResultsInOrder() {
            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(3));

            assertThat(summaries(results)).containsExactly("Remote: review 0", "Remote: review 1", "Remote: review 2");
            assertThat(remote.getCallCount()).isEqualTo(1);
            assertThat(results).allSatisfy(r -> assertThat(((InsightResult) r).degraded()).isFalse());
        }

        @Test
        @DisplayName("should keep order across several concurrent batches")
        void shouldKeepOrderAcrossBatches() {
            List<String> texts = reviews(45);

            List<AnalysisResult> results = submit(AnalysisKind.SUMMARY, texts);

            assertThat(remote.getCallCount()).isEqualTo(3);
            assertThat(results).hasSize(45);
            for (int i = 0; i < texts.size(); i++) {
                InsightResult result = (InsightResult) results.get(i);
                assertThat(result.kind()).isEqualTo(AnalysisKind.SUMMARY);
                assertThat(result.summary()).isEqualTo("Remote: review " + i);
            }
        }

        @Test
        @DisplayName("should answer repeated inputs from the cache")
        void shouldAnswerFromCache() {
            List<AnalysisResult> first = submit(AnalysisKind.INSIGHT, reviews(3));
            long hitsBefore = cache.stats().hits();

            List<AnalysisResult> second = submit(AnalysisKind.INSIGHT, reviews(3));

            assertThat(second).isEqualTo(first);
            assertThat(remote.getCallCount()).isEqualTo(1);
            assertThat(cache.stats().hits()).isEqualTo(hitsBefore + 3);
        }

        @Test
        @DisplayName("should only send cache misses and merge them with hits")
        void shouldMergeHitsAndMisses() {
            InsightResult cached = new InsightResult(AnalysisKind.INSIGHT, "cached", List.of("c"), null, null, null, false);
            cache.put("review 1", cached, AnalysisKind.INSIGHT);

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(3));

            assertThat(results.get(1)).isSameAs(cached);
            assertThat(summaries(results)).containsExactly("Remote: review 0", "cached", "Remote: review 2");
            assertThat(StubRemoteClient.reviews(remote.getPrompts().get(0))).containsExactly("review 0", "review 2");
        }

        @Test
        @DisplayName("should shrink the throttle interval and reset the breaker on success")
        void shouldRecordSuccess() {
            breaker.recordFailure();
            throttle.adjust(AdaptiveThrottle.Outcome.FAILURE);

            submit(AnalysisKind.INSIGHT, reviews(2));

            assertThat(breaker.getFailureCount()).isZero();
            assertThat(throttle.getMinInterval()).isEqualTo(Duration.ofMillis(135));
            assertThat(metrics.snapshot().totalCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("should propagate the logging context to workers")
        void shouldPropagateLoggingContext() {
            List<String> seen = new CopyOnWriteArrayList<>();
            remote.setResponder(prompt -> {
                seen.add(MDC.get("requestId") + "/" + MDC.get("kind"));
                return StubRemoteClient.echoInsights(prompt);
            });

            orchestrator.submit(AnalysisRequest.builder()
                    .requestId("req-42")
                    .kind(AnalysisKind.INSIGHT)
                    .texts(reviews(2))
                    .build());

            assertThat(seen).containsExactly("req-42/insight");
            assertThat(MDC.get("requestId")).isNull();
        }
    }

    @Nested
    @DisplayName("Local route")
    class LocalRoute {

        @Test
        @DisplayName("should analyze sentiment locally without calling the remote service")
        void shouldAnalyzeSentimentLocally() {
            List<String> texts = List.of("great app", "crashes constantly", "meh, ok");

            List<AnalysisResult> results = submit(AnalysisKind.SENTIMENT, texts);

            assertThat(results).extracting(r -> ((SentimentResult) r).label())
                    .containsExactly(SentimentLabel.POSITIVE, SentimentLabel.NEGATIVE, SentimentLabel.NEUTRAL);
            assertThat(remote.getCallCount()).isZero();
            assertThat(cache.stats().misses()).isEqualTo(3);

            List<AnalysisResult> again = submit(AnalysisKind.SENTIMENT, texts);

            assertThat(again).isEqualTo(results);
            assertThat(cache.stats().hits()).isEqualTo(3);
            assertThat(metrics.snapshot().fallbacks()).isZero();
        }

        @Test
        @DisplayName("should produce the same sentiment without remote credentials")
        void shouldAnalyzeSentimentWithoutCredentials() {
            remote.setAvailable(false);

            List<AnalysisResult> results = submit(AnalysisKind.SENTIMENT, List.of("great app", "crashes constantly", "meh, ok"));

            assertThat(results).extracting(r -> ((SentimentResult) r).label())
                    .containsExactly(SentimentLabel.POSITIVE, SentimentLabel.NEGATIVE, SentimentLabel.NEUTRAL);
            assertThat(orchestrator.status().usingLocalProcessing()).isTrue();
        }

        @Test
        @DisplayName("should degrade insights when the remote service is not configured")
        void shouldDegradeWhenUnavailable() {
            remote.setAvailable(false);

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(2));

            assertThat(remote.getCallCount()).isZero();
            assertThat(results).allSatisfy(r -> {
                InsightResult insight = (InsightResult) r;
                assertThat(insight.degraded()).isTrue();
                assertThat(insight.summary()).contains("not configured");
            });
            assertThat(cache.size(AnalysisKind.INSIGHT)).isZero();
            assertThat(metrics.snapshot().fallbacks()).isEqualTo(2);
        }

        @Test
        @DisplayName("should bypass the remote service while the circuit is open")
        void shouldBypassWhenCircuitOpen() {
            breaker.forceState(CircuitBreaker.State.OPEN);

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(50));

            assertThat(results).hasSize(50);
            assertThat(remote.getCallCount()).isZero();
            assertThat(summaries(results)).allMatch(s -> s.contains("API reliability issues"));
        }

        @Test
        @DisplayName("should handle empty input")
        void shouldHandleEmptyInput() {
            assertThat(submit(AnalysisKind.INSIGHT, List.of())).isEmpty();
            assertThat(remote.getCallCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fall back locally when the remote call fails")
        void shouldFallBackOnRemoteFailure() {
            remote.failWith(new RemoteCallException(ErrorType.HTTP_ERROR, 500, "HTTP 500", null));

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(3));

            assertThat(summaries(results)).containsOnly("Remote analysis failed. Using local processing.");
            assertThat(breaker.getFailureCount()).isEqualTo(1);
            assertThat(throttle.getMinInterval()).isEqualTo(Duration.ofMillis(150));
            assertThat(metrics.snapshot().fallbacks()).isEqualTo(3);
            assertThat(metrics.scrape()).contains("outcome=\"http_error\"");
        }

        @Test
        @DisplayName("should report the fallback in the outcome of the request")
        void shouldReportFallbackInOutcome() {
            remote.failWith(new RemoteCallException(ErrorType.HTTP_ERROR, 503, "HTTP 503", null));

            AnalysisOutcome failed = orchestrator.analyze(AnalysisRequest.of(AnalysisKind.INSIGHT, reviews(3)));

            assertThat(failed.localProcessing()).isTrue();
            assertThat(failed.fallbackItems()).isEqualTo(3);
            assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

            remote.echo();
            AnalysisOutcome recovered = orchestrator.analyze(AnalysisRequest.of(AnalysisKind.INSIGHT, List.of("fresh")));

            assertThat(recovered.localProcessing()).isFalse();
            assertThat(recovered.fallbackItems()).isZero();
        }

        @Test
        @DisplayName("should not call the remote for batches queued behind the failure that opened the circuit")
        void shouldStopQueuedBatchesOnceCircuitOpens() {
            CircuitBreaker strictBreaker = new CircuitBreaker("strict", 1, Duration.ofMinutes(2), clock);
            remote.setResponder(prompt -> {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return CompletableFuture.failedFuture(
                        new RemoteCallException(ErrorType.HTTP_ERROR, 503, "HTTP 503", null));
            });

            try (MetricsRegistry strictMetrics = new MetricsRegistry("strict", false);
                 AnalysisOrchestrator single = AnalysisOrchestrator.builder()
                    .remoteClient(remote)
                    .cache(new ResultCache(100))
                    .circuitBreaker(strictBreaker)
                    .throttle(throttle)
                    .metricsRegistry(strictMetrics)
                    .workerThreads(4)
                    .maxConcurrentRemoteCalls(1)
                    .remoteCallTimeout(Duration.ofSeconds(1))
                    .defaultDeadline(Duration.ofSeconds(10))
                    .build()) {

                AnalysisOutcome outcome = single.analyze(AnalysisRequest.of(AnalysisKind.INSIGHT, reviews(80)));

                assertThat(remote.getCallCount()).isEqualTo(1);
                assertThat(strictBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
                assertThat(strictBreaker.getFailureCount()).isEqualTo(1);
                assertThat(outcome.results()).hasSize(80)
                        .allSatisfy(r -> assertThat(((InsightResult) r).degraded()).isTrue());
                assertThat(outcome.fallbackItems()).isEqualTo(80);
            }
        }

        @Test
        @DisplayName("should treat an undecodable reply as a failure")
        void shouldFallBackOnParseFailure() {
            remote.replyWith("I am unable to analyze these reviews.");

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(2));

            assertThat(results).allSatisfy(r -> assertThat(((InsightResult) r).degraded()).isTrue());
            assertThat(breaker.getFailureCount()).isEqualTo(1);
            assertThat(metrics.scrape()).contains("outcome=\"parse_error\"");
        }

        @Test
        @DisplayName("should treat a record count mismatch as a failure")
        void shouldFallBackOnCountMismatch() {
            remote.replyWith("[{\"summary\": \"only one\"}]");

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, reviews(2));

            assertThat(results).allSatisfy(r -> assertThat(((InsightResult) r).degraded()).isTrue());
            assertThat(cache.size(AnalysisKind.INSIGHT)).isZero();
        }

        @Test
        @DisplayName("should open the circuit after repeated failures and stop calling")
        void shouldOpenCircuit() {
            remote.failWith(new RemoteCallException(ErrorType.NETWORK_ERROR, "Connection refused"));

            for (int i = 0; i < 3; i++) {
                submit(AnalysisKind.INSIGHT, List.of("text " + i));
            }
            assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

            submit(AnalysisKind.INSIGHT, List.of("text 3"));
            assertThat(remote.getCallCount()).isEqualTo(3);

            clock.advance(Duration.ofMinutes(2));
            remote.echo();
            List<AnalysisResult> recovered = submit(AnalysisKind.INSIGHT, List.of("text 4"));

            assertThat(summaries(recovered)).containsExactly("Remote: text 4");
            assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("should weigh quota rejections and cool down")
        void shouldHandleQuotaRejection() {
            remote.failWith(new QuotaExceededException("RESOURCE_EXHAUSTED: quota exceeded"));

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, List.of("first"));

            assertThat(breaker.getFailureCount()).isEqualTo(2);
            assertThat(throttle.isRateLimited()).isTrue();
            assertThat(throttle.getMinInterval()).isEqualTo(Duration.ofMillis(225));
            assertThat(summaries(results)).allMatch(s -> s.startsWith("Rate limit exceeded"));

            remote.echo();
            submit(AnalysisKind.INSIGHT, List.of("second"));
            assertThat(remote.getCallCount()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(5));
            List<AnalysisResult> resumed = submit(AnalysisKind.INSIGHT, List.of("third"));
            assertThat(summaries(resumed)).containsExactly("Remote: third");
            assertThat(remote.getCallCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fall back locally when the request deadline expires")
        void shouldFallBackOnDeadline() {
            CompletableFuture<String> pending = new CompletableFuture<>();
            remote.setResponder(prompt -> pending);

            long start = System.nanoTime();
            List<AnalysisResult> results = orchestrator.submit(AnalysisRequest.builder()
                    .kind(AnalysisKind.INSIGHT)
                    .texts(List.of("slow one"))
                    .timeout(Duration.ofMillis(200))
                    .build());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(elapsed).isLessThan(Duration.ofSeconds(1));
            assertThat(summaries(results)).containsExactly("Remote analysis timed out. Using local processing.");

            // the abandoned batch still completes and fills the cache
            pending.complete("[{\"summary\": \"late answer\"}]");
            waitForCacheSize(AnalysisKind.INSIGHT, 1);
            assertThat(cache.get("slow one", AnalysisKind.INSIGHT))
                    .hasValueSatisfying(r -> assertThat(((InsightResult) r).summary()).isEqualTo("late answer"));
        }

        @Test
        @DisplayName("should time out a remote call that never answers")
        void shouldTimeOutRemoteCall() {
            remote.setResponder(prompt -> new CompletableFuture<>());

            List<AnalysisResult> results = submit(AnalysisKind.INSIGHT, List.of("stuck"));

            assertThat(summaries(results)).containsExactly("Remote analysis timed out. Using local processing.");
            assertThat(breaker.getFailureCount()).isEqualTo(1);
            assertThat(metrics.scrape()).contains("outcome=\"timeout\"");
        }

        private void waitForCacheSize(AnalysisKind kind, int expected) {
            long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
            while (cache.size(kind) < expected && System.nanoTime() < deadline) {
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    @Nested
    @DisplayName("Progress and status")
    class ProgressAndStatus {

        @Test
        @DisplayName("should emit one progress event per batch")
        void shouldEmitProgressPerBatch() {
            List<ProgressEvent> events = new CopyOnWriteArrayList<>();

            orchestrator.submit(AnalysisRequest.builder()
                    .kind(AnalysisKind.INSIGHT)
                    .texts(reviews(45))
                    .progressListener(events::add)
                    .build());

            assertThat(events).hasSize(3);
            assertThat(events).allSatisfy(e -> assertThat(e.batchesTotal()).isEqualTo(3));
            assertThat(events).anySatisfy(e -> {
                assertThat(e.isComplete()).isTrue();
                assertThat(e.itemsProcessed()).isEqualTo(45);
            });
        }

        @Test
        @DisplayName("should emit a completed event when everything was cached")
        void shouldEmitCompletedEventForCacheHits() {
            submit(AnalysisKind.SENTIMENT, List.of("great app"));
            List<ProgressEvent> events = new ArrayList<>();

            orchestrator.submit(AnalysisRequest.builder()
                    .kind(AnalysisKind.SENTIMENT)
                    .texts(List.of("great app"))
                    .progressListener(events::add)
                    .build());

            assertThat(events).singleElement().satisfies(e -> {
                assertThat(e.batchesTotal()).isZero();
                assertThat(e.itemsProcessed()).isEqualTo(1);
                assertThat(e.isComplete()).isTrue();
            });
        }

        @Test
        @DisplayName("should survive a failing progress listener")
        void shouldSurviveFailingListener() {
            List<AnalysisResult> results = orchestrator.submit(AnalysisRequest.builder()
                    .kind(AnalysisKind.SENTIMENT)
                    .texts(List.of("good"))
                    .progressListener(e -> {
                        throw new IllegalStateException("listener broken");
                    })
                    .build());

            assertThat(results).hasSize(1);
        }

        @Test
        @DisplayName("should report the time until the circuit closes")
        void shouldReportCircuitReset() {
            assertThat(orchestrator.status().circuitResetInSeconds()).isZero();

            breaker.recordFailure(3);
            clock.advance(Duration.ofMillis(30_500));
            ServiceStatus open = orchestrator.status();

            assertThat(open.circuitOpen()).isTrue();
            assertThat(open.circuitResetInSeconds()).isEqualTo(90);
            assertThat(open.usingLocalProcessing()).isTrue();

            clock.advance(Duration.ofSeconds(90));
            ServiceStatus closed = orchestrator.status();

            assertThat(closed.circuitOpen()).isFalse();
            assertThat(closed.circuitResetInSeconds()).isZero();
        }

        @Test
        @DisplayName("should expose cache and performance figures")
        void shouldExposeFigures() {
            submit(AnalysisKind.INSIGHT, reviews(2));
            submit(AnalysisKind.INSIGHT, reviews(2));

            ServiceStatus status = orchestrator.status();

            assertThat(status.available()).isTrue();
            assertThat(status.throttleIntervalMs()).isEqualTo(100);
            assertThat(status.cacheStats().size(AnalysisKind.INSIGHT)).isEqualTo(2);
            assertThat(status.performanceMetrics().cacheHits()).isEqualTo(2);
            assertThat(status.performanceMetrics().totalCalls()).isEqualTo(1);
            assertThat(metrics.scrape()).contains("test_cache_size{partition=\"insight\"");
        }
    }

    @Nested
    @DisplayName("Insights")
    class Insights {

        @Test
        @DisplayName("should merge per-review insights into one report")
        void shouldMergeInsights() {
            InsightResult report = orchestrator.extractInsights(List.of("fast sync", "dark mode please"));

            assertThat(report.degraded()).isFalse();
            assertThat(report.summary()).isEqualTo("Remote: fast sync Remote: dark mode please");
            assertThat(report.keyPoints()).containsExactly("fast sync", "dark mode please");
        }

        @Test
        @DisplayName("should return a degraded report without remote analysis")
        void shouldDegradeReport() {
            remote.setAvailable(false);

            InsightResult report = orchestrator.extractInsights(List.of("a", "b"), Duration.ofSeconds(5));

            assertThat(report.degraded()).isTrue();
            assertThat(report.summary()).contains("not configured");
        }
    }

    @Test
    @DisplayName("should reject requests once closed")
    void shouldRejectAfterClose() {
        orchestrator.close();

        assertThatThrownBy(() -> submit(AnalysisKind.SENTIMENT, List.of("a")))
                .isInstanceOf(IllegalStateException.class);
    }
}
