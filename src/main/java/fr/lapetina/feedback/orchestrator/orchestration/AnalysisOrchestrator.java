package fr.lapetina.feedback.orchestrator.orchestration;

import fr.lapetina.feedback.orchestrator.domain.analysis.InsightAggregator;
import fr.lapetina.feedback.orchestrator.domain.analysis.LocalAnalysisException;
import fr.lapetina.feedback.orchestrator.domain.analysis.LocalAnalyzer;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisOutcome;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisRequest;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;
import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import fr.lapetina.feedback.orchestrator.domain.model.ProgressEvent;
import fr.lapetina.feedback.orchestrator.domain.model.ServiceStatus;
import fr.lapetina.feedback.orchestrator.domain.parsing.ParseResult;
import fr.lapetina.feedback.orchestrator.domain.parsing.ResponseParser;
import fr.lapetina.feedback.orchestrator.domain.parsing.ResultDecoder;
import fr.lapetina.feedback.orchestrator.infrastructure.cache.ResultCache;
import fr.lapetina.feedback.orchestrator.infrastructure.http.AdaptiveThrottle;
import fr.lapetina.feedback.orchestrator.infrastructure.http.CircuitBreaker;
import fr.lapetina.feedback.orchestrator.infrastructure.http.PromptFactory;
import fr.lapetina.feedback.orchestrator.infrastructure.http.QuotaExceededException;
import fr.lapetina.feedback.orchestrator.infrastructure.http.RemoteCallException;
import fr.lapetina.feedback.orchestrator.infrastructure.http.RemoteInferenceClient;
import fr.lapetina.feedback.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for feedback analysis.
 *
 * For every request:
 * 1. Inputs already in the result cache are answered from it.
 * 2. Misses go to the local analyzer when the kind is sentiment, the remote service is not
 *    configured, the circuit breaker is open or a quota cooldown is in effect.
 * 3. Otherwise misses are split into remote batches. Each batch waits on the throttle, calls the
 *    remote service and decodes the reply. Any failure feeds the breaker and the throttle and the
 *    batch is analyzed locally instead.
 * 4. Results are scattered back by original index, so the output always matches input order.
 *
 * Batches run on a fixed worker pool; remote calls are additionally bounded by a semaphore.
 * When the request deadline expires, batches still outstanding are analyzed locally in the
 * calling thread. They are not cancelled and may still populate the cache when they finish.
 *
 * Callers never see remote or parse failures. Only a failure of the local analyzer itself,
 * which leaves no analysis path, surfaces as {@link LocalAnalysisException}.
 */
public final class AnalysisOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final RemoteInferenceClient remoteClient;
    private final ResultCache cache;
    private final CircuitBreaker circuitBreaker;
    private final AdaptiveThrottle throttle;
    private final BatchPlanner batchPlanner;
    private final ResponseParser responseParser;
    private final LocalAnalyzer localAnalyzer;
    private final InsightAggregator insightAggregator;
    private final PromptFactory promptFactory;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService workers;
    private final Semaphore remoteSlots;
    private final Duration remoteCallTimeout;
    private final Duration defaultDeadline;
    private final int quotaFailureWeight;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private AnalysisOrchestrator(Builder builder) {
        this.remoteClient = Objects.requireNonNull(builder.remoteClient, "Remote client is required");
        this.cache = Objects.requireNonNull(builder.cache, "Result cache is required");
        this.circuitBreaker = Objects.requireNonNull(builder.circuitBreaker, "Circuit breaker is required");
        this.throttle = Objects.requireNonNull(builder.throttle, "Throttle is required");
        this.metricsRegistry = Objects.requireNonNull(builder.metricsRegistry, "Metrics registry is required");
        this.batchPlanner = builder.batchPlanner;
        this.responseParser = builder.responseParser;
        this.localAnalyzer = builder.localAnalyzer;
        this.insightAggregator = builder.insightAggregator;
        this.promptFactory = builder.promptFactory;
        this.remoteCallTimeout = builder.remoteCallTimeout;
        this.defaultDeadline = builder.defaultDeadline;
        this.quotaFailureWeight = builder.quotaFailureWeight;
        this.remoteSlots = new Semaphore(builder.maxConcurrentRemoteCalls, true);
        this.workers = Executors.newFixedThreadPool(builder.workerThreads, new WorkerThreadFactory("orchestrator-worker"));

        registerGauges();

        log.info("AnalysisOrchestrator created: workers={}, maxConcurrentRemoteCalls={}, remoteCallTimeoutMs={}, "
                        + "defaultDeadlineMs={}, remoteAvailable={}",
                builder.workerThreads, builder.maxConcurrentRemoteCalls, remoteCallTimeout.toMillis(),
                defaultDeadline.toMillis(), remoteClient.isAvailable());
    }

    /**
     * Analyzes every text of the request.
     *
     * @return one result per input, in input order
     * @throws LocalAnalysisException if the local analyzer fails
     * @throws IllegalStateException  if the orchestrator has been closed
     */
    public List<AnalysisResult> submit(AnalysisRequest request) {
        return analyze(request).results();
    }

    /**
     * Same as {@link #submit(AnalysisRequest)}, also reporting whether this request fell back
     * to local analysis.
     */
    public AnalysisOutcome analyze(AnalysisRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (!running.get()) {
            throw new IllegalStateException("Orchestrator is closed");
        }

        MDC.put("requestId", request.requestId());
        MDC.put("kind", request.kind().wireName());
        try {
            return process(request);
        } finally {
            MDC.remove("requestId");
            MDC.remove("kind");
        }
    }

    /**
     * Extracts insights from every text and merges them into a single report.
     */
    public InsightResult extractInsights(List<String> texts) {
        return extractInsights(texts, null);
    }

    /**
     * Extracts insights with an explicit deadline, {@code null} for the default one.
     */
    public InsightResult extractInsights(List<String> texts, Duration timeout) {
        AnalysisRequest request = AnalysisRequest.builder()
                .kind(AnalysisKind.INSIGHT)
                .texts(texts)
                .timeout(timeout)
                .build();
        List<InsightResult> insights = new ArrayList<>(texts.size());
        for (AnalysisResult result : submit(request)) {
            insights.add((InsightResult) result);
        }
        return insightAggregator.aggregate(insights);
    }

    /**
     * Read-only snapshot for health and monitoring displays.
     */
    public ServiceStatus status() {
        boolean circuitOpen = circuitBreaker.isOpen();
        Duration remaining = circuitBreaker.remainingOpenTime();
        long resetInSeconds = (remaining.toMillis() + 999) / 1000;
        return new ServiceStatus(
                remoteClient.isAvailable(),
                circuitOpen,
                throttle.isRateLimited(),
                circuitOpen ? resetInSeconds : 0,
                throttle.getMinInterval().toMillis(),
                cache.stats(),
                metricsRegistry.snapshot()
        );
    }

    private AnalysisOutcome process(AnalysisRequest request) {
        AnalysisKind kind = request.kind();
        AtomicInteger fallbackItems = new AtomicInteger();
        List<String> texts = request.texts();
        long deadlineNanos = System.nanoTime() + request.deadline().orElse(defaultDeadline).toNanos();
        AnalysisResult[] results = new AnalysisResult[texts.size()];

        List<Integer> missIndices = new ArrayList<>();
        List<String> missTexts = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            AnalysisResult cached = cache.get(text, kind).orElse(null);
            metricsRegistry.recordCacheLookup(kind, cached != null);
            if (cached != null) {
                results[i] = cached;
            } else {
                missIndices.add(i);
                missTexts.add(text);
            }
        }

        ErrorType bypassReason = kind == AnalysisKind.SENTIMENT ? null : remoteBypassReason();
        boolean remote = kind != AnalysisKind.SENTIMENT && bypassReason == null;
        List<Batch> batches = batchPlanner.plan(missTexts, missIndices,
                remote ? BatchPlanner.Target.REMOTE : BatchPlanner.Target.LOCAL);

        log.info("Analysis request received: items={}, cacheHits={}, route={}, reason={}, batches={}",
                texts.size(), texts.size() - missTexts.size(), remote ? "remote" : "local",
                bypassReason != null ? bypassReason : "-", batches.size());

        ProgressTracker progress = new ProgressTracker(request, batches.size(), texts.size() - missTexts.size());
        if (batches.isEmpty()) {
            progress.emitCurrent();
            return outcome(kind, results, 0);
        }

        Map<String, String> context = MDC.getCopyOfContextMap();
        List<Future<List<AnalysisResult>>> futures = new ArrayList<>(batches.size());
        for (Batch batch : batches) {
            Callable<List<AnalysisResult>> task = remote
                    ? () -> runRemote(kind, batch, deadlineNanos, fallbackItems)
                    : () -> runLocal(kind, batch, bypassReason, fallbackItems);
            futures.add(workers.submit(withContext(context, () -> {
                List<AnalysisResult> batchResults = task.call();
                progress.batchDone(batch);
                return batchResults;
            })));
        }

        for (int b = 0; b < batches.size(); b++) {
            Batch batch = batches.get(b);
            scatter(results, batch, await(kind, batch, futures.get(b), deadlineNanos, fallbackItems));
            progress.batchDone(batch);
        }
        return outcome(kind, results, fallbackItems.get());
    }

    private static AnalysisOutcome outcome(AnalysisKind kind, AnalysisResult[] results, int fallbackItems) {
        boolean local = fallbackItems > 0 || (kind == AnalysisKind.SENTIMENT && results.length > 0);
        return new AnalysisOutcome(List.of(results), fallbackItems, local);
    }

    private List<AnalysisResult> await(AnalysisKind kind, Batch batch, Future<List<AnalysisResult>> future,
                                       long deadlineNanos, AtomicInteger fallbackItems) {
        try {
            long remaining = deadlineNanos - System.nanoTime();
            return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Request deadline exceeded, analyzing batch locally: batch={}, items={}",
                    batch.number(), batch.size());
            return runLocal(kind, batch, ErrorType.DEADLINE_EXCEEDED, fallbackItems);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for batch, analyzing locally: batch={}", batch.number());
            return runLocal(kind, batch, ErrorType.INTERNAL_ERROR, fallbackItems);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LocalAnalysisException) {
                throw (LocalAnalysisException) cause;
            }
            log.error("Batch failed unexpectedly, analyzing locally: batch={}", batch.number(), cause);
            return runLocal(kind, batch, ErrorType.INTERNAL_ERROR, fallbackItems);
        }
    }

    private ErrorType remoteBypassReason() {
        if (!remoteClient.isAvailable()) {
            return ErrorType.UNAVAILABLE;
        }
        if (circuitBreaker.isOpen()) {
            return ErrorType.CIRCUIT_OPEN;
        }
        if (throttle.isRateLimited()) {
            return ErrorType.RATE_LIMITED;
        }
        return null;
    }

    private List<AnalysisResult> runRemote(AnalysisKind kind, Batch batch, long deadlineNanos,
                                           AtomicInteger fallbackItems) {
        // Admission is re-checked per batch: an earlier batch may have opened the circuit.
        ErrorType bypassReason = remoteBypassReason();
        if (bypassReason != null) {
            return skipRemote(kind, batch, bypassReason, fallbackItems);
        }

        try {
            remoteSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return runLocal(kind, batch, ErrorType.INTERNAL_ERROR, fallbackItems);
        }
        try {
            // Checked again once admitted: another batch may have failed while this one waited.
            bypassReason = remoteBypassReason();
            if (bypassReason != null) {
                return skipRemote(kind, batch, bypassReason, fallbackItems);
            }
            if (System.nanoTime() - deadlineNanos >= 0) {
                return runLocal(kind, batch, ErrorType.DEADLINE_EXCEEDED, fallbackItems);
            }
            throttle.waitIfNeeded();
            bypassReason = remoteBypassReason();
            if (bypassReason != null) {
                return skipRemote(kind, batch, bypassReason, fallbackItems);
            }
            return callRemote(kind, batch, fallbackItems);
        } finally {
            remoteSlots.release();
        }
    }

    private List<AnalysisResult> skipRemote(AnalysisKind kind, Batch batch, ErrorType reason,
                                            AtomicInteger fallbackItems) {
        log.info("Remote call skipped, analyzing batch locally: batch={}, reason={}", batch.number(), reason);
        return runLocal(kind, batch, reason, fallbackItems);
    }

    private List<AnalysisResult> callRemote(AnalysisKind kind, Batch batch, AtomicInteger fallbackItems) {
        String prompt = promptFactory.build(kind, batch.texts());
        log.debug("Dispatching remote batch: batch={}, items={}, model={}",
                batch.number(), batch.size(), remoteClient.getModelName());

        long start = System.nanoTime();
        String raw;
        try {
            raw = awaitReply(remoteClient.generate(prompt));
        } catch (RemoteCallException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            return remoteFailed(kind, batch, e.getErrorType(), e instanceof QuotaExceededException,
                    e.getMessage(), latency, fallbackItems);
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - start);

        ParseResult<List<AnalysisResult>> decoded =
                ResultDecoder.parseAndDecode(responseParser, raw, kind, batch.size());
        if (decoded.isFailure()) {
            log.warn("Remote reply could not be decoded: batch={}, error={}, raw={}",
                    batch.number(), decoded.error().message(), decoded.error().rawPreview());
            return remoteFailed(kind, batch, ErrorType.PARSE_ERROR, false, decoded.error().message(), latency,
                    fallbackItems);
        }

        circuitBreaker.recordSuccess();
        throttle.adjust(AdaptiveThrottle.Outcome.SUCCESS);
        metricsRegistry.recordRemoteCall(kind, MetricsRegistry.OUTCOME_SUCCESS, latency);

        List<AnalysisResult> results = decoded.value();
        for (int i = 0; i < batch.size(); i++) {
            cache.put(batch.texts().get(i), results.get(i), kind);
        }
        log.info("Remote batch completed: batch={}, items={}, strategy={}, latencyMs={}",
                batch.number(), batch.size(), decoded.strategy(), latency.toMillis());
        return results;
    }

    private String awaitReply(CompletableFuture<String> reply) {
        try {
            return reply.get(remoteCallTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reply.cancel(true);
            throw new RemoteCallException(ErrorType.TIMEOUT, -1,
                    "No reply within " + remoteCallTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reply.cancel(true);
            throw new RemoteCallException(ErrorType.INTERNAL_ERROR, -1, "Interrupted while waiting for reply", e);
        } catch (ExecutionException e) {
            throw RemoteCallException.classify(e);
        }
    }

    private List<AnalysisResult> remoteFailed(AnalysisKind kind, Batch batch, ErrorType errorType, boolean quota,
                                              String message, Duration latency, AtomicInteger fallbackItems) {
        circuitBreaker.recordFailure(quota ? quotaFailureWeight : 1);
        throttle.adjust(quota ? AdaptiveThrottle.Outcome.QUOTA_EXCEEDED : AdaptiveThrottle.Outcome.FAILURE);
        metricsRegistry.recordRemoteFailure(kind, errorType, latency);

        log.warn("Remote batch failed, analyzing locally: batch={}, items={}, errorType={}, error={}, "
                        + "consecutiveFailures={}, latencyMs={}",
                batch.number(), batch.size(), errorType, message, circuitBreaker.getFailureCount(),
                latency.toMillis());
        return runLocal(kind, batch, errorType, fallbackItems);
    }

    /**
     * Analyzes a batch without the remote service.
     *
     * @param reason why the remote service was not used, {@code null} when local is the normal route
     * @param fallbackItems per-request count of inputs analyzed locally for a non-null reason
     */
    private List<AnalysisResult> runLocal(AnalysisKind kind, Batch batch, ErrorType reason,
                                          AtomicInteger fallbackItems) {
        List<AnalysisResult> results = new ArrayList<>(batch.size());
        try {
            for (String text : batch.texts()) {
                results.add(localAnalyzer.fallback(kind, text, reason));
            }
        } catch (RuntimeException e) {
            log.error("Local analysis failed, no analysis path left: batch={}, items={}",
                    batch.number(), batch.size(), e);
            throw new LocalAnalysisException("Local analysis failed for batch " + batch.number(), e);
        }

        if (reason != null) {
            fallbackItems.addAndGet(batch.size());
            metricsRegistry.recordFallback(kind, reason, batch.size());
        }
        // Degraded results are not cached so a later remote result can replace them.
        if (kind == AnalysisKind.SENTIMENT) {
            for (int i = 0; i < batch.size(); i++) {
                cache.put(batch.texts().get(i), results.get(i), kind);
            }
        }
        log.debug("Local batch completed: batch={}, items={}", batch.number(), batch.size());
        return results;
    }

    private static void scatter(AnalysisResult[] target, Batch batch, List<AnalysisResult> batchResults) {
        List<Integer> indices = batch.originalIndices();
        for (int i = 0; i < indices.size(); i++) {
            target[indices.get(i)] = batchResults.get(i);
        }
    }

    private static <T> Callable<T> withContext(Map<String, String> context, Callable<T> task) {
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private void registerGauges() {
        metricsRegistry.registerGauge("circuit_open", "Circuit breaker state (1=OPEN, 0=CLOSED)",
                () -> circuitBreaker.getState() == CircuitBreaker.State.OPEN ? 1 : 0);
        metricsRegistry.registerGauge("throttle_interval_ms", "Current minimum interval between remote calls",
                () -> throttle.getMinInterval().toMillis());
        metricsRegistry.registerGauge("rate_limited", "Quota cooldown in effect (1=yes, 0=no)",
                () -> throttle.isRateLimited() ? 1 : 0);
        for (AnalysisKind kind : AnalysisKind.values()) {
            metricsRegistry.registerGauge("cache_size", "Entries per cache partition",
                    () -> cache.size(kind), "partition", kind.wireName());
        }
    }

    /**
     * Stops the worker pool. Requests already running are allowed to finish.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down AnalysisOrchestrator...");
            workers.shutdown();
            try {
                if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("AnalysisOrchestrator shutdown timed out, interrupting workers...");
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
            log.info("AnalysisOrchestrator shut down");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Emits one progress event per batch, the first time the batch is settled either by its
     * worker or by the deadline fallback.
     */
    private static final class ProgressTracker {
        private final AnalysisRequest request;
        private final int batchesTotal;
        private final Set<Integer> settled = ConcurrentHashMap.newKeySet();
        private final AtomicInteger itemsProcessed;

        ProgressTracker(AnalysisRequest request, int batchesTotal, int itemsFromCache) {
            this.request = request;
            this.batchesTotal = batchesTotal;
            this.itemsProcessed = new AtomicInteger(itemsFromCache);
        }

        void batchDone(Batch batch) {
            if (settled.add(batch.number())) {
                int items = itemsProcessed.addAndGet(batch.size());
                emit(settled.size(), items);
            }
        }

        void emitCurrent() {
            emit(settled.size(), itemsProcessed.get());
        }

        private void emit(int batchesDone, int items) {
            try {
                request.progressListener().onProgress(new ProgressEvent(
                        request.requestId(), batchesDone, batchesTotal, items, request.size()));
            } catch (RuntimeException e) {
                log.warn("Progress listener failed: requestId={}", request.requestId(), e);
            }
        }
    }

    /**
     * Thread factory for batch worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Builder for AnalysisOrchestrator.
     */
    public static final class Builder {
        private RemoteInferenceClient remoteClient;
        private ResultCache cache;
        private CircuitBreaker circuitBreaker;
        private AdaptiveThrottle throttle;
        private MetricsRegistry metricsRegistry;
        private BatchPlanner batchPlanner = new BatchPlanner();
        private ResponseParser responseParser = new ResponseParser();
        private LocalAnalyzer localAnalyzer = new LocalAnalyzer();
        private InsightAggregator insightAggregator = new InsightAggregator();
        private PromptFactory promptFactory = new PromptFactory();
        private int workerThreads = Runtime.getRuntime().availableProcessors();
        private int maxConcurrentRemoteCalls = 2;
        private Duration remoteCallTimeout = Duration.ofSeconds(30);
        private Duration defaultDeadline = Duration.ofSeconds(60);
        private int quotaFailureWeight = 2;

        public Builder remoteClient(RemoteInferenceClient remoteClient) {
            this.remoteClient = remoteClient;
            return this;
        }

        public Builder cache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder throttle(AdaptiveThrottle throttle) {
            this.throttle = throttle;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder batchPlanner(BatchPlanner batchPlanner) {
            this.batchPlanner = batchPlanner;
            return this;
        }

        public Builder responseParser(ResponseParser responseParser) {
            this.responseParser = responseParser;
            return this;
        }

        public Builder localAnalyzer(LocalAnalyzer localAnalyzer) {
            this.localAnalyzer = localAnalyzer;
            return this;
        }

        public Builder insightAggregator(InsightAggregator insightAggregator) {
            this.insightAggregator = insightAggregator;
            return this;
        }

        public Builder promptFactory(PromptFactory promptFactory) {
            this.promptFactory = promptFactory;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) {
                throw new IllegalArgumentException("Worker threads must be positive");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder maxConcurrentRemoteCalls(int maxConcurrentRemoteCalls) {
            if (maxConcurrentRemoteCalls <= 0) {
                throw new IllegalArgumentException("Max concurrent remote calls must be positive");
            }
            this.maxConcurrentRemoteCalls = maxConcurrentRemoteCalls;
            return this;
        }

        public Builder remoteCallTimeout(Duration remoteCallTimeout) {
            this.remoteCallTimeout = remoteCallTimeout;
            return this;
        }

        public Builder defaultDeadline(Duration defaultDeadline) {
            this.defaultDeadline = defaultDeadline;
            return this;
        }

        public Builder quotaFailureWeight(int quotaFailureWeight) {
            this.quotaFailureWeight = quotaFailureWeight;
            return this;
        }

        public AnalysisOrchestrator build() {
            return new AnalysisOrchestrator(this);
        }
    }
}
