/**
 * Feedback Orchestrator - Resilient gateway between feedback analysis and a rate-limited remote model.
 *
 * <p>Every analysis request is answered in full and in input order. Results come from the
 * cache, the remote model (Gemini), or a deterministic local analyzer when the remote
 * service is unconfigured, failing, or over quota.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.feedback.orchestrator.OrchestratorFactory} - Main entry point for creating
 *       a fully-configured orchestrator from YAML configuration</li>
 *   <li>{@link fr.lapetina.feedback.orchestrator.FeedbackOrchestratorApplication} - Standalone HTTP server
 *       exposing analysis, insights and status</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("orchestrator.yaml")) {
 *     AnalysisOrchestrator orchestrator = factory.getOrchestrator();
 *
 *     List<AnalysisResult> results = orchestrator.submit(
 *             AnalysisRequest.of(AnalysisKind.SENTIMENT, List.of("great app", "crashes constantly")));
 *     ServiceStatus status = orchestrator.status();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Circuit breaker and adaptive throttle in front of the remote model</li>
 *   <li>Per-kind LRU result cache</li>
 *   <li>Size-adaptive batching with bounded worker and remote concurrency</li>
 *   <li>Lenient parsing of model replies with silent local fallback</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.feedback.orchestrator.OrchestratorFactory
 * @see fr.lapetina.feedback.orchestrator.orchestration.AnalysisOrchestrator
 */
package fr.lapetina.feedback.orchestrator;
