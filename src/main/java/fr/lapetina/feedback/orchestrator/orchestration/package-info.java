/**
 * Request orchestration.
 *
 * <h2>Flow</h2>
 * <pre>
 * AnalysisRequest
 *   -&gt; cache lookup (per input)
 *   -&gt; route: local (sentiment, unavailable, circuit open, rate limited) or remote
 *   -&gt; BatchPlanner (size by average text length)
 *   -&gt; worker pool: throttle -&gt; remote call -&gt; parse/decode, or local analysis
 *   -&gt; scatter by original index
 * </pre>
 *
 * <h2>Concurrency</h2>
 * <p>Batches of one request run in parallel on a fixed pool. Remote calls are bounded by a
 * semaphore and paced by the throttle. Circuit breaker, throttle, cache and metrics are the
 * only state shared between batches and guard their own mutations.
 *
 * @see fr.lapetina.feedback.orchestrator.orchestration.AnalysisOrchestrator
 * @see fr.lapetina.feedback.orchestrator.orchestration.BatchPlanner
 */
package fr.lapetina.feedback.orchestrator.orchestration;
