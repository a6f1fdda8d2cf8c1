/**
 * Domain model of the orchestrator.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.feedback.orchestrator.domain.model.AnalysisRequest} - Immutable ordered input texts plus kind</li>
 *   <li>{@link fr.lapetina.feedback.orchestrator.domain.model.SentimentResult} - Score, label and confidence for one text</li>
 *   <li>{@link fr.lapetina.feedback.orchestrator.domain.model.InsightResult} - Summary and insight lists for one text</li>
 *   <li>{@link fr.lapetina.feedback.orchestrator.domain.model.ServiceStatus} - Monitoring snapshot</li>
 *   <li>{@link fr.lapetina.feedback.orchestrator.domain.model.ErrorType} - Remote failure categories</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type in this package is an immutable record or enum and may be shared freely
 * between worker threads and the result cache.
 */
package fr.lapetina.feedback.orchestrator.domain.model;
