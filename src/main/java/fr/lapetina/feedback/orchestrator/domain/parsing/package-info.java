/**
 * Defensive parsing of semi-structured model replies.
 *
 * <p>{@link fr.lapetina.feedback.orchestrator.domain.parsing.ResponseParser} extracts a JSON tree through
 * an ordered fallback chain; {@link fr.lapetina.feedback.orchestrator.domain.parsing.ResultDecoder} turns
 * that tree into typed per-item results. Both report failure as a
 * {@link fr.lapetina.feedback.orchestrator.domain.parsing.ParseResult} value instead of throwing.
 */
package fr.lapetina.feedback.orchestrator.domain.parsing;
