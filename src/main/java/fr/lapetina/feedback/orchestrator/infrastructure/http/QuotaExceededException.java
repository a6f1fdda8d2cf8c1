package fr.lapetina.feedback.orchestrator.infrastructure.http;

import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;

/**
 * The remote service rejected the call because a quota or rate limit was exceeded.
 * Counts more heavily toward opening the circuit and triggers a throttle cooldown.
 */
public final class QuotaExceededException extends RemoteCallException {

    public QuotaExceededException(int statusCode, String message, Throwable cause) {
        super(ErrorType.QUOTA_EXCEEDED, statusCode, message, cause);
    }

    public QuotaExceededException(String message) {
        this(429, message, null);
    }
}
