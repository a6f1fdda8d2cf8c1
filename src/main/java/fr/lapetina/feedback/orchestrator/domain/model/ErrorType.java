package fr.lapetina.feedback.orchestrator.domain.model;

/**
 * Error taxonomy for remote analysis attempts.
 * Used to tag metrics and logs; none of these reach callers of the orchestrator.
 */
public enum ErrorType {
    /** Connection refused, reset, DNS failure and other I/O problems */
    NETWORK_ERROR,

    /** Non-2xx status other than a quota rejection */
    HTTP_ERROR,

    /** Remote call did not complete within the configured timeout */
    TIMEOUT,

    /** Quota or rate limit rejection (HTTP 429, "quota", "rate") */
    QUOTA_EXCEEDED,

    /** Reply could not be turned into structured records */
    PARSE_ERROR,

    /** Circuit breaker is open, remote call skipped */
    CIRCUIT_OPEN,

    /** Quota cooldown in effect, remote call skipped */
    RATE_LIMITED,

    /** Remote service not configured */
    UNAVAILABLE,

    /** Request deadline expired before the batch completed */
    DEADLINE_EXCEEDED,

    /** Unexpected failure */
    INTERNAL_ERROR
}
