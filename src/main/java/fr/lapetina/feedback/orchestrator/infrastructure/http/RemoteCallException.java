package fr.lapetina.feedback.orchestrator.infrastructure.http;

import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * A remote analysis call failed: network error, timeout or non-2xx status.
 */
public class RemoteCallException extends RuntimeException {

    private static final Pattern QUOTA_SIGNAL = Pattern.compile(
            "\\b429\\b|quota|resource_exhausted|\\brate[ _-]?limit|\\brate\\b",
            Pattern.CASE_INSENSITIVE);

    private final ErrorType errorType;
    private final int statusCode;

    public RemoteCallException(ErrorType errorType, String message) {
        this(errorType, -1, message, null);
    }

    public RemoteCallException(ErrorType errorType, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.statusCode = statusCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * HTTP status of the failed call, -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * True when a status code or message identifies a quota or rate limit rejection.
     */
    public static boolean isQuotaSignal(int statusCode, String message) {
        return statusCode == 429 || (message != null && QUOTA_SIGNAL.matcher(message).find());
    }

    /**
     * Maps any failure of a remote call attempt onto the remote error taxonomy.
     */
    public static RemoteCallException classify(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof RemoteCallException) {
            return (RemoteCallException) cause;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (isQuotaSignal(-1, message)) {
            return new QuotaExceededException(-1, message, cause);
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return new RemoteCallException(ErrorType.TIMEOUT, -1, message, cause);
        }
        if (cause instanceof IOException) {
            return new RemoteCallException(ErrorType.NETWORK_ERROR, -1, message, cause);
        }
        return new RemoteCallException(ErrorType.INTERNAL_ERROR, -1, message, cause);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
