package fr.lapetina.feedback.orchestrator.infrastructure.http;

import java.util.concurrent.CompletableFuture;

/**
 * Remote text-analysis service taking a prompt and returning the model's raw text reply.
 *
 * Implementations complete the future exceptionally with a {@link RemoteCallException}
 * (or {@link QuotaExceededException}) when the call fails.
 */
public interface RemoteInferenceClient extends AutoCloseable {

    CompletableFuture<String> generate(String prompt);

    /**
     * False when the service is not configured, for instance without credentials.
     */
    boolean isAvailable();

    String getModelName();

    @Override
    default void close() {
    }
}
