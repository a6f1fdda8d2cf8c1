package fr.lapetina.feedback.orchestrator.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered feedback texts to analyze with a single kind.
 * Immutable and thread-safe.
 *
 * @param timeout optional deadline for the whole request; when null the configured default applies
 */
public record AnalysisRequest(
        String requestId,
        AnalysisKind kind,
        List<String> texts,
        ProgressListener progressListener,
        Duration timeout
) {
    public AnalysisRequest {
        Objects.requireNonNull(kind, "Kind is required");
        Objects.requireNonNull(texts, "Texts are required");
        for (int i = 0; i < texts.size(); i++) {
            if (texts.get(i) == null) {
                throw new IllegalArgumentException("Text at index " + i + " is null");
            }
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (progressListener == null) {
            progressListener = ProgressListener.NOOP;
        }
        texts = List.copyOf(texts);
    }

    public static AnalysisRequest of(AnalysisKind kind, List<String> texts) {
        return new AnalysisRequest(null, kind, texts, null, null);
    }

    public int size() {
        return texts.size();
    }

    public Optional<Duration> deadline() {
        return Optional.ofNullable(timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private AnalysisKind kind;
        private List<String> texts;
        private ProgressListener progressListener;
        private Duration timeout;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder kind(AnalysisKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder texts(List<String> texts) {
            this.texts = texts;
            return this;
        }

        public Builder progressListener(ProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public AnalysisRequest build() {
            return new AnalysisRequest(requestId, kind, texts, progressListener, timeout);
        }
    }
}
