package fr.lapetina.feedback.orchestrator.orchestration;

import java.util.List;
import java.util.Objects;

/**
 * Contiguous slice of the inputs still to analyze.
 *
 * @param number          position of the batch in its plan, starting at 0
 * @param originalIndices index in the request of each text, used to scatter results back
 */
public record Batch(int number, List<Integer> originalIndices, List<String> texts) {

    public Batch {
        Objects.requireNonNull(originalIndices, "Original indices are required");
        Objects.requireNonNull(texts, "Texts are required");
        if (originalIndices.size() != texts.size()) {
            throw new IllegalArgumentException(
                    "Index count " + originalIndices.size() + " does not match text count " + texts.size());
        }
        originalIndices = List.copyOf(originalIndices);
        texts = List.copyOf(texts);
    }

    public int size() {
        return texts.size();
    }
}
