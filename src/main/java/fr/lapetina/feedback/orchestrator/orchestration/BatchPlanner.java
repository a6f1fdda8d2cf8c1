package fr.lapetina.feedback.orchestrator.orchestration;

import fr.lapetina.feedback.orchestrator.infrastructure.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Splits inputs into contiguous batches sized by average text length.
 *
 * Longer texts get smaller batches. Remote calls use small batches to keep each prompt
 * within model limits; local analysis uses large ones. Stateless and thread-safe.
 */
public final class BatchPlanner {

    private static final Logger log = LoggerFactory.getLogger(BatchPlanner.class);

    public enum Target {
        REMOTE,
        LOCAL
    }

    private final List<Integer> lengthThresholds;
    private final List<Integer> remoteSizes;
    private final List<Integer> localSizes;

    public BatchPlanner(List<Integer> lengthThresholds, List<Integer> remoteSizes, List<Integer> localSizes) {
        if (remoteSizes.size() != lengthThresholds.size() + 1 || localSizes.size() != lengthThresholds.size() + 1) {
            throw new IllegalArgumentException("Expected one batch size per length bucket: thresholds="
                    + lengthThresholds + ", remote=" + remoteSizes + ", local=" + localSizes);
        }
        this.lengthThresholds = List.copyOf(lengthThresholds);
        this.remoteSizes = List.copyOf(remoteSizes);
        this.localSizes = List.copyOf(localSizes);
    }

    public BatchPlanner(OrchestratorConfig.BatchingConfig config) {
        this(config.getLengthThresholds(), config.getRemoteBatchSizes(), config.getLocalBatchSizes());
    }

    public BatchPlanner() {
        this(new OrchestratorConfig.BatchingConfig());
    }

    /**
     * Plans batches over all inputs, indices 0 to n-1.
     */
    public List<Batch> plan(List<String> texts, Target target) {
        return plan(texts, IntStream.range(0, texts.size()).boxed().toList(), target);
    }

    /**
     * Plans batches over a subset of a request.
     *
     * @param originalIndices position in the request of each text
     */
    public List<Batch> plan(List<String> texts, List<Integer> originalIndices, Target target) {
        if (texts.size() != originalIndices.size()) {
            throw new IllegalArgumentException("Texts and indices differ in size");
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        int batchSize = batchSize(averageLength(texts), target);
        List<Batch> batches = new ArrayList<>((texts.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < texts.size(); start += batchSize) {
            int end = Math.min(start + batchSize, texts.size());
            batches.add(new Batch(batches.size(), originalIndices.subList(start, end), texts.subList(start, end)));
        }

        log.debug("Planned batches: target={}, items={}, batchSize={}, batches={}",
                target, texts.size(), batchSize, batches.size());
        return batches;
    }

    /**
     * Batch size for the given average text length.
     */
    public int batchSize(double averageLength, Target target) {
        List<Integer> sizes = target == Target.REMOTE ? remoteSizes : localSizes;
        for (int i = 0; i < lengthThresholds.size(); i++) {
            if (averageLength < lengthThresholds.get(i)) {
                return sizes.get(i);
            }
        }
        return sizes.get(sizes.size() - 1);
    }

    static double averageLength(List<String> texts) {
        long total = 0;
        for (String text : texts) {
            total += text.length();
        }
        return (double) total / texts.size();
    }
}
