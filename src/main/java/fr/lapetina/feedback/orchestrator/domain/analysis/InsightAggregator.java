package fr.lapetina.feedback.orchestrator.domain.analysis;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Combines per-review insight results into a single report.
 *
 * Summaries are joined, each list is de-duplicated keeping first occurrences and capped,
 * and empty lists receive a filler item. When every list comes back empty, hints are
 * derived from the combined summary.
 */
public final class InsightAggregator {

    private static final Logger log = LoggerFactory.getLogger(InsightAggregator.class);

    public static final int MAX_ITEMS = 10;
    private static final int HINT_LENGTH = 100;

    public InsightResult aggregate(List<InsightResult> results) {
        List<InsightResult> usable = results.stream().filter(r -> !r.degraded()).toList();
        if (usable.isEmpty()) {
            String summary = results.isEmpty() ? "No feedback to analyze" : results.get(0).summary();
            return InsightResult.degraded(AnalysisKind.INSIGHT, summary);
        }

        String summary = combineSummaries(usable);
        List<String> keyPoints = merge(usable, InsightResult::keyPoints);
        List<String> painPoints = merge(usable, InsightResult::painPoints);
        List<String> featureRequests = merge(usable, InsightResult::featureRequests);
        List<String> positiveAspects = merge(usable, InsightResult::positiveAspects);

        log.debug("Aggregated insights: reviews={}, keyPoints={}, painPoints={}, featureRequests={}, positiveAspects={}",
                usable.size(), keyPoints.size(), painPoints.size(), featureRequests.size(), positiveAspects.size());

        if (keyPoints.isEmpty() && painPoints.isEmpty() && featureRequests.isEmpty() && positiveAspects.isEmpty()) {
            log.warn("All insight lists are empty, deriving hints from summary");
            String lower = summary.toLowerCase(Locale.ROOT);
            String excerpt = summary.length() <= HINT_LENGTH ? summary : summary.substring(0, HINT_LENGTH);
            keyPoints = List.of("No specific key points identified. Please review the summary.");
            if (lower.contains("issue") || lower.contains("problem")) {
                painPoints = List.of("Issues mentioned in summary: " + excerpt);
            }
            if (lower.contains("request") || lower.contains("would like")) {
                featureRequests = List.of("Potential requests mentioned in summary: " + excerpt);
            }
            if (lower.contains("good") || lower.contains("great") || lower.contains("like")) {
                positiveAspects = List.of("Positive aspects mentioned in summary: " + excerpt);
            }
        }

        return new InsightResult(
                AnalysisKind.INSIGHT,
                summary,
                orDefault(keyPoints, "No key points identified"),
                orDefault(painPoints, "No specific pain points identified"),
                orDefault(featureRequests, "No specific feature requests identified"),
                orDefault(positiveAspects, "No specific positive aspects identified"),
                false
        );
    }

    private static String combineSummaries(List<InsightResult> results) {
        Set<String> summaries = new LinkedHashSet<>();
        for (InsightResult result : results) {
            String summary = result.summary().trim();
            if (!summary.isEmpty()) {
                summaries.add(summary);
            }
        }
        return summaries.isEmpty() ? "No summary available" : String.join(" ", summaries);
    }

    private static List<String> merge(List<InsightResult> results, Function<InsightResult, List<String>> field) {
        Set<String> merged = new LinkedHashSet<>();
        for (InsightResult result : results) {
            for (String item : field.apply(result)) {
                merged.add(item);
                if (merged.size() == MAX_ITEMS) {
                    return new ArrayList<>(merged);
                }
            }
        }
        return new ArrayList<>(merged);
    }

    private static List<String> orDefault(List<String> items, String filler) {
        return items.isEmpty() ? List.of(filler) : items;
    }
}
