package fr.lapetina.feedback.orchestrator.domain.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentLabel;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes a parsed reply into one typed result per batch item.
 *
 * The reply must be an array with exactly one element per item, in item order.
 * An object wrapping such an array under a common key ("results", "reviews", "items",
 * "analyses") is unwrapped; a bare object is accepted for a single-item batch.
 */
public final class ResultDecoder {

    private static final List<String> WRAPPER_KEYS = List.of("results", "reviews", "items", "analyses");

    static final String MISSING_SUMMARY = "No summary available";

    /**
     * Convenience entry point chaining parsing and decoding.
     */
    public static ParseResult<List<AnalysisResult>> parseAndDecode(
            ResponseParser parser,
            String raw,
            AnalysisKind kind,
            int expectedCount
    ) {
        return parser.parse(raw).flatMap(node -> new ResultDecoder().decode(raw, node, kind, expectedCount));
    }

    public ParseResult<List<AnalysisResult>> decode(String raw, JsonNode node, AnalysisKind kind, int expectedCount) {
        JsonNode elements = unwrap(node, expectedCount);
        if (elements == null) {
            return ParseResult.failure(raw, "Expected a JSON array of " + expectedCount + " records");
        }
        if (elements.size() != expectedCount) {
            return ParseResult.failure(raw,
                    "Expected " + expectedCount + " records, got " + elements.size());
        }

        List<AnalysisResult> results = new ArrayList<>(expectedCount);
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            Optional<? extends AnalysisResult> decoded = kind == AnalysisKind.SENTIMENT
                    ? decodeSentiment(element)
                    : decodeInsight(element, kind);
            if (decoded.isEmpty()) {
                return ParseResult.failure(raw, "Record " + i + " is not a valid " + kind.wireName() + " result");
            }
            results.add(decoded.get());
        }
        return ParseResult.success(List.copyOf(results), null);
    }

    private JsonNode unwrap(JsonNode node, int expectedCount) {
        if (node.isArray()) {
            return node;
        }
        if (node.isObject()) {
            for (String key : WRAPPER_KEYS) {
                JsonNode inner = node.get(key);
                if (inner != null && inner.isArray()) {
                    return inner;
                }
            }
            if (expectedCount == 1) {
                return ((ObjectNode) node).arrayNode().add(node);
            }
        }
        return null;
    }

    Optional<SentimentResult> decodeSentiment(JsonNode element) {
        if (element == null || !element.isObject()) {
            return Optional.empty();
        }
        Optional<Double> score = number(element, "score", "sentiment_score");
        Optional<SentimentLabel> label = text(element, "label", "sentiment_label").flatMap(SentimentLabel::parse);

        if (score.isEmpty() && label.isEmpty()) {
            return Optional.empty();
        }

        double normalized = score.map(ResultDecoder::normalizeScore)
                .orElseGet(() -> defaultScore(label.get()));
        SentimentLabel resolved = label.orElseGet(() -> SentimentLabel.fromScore(normalized));
        double confidence = number(element, "confidence")
                .map(ResultDecoder::clamp)
                .orElseGet(() -> Math.abs(normalized * 2.0 - 1.0));

        return Optional.of(new SentimentResult(normalized, resolved, confidence));
    }

    Optional<InsightResult> decodeInsight(JsonNode element, AnalysisKind kind) {
        if (element == null) {
            return Optional.empty();
        }
        if (element.isTextual()) {
            return Optional.of(new InsightResult(kind, element.asText(), null, null, null, null, false));
        }
        if (!element.isObject()) {
            return Optional.empty();
        }
        String summary = text(element, "summary").filter(s -> !s.isBlank()).orElse(MISSING_SUMMARY);
        return Optional.of(new InsightResult(
                kind,
                summary,
                strings(element, "key_points", "keyPoints"),
                strings(element, "pain_points", "painPoints"),
                strings(element, "feature_requests", "featureRequests"),
                strings(element, "positive_aspects", "positiveAspects"),
                false
        ));
    }

    /**
     * Scores outside [0, 1] but within [-1, 0) are read as compound scores.
     */
    private static double normalizeScore(double raw) {
        if (raw < 0.0 && raw >= -1.0) {
            return (raw + 1.0) / 2.0;
        }
        return clamp(raw);
    }

    private static double defaultScore(SentimentLabel label) {
        return switch (label) {
            case POSITIVE -> 0.75;
            case NEGATIVE -> 0.25;
            case NEUTRAL -> 0.5;
        };
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Optional<Double> number(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode field = node.get(name);
            if (field == null || field.isNull()) {
                continue;
            }
            if (field.isNumber()) {
                return Optional.of(field.asDouble());
            }
            if (field.isTextual()) {
                try {
                    return Optional.of(Double.parseDouble(field.asText().trim()));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode field = node.get(name);
            if (field != null && field.isTextual()) {
                return Optional.of(field.asText());
            }
        }
        return Optional.empty();
    }

    private static List<String> strings(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode field = node.get(name);
            if (field != null && field.isArray()) {
                List<String> values = new ArrayList<>(field.size());
                for (JsonNode item : field) {
                    if (item.isValueNode() && !item.isNull()) {
                        String value = item.asText().trim();
                        if (!value.isEmpty()) {
                            values.add(value);
                        }
                    }
                }
                return values;
            }
        }
        return List.of();
    }
}
