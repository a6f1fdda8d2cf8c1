package fr.lapetina.feedback.orchestrator.infrastructure.http;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;

import java.util.List;

/**
 * Builds the batch prompts sent to the remote model.
 * Every prompt asks for a JSON array holding exactly one element per review, in review order.
 */
public final class PromptFactory {

    private static final String SENTIMENT_INSTRUCTION =
            "Analyze the sentiment of each of the following reviews and return a JSON array of objects,\n" +
            "one object per review, in the same order as the reviews.\n" +
            "Each object should have:\n" +
            "- score: a float between 0 (negative) and 1 (positive)\n" +
            "- label: one of \"POSITIVE\", \"NEGATIVE\", or \"NEUTRAL\"\n" +
            "- confidence: a float between 0 and 1 indicating confidence in the analysis\n";

    private static final String INSIGHT_INSTRUCTION =
            "Analyze each of the following product reviews and extract insights. Return a JSON array of objects,\n" +
            "one object per review, in the same order as the reviews. Each object must have:\n" +
            "- summary: a brief summary of the review (must not be empty)\n" +
            "- key_points: array of the most important points mentioned\n" +
            "- pain_points: array of issues or problems mentioned\n" +
            "- feature_requests: array of features or improvements requested\n" +
            "- positive_aspects: array of positive aspects mentioned\n" +
            "Use an empty array when a review mentions nothing for a category.\n";

    private static final String SUMMARY_INSTRUCTION =
            "Summarize each of the following reviews. Return a JSON array of objects,\n" +
            "one object per review, in the same order as the reviews. Each object must have:\n" +
            "- summary: one or two sentences capturing the review (must not be empty)\n" +
            "- key_points: array of at most three short key points\n";

    public String build(AnalysisKind kind, List<String> reviews) {
        StringBuilder prompt = new StringBuilder(instruction(kind));
        prompt.append("\nReviews:\n");
        for (int i = 0; i < reviews.size(); i++) {
            prompt.append("Review ").append(i + 1).append(": ")
                    .append(reviews.get(i).replace('\n', ' ').trim())
                    .append('\n');
        }
        prompt.append("\nReturn only the JSON array with exactly ")
                .append(reviews.size())
                .append(reviews.size() == 1 ? " element" : " elements")
                .append(", without any additional text.");
        return prompt.toString();
    }

    private static String instruction(AnalysisKind kind) {
        return switch (kind) {
            case SENTIMENT -> SENTIMENT_INSTRUCTION;
            case INSIGHT -> INSIGHT_INSTRUCTION;
            case SUMMARY -> SUMMARY_INSTRUCTION;
        };
    }
}
