package fr.lapetina.feedback.orchestrator.domain.parsing;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentLabel;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResultDecoderTest {

    private final ResponseParser parser = new ResponseParser();

    private ParseResult<List<AnalysisResult>> decode(String raw, AnalysisKind kind, int expected) {
        return ResultDecoder.parseAndDecode(parser, raw, kind, expected);
    }

    @Nested
    @DisplayName("Shape")
    class Shape {

        @Test
        @DisplayName("should keep the parse strategy through decoding")
        void shouldKeepStrategy() {
            ParseResult<List<AnalysisResult>> result = decode(
                    "```json\n[{\"score\": 0.9, \"label\": \"positive\"}]\n```", AnalysisKind.SENTIMENT, 1);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.strategy()).isEqualTo(ParseStrategy.FENCED_BLOCK);
        }

        @Test
        @DisplayName("should unwrap an array under a wrapper key")
        void shouldUnwrapWrapperKey() {
            ParseResult<List<AnalysisResult>> result = decode(
                    "{\"results\": [{\"score\": 0.2}, {\"score\": 0.7}]}", AnalysisKind.SENTIMENT, 2);

            assertThat(result.value()).hasSize(2);
        }

        @Test
        @DisplayName("should accept a bare object for a single item")
        void shouldAcceptBareObject() {
            ParseResult<List<AnalysisResult>> result = decode(
                    "{\"summary\": \"Solid app\"}", AnalysisKind.SUMMARY, 1);

            assertThat(result.isSuccess()).isTrue();
            assertThat(((InsightResult) result.value().get(0)).summary()).isEqualTo("Solid app");
        }

        @Test
        @DisplayName("should reject a record count mismatch")
        void shouldRejectCountMismatch() {
            ParseResult<List<AnalysisResult>> result = decode(
                    "[{\"score\": 0.2}, {\"score\": 0.7}]", AnalysisKind.SENTIMENT, 3);

            assertThat(result.isFailure()).isTrue();
            assertThat(result.error().message()).contains("Expected 3 records, got 2");
        }

        @Test
        @DisplayName("should reject a bare object for several items")
        void shouldRejectBareObjectForBatch() {
            assertThat(decode("{\"summary\": \"x\"}", AnalysisKind.INSIGHT, 2).isFailure()).isTrue();
        }

        @Test
        @DisplayName("should propagate parse failures")
        void shouldPropagateParseFailure() {
            ParseResult<List<AnalysisResult>> result = decode("no json here", AnalysisKind.INSIGHT, 1);

            assertThat(result.isFailure()).isTrue();
            assertThat(result.error().raw()).isEqualTo("no json here");
        }
    }

    @Nested
    @DisplayName("Sentiment records")
    class SentimentRecords {

        @Test
        @DisplayName("should read score, label and confidence")
        void shouldReadAllFields() {
            SentimentResult result = sentiment("[{\"score\": 0.85, \"label\": \"POSITIVE\", \"confidence\": 0.7}]");

            assertThat(result.score()).isEqualTo(0.85);
            assertThat(result.label()).isEqualTo(SentimentLabel.POSITIVE);
            assertThat(result.confidence()).isEqualTo(0.7);
        }

        @Test
        @DisplayName("should derive the label from the score")
        void shouldDeriveLabel() {
            assertThat(sentiment("[{\"score\": 0.1}]").label()).isEqualTo(SentimentLabel.NEGATIVE);
            assertThat(sentiment("[{\"score\": 0.5}]").label()).isEqualTo(SentimentLabel.NEUTRAL);
        }

        @Test
        @DisplayName("should derive the score from the label")
        void shouldDeriveScore() {
            SentimentResult result = sentiment("[{\"sentiment_label\": \"negative\"}]");

            assertThat(result.score()).isEqualTo(0.25);
            assertThat(result.confidence()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("should read negative scores as compound scores and clamp the rest")
        void shouldNormalizeScores() {
            assertThat(sentiment("[{\"score\": -0.5}]").score()).isEqualTo(0.25);
            assertThat(sentiment("[{\"score\": 7}]").score()).isEqualTo(1.0);
            assertThat(sentiment("[{\"score\": \"0.3\"}]").score()).isEqualTo(0.3);
            assertThat(sentiment("[{\"score\": 0.6, \"confidence\": 4}]").confidence()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject records with neither score nor label")
        void shouldRejectEmptyRecords() {
            assertThat(decode("[{\"summary\": \"x\"}]", AnalysisKind.SENTIMENT, 1).isFailure()).isTrue();
            assertThat(decode("[\"positive\"]", AnalysisKind.SENTIMENT, 1).isFailure()).isTrue();
        }

        private SentimentResult sentiment(String raw) {
            ParseResult<List<AnalysisResult>> result = decode(raw, AnalysisKind.SENTIMENT, 1);
            assertThat(result.isSuccess()).isTrue();
            return (SentimentResult) result.value().get(0);
        }
    }

    @Nested
    @DisplayName("Insight records")
    class InsightRecords {

        @Test
        @DisplayName("should read snake_case and camelCase lists")
        void shouldReadBothKeyStyles() {
            ParseResult<List<AnalysisResult>> result = decode(
                    "[{\"summary\": \"Crashes on login\", \"pain_points\": [\"login crash\", \" \"]},"
                            + " {\"summary\": \"Wants dark mode\", \"featureRequests\": [\"dark mode\"]}]",
                    AnalysisKind.INSIGHT, 2);

            InsightResult first = (InsightResult) result.value().get(0);
            InsightResult second = (InsightResult) result.value().get(1);
            assertThat(first.kind()).isEqualTo(AnalysisKind.INSIGHT);
            assertThat(first.painPoints()).containsExactly("login crash");
            assertThat(first.degraded()).isFalse();
            assertThat(second.featureRequests()).containsExactly("dark mode");
            assertThat(second.keyPoints()).isEmpty();
        }

        @Test
        @DisplayName("should fill a missing summary")
        void shouldFillMissingSummary() {
            InsightResult result = (InsightResult) decode("[{\"key_points\": [\"a\"]}]", AnalysisKind.INSIGHT, 1)
                    .value().get(0);

            assertThat(result.summary()).isEqualTo(ResultDecoder.MISSING_SUMMARY);
        }

        @Test
        @DisplayName("should accept a plain string as a summary")
        void shouldAcceptPlainString() {
            InsightResult result = (InsightResult) decode("[\"Users love it\"]", AnalysisKind.SUMMARY, 1)
                    .value().get(0);

            assertThat(result.kind()).isEqualTo(AnalysisKind.SUMMARY);
            assertThat(result.summary()).isEqualTo("Users love it");
        }
    }
}
