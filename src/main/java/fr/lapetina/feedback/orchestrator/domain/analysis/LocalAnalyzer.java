package fr.lapetina.feedback.orchestrator.domain.analysis;

import fr.lapetina.feedback.orchestrator.domain.model.AnalysisKind;
import fr.lapetina.feedback.orchestrator.domain.model.AnalysisResult;
import fr.lapetina.feedback.orchestrator.domain.model.ErrorType;
import fr.lapetina.feedback.orchestrator.domain.model.InsightResult;
import fr.lapetina.feedback.orchestrator.domain.model.SentimentResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic lexicon and rule based sentiment scoring, always available.
 *
 * Rules:
 * - word valences from {@link SentimentLexicon}, with simple suffix stripping
 * - boosters and dampeners within three preceding words scale the valence
 * - a negation within three preceding words flips and damps it
 * - words after "but" weigh more than words before it
 * - up to four exclamation marks intensify the overall polarity
 *
 * The valence sum is squashed into a compound score in [-1, 1], then normalized to
 * [0, 1] by {@link SentimentResult#fromCompound(double)}.
 *
 * Holds no mutable state; safe for unbounded concurrent use.
 */
public final class LocalAnalyzer {

    private static final Pattern URL = Pattern.compile("https?://\\S+|www\\.\\S+");
    private static final Pattern APOSTROPHE = Pattern.compile("['’]");
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z]+");

    private static final double NORMALIZATION_ALPHA = 15.0;
    private static final double NEGATION_SCALAR = -0.74;
    private static final double EXCLAMATION_BOOST = 0.292;
    private static final int MAX_EXCLAMATIONS = 4;
    private static final int LOOKBACK = 3;

    public SentimentResult analyze(String text) {
        if (text == null || text.isBlank()) {
            return SentimentResult.neutral();
        }
        return SentimentResult.fromCompound(compound(text));
    }

    public List<SentimentResult> analyzeAll(List<String> texts) {
        List<SentimentResult> results = new ArrayList<>(texts.size());
        for (String text : texts) {
            results.add(analyze(text));
        }
        return results;
    }

    /**
     * Local substitute for any kind. Sentiment is computed; insight and summary have no local
     * equivalent and yield a degraded result explaining why.
     */
    public AnalysisResult fallback(AnalysisKind kind, String text, ErrorType reason) {
        if (kind == AnalysisKind.SENTIMENT) {
            return analyze(text);
        }
        return InsightResult.degraded(kind, degradedSummary(reason));
    }

    static String degradedSummary(ErrorType reason) {
        if (reason == null) {
            return "Using local processing";
        }
        return switch (reason) {
            case CIRCUIT_OPEN -> "Using local processing due to API reliability issues";
            case RATE_LIMITED, QUOTA_EXCEEDED -> "Rate limit exceeded. Using local processing temporarily.";
            case UNAVAILABLE -> "Insights not available - remote analysis not configured";
            case TIMEOUT, DEADLINE_EXCEEDED -> "Remote analysis timed out. Using local processing.";
            default -> "Remote analysis failed. Using local processing.";
        };
    }

    double compound(String text) {
        List<String> tokens = tokenize(text);
        int butIndex = tokens.indexOf("but");

        double sum = 0.0;
        for (int i = 0; i < tokens.size(); i++) {
            Double base = lookup(tokens.get(i));
            if (base == null) {
                continue;
            }
            double valence = base;

            for (int back = 1; back <= LOOKBACK && i - back >= 0; back++) {
                Double boost = SentimentLexicon.BOOSTERS.get(tokens.get(i - back));
                if (boost != null) {
                    double decay = 1.0 - 0.05 * (back - 1);
                    valence += Math.signum(base) * boost * decay;
                }
            }
            for (int back = 1; back <= LOOKBACK && i - back >= 0; back++) {
                if (SentimentLexicon.NEGATIONS.contains(tokens.get(i - back))) {
                    valence *= NEGATION_SCALAR;
                    break;
                }
            }
            if (butIndex >= 0) {
                valence *= i < butIndex ? 0.5 : 1.5;
            }
            sum += valence;
        }

        if (sum != 0.0) {
            long exclamations = Math.min(MAX_EXCLAMATIONS, text.chars().filter(c -> c == '!').count());
            sum += Math.signum(sum) * exclamations * EXCLAMATION_BOOST;
        }

        double compound = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        return Math.max(-1.0, Math.min(1.0, compound));
    }

    static List<String> tokenize(String text) {
        String cleaned = text.toLowerCase(Locale.ROOT);
        cleaned = URL.matcher(cleaned).replaceAll(" ");
        cleaned = APOSTROPHE.matcher(cleaned).replaceAll("");
        cleaned = NON_LETTER.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return List.of(cleaned.split(" "));
    }

    private static Double lookup(String token) {
        Double valence = SentimentLexicon.VALENCES.get(token);
        if (valence != null) {
            return valence;
        }
        for (String stem : stems(token)) {
            valence = SentimentLexicon.VALENCES.get(stem);
            if (valence != null) {
                return valence;
            }
        }
        return null;
    }

    private static List<String> stems(String token) {
        List<String> stems = new ArrayList<>(4);
        if (token.length() > 4 && token.endsWith("ing")) {
            String root = token.substring(0, token.length() - 3);
            stems.add(root);
            stems.add(root + "e");
        }
        if (token.length() > 3 && token.endsWith("ed")) {
            stems.add(token.substring(0, token.length() - 2));
            stems.add(token.substring(0, token.length() - 1));
        }
        if (token.length() > 3 && token.endsWith("es")) {
            stems.add(token.substring(0, token.length() - 2));
        }
        if (token.length() > 2 && token.endsWith("s")) {
            stems.add(token.substring(0, token.length() - 1));
        }
        return stems;
    }
}
