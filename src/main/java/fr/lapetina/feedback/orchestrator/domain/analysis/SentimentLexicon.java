package fr.lapetina.feedback.orchestrator.domain.analysis;

import java.util.Map;
import java.util.Set;

/**
 * Word valences used by the local analyzer, tuned for product and app feedback.
 * Valences range roughly from -4 (strongly negative) to +4 (strongly positive).
 */
final class SentimentLexicon {

    static final Map<String, Double> VALENCES = Map.ofEntries(
            // positive
            Map.entry("good", 1.9), Map.entry("great", 3.1), Map.entry("excellent", 3.2),
            Map.entry("amazing", 2.8), Map.entry("awesome", 3.1), Map.entry("fantastic", 2.6),
            Map.entry("wonderful", 2.7), Map.entry("love", 3.2), Map.entry("loved", 2.9),
            Map.entry("best", 3.2), Map.entry("perfect", 2.7), Map.entry("nice", 1.8),
            Map.entry("happy", 2.7), Map.entry("helpful", 1.8), Map.entry("easy", 1.9),
            Map.entry("recommend", 1.5), Map.entry("like", 1.5), Map.entry("enjoy", 2.2),
            Map.entry("pleased", 1.9), Map.entry("satisfied", 1.8), Map.entry("impressive", 2.3),
            Map.entry("beautiful", 2.9), Map.entry("fast", 1.4), Map.entry("reliable", 1.9),
            Map.entry("efficient", 1.6), Map.entry("convenient", 1.6), Map.entry("friendly", 2.2),
            Map.entry("useful", 1.9), Map.entry("worth", 0.9), Map.entry("favorite", 2.0),
            Map.entry("simple", 0.8), Map.entry("smooth", 1.3), Map.entry("intuitive", 1.8),
            Map.entry("innovative", 1.7), Map.entry("responsive", 1.5), Map.entry("quick", 1.2),
            Map.entry("fun", 2.3), Map.entry("effective", 2.1), Map.entry("quality", 1.1),
            Map.entry("valuable", 2.1), Map.entry("positive", 2.6), Map.entry("outstanding", 3.0),
            Map.entry("superb", 3.1), Map.entry("superior", 2.3), Map.entry("thanks", 1.9),
            Map.entry("ok", 0.9), Map.entry("okay", 0.9), Map.entry("fine", 0.8),
            Map.entry("works", 0.8), Map.entry("stable", 1.2), Map.entry("clean", 1.7),
            // negative
            Map.entry("bad", -2.5), Map.entry("terrible", -3.1), Map.entry("awful", -3.1),
            Map.entry("horrible", -2.9), Map.entry("poor", -2.1), Map.entry("worst", -3.1),
            Map.entry("hate", -2.7), Map.entry("difficult", -1.5), Map.entry("slow", -1.4),
            Map.entry("expensive", -1.2), Map.entry("disappointing", -2.2), Map.entry("disappointed", -2.1),
            Map.entry("useless", -2.2), Map.entry("annoying", -1.8), Map.entry("frustrating", -2.2),
            Map.entry("broken", -2.1), Map.entry("issue", -1.0), Map.entry("problem", -1.7),
            Map.entry("bug", -1.6), Map.entry("error", -1.8), Map.entry("crash", -2.5),
            Map.entry("fail", -2.3), Map.entry("failure", -2.3), Map.entry("waste", -2.0),
            Map.entry("confusing", -1.3), Map.entry("complicated", -1.1), Map.entry("hard", -0.6),
            Map.entry("impossible", -1.6), Map.entry("negative", -2.7), Map.entry("ugly", -2.3),
            Map.entry("unreliable", -1.9), Map.entry("inconsistent", -1.1), Map.entry("inconvenient", -1.4),
            Map.entry("unhelpful", -1.8), Map.entry("unfriendly", -1.9), Map.entry("inefficient", -1.6),
            Map.entry("ineffective", -1.8), Map.entry("overpriced", -1.9), Map.entry("cheap", -0.5),
            Map.entry("glitchy", -1.9), Map.entry("laggy", -1.7), Map.entry("buggy", -2.0),
            Map.entry("unstable", -1.7), Map.entry("unusable", -2.6), Map.entry("mediocre", -1.2),
            Map.entry("freeze", -1.5), Map.entry("freezes", -1.5), Map.entry("meh", -0.9),
            Map.entry("refund", -1.2), Map.entry("scam", -3.0), Map.entry("sucks", -1.9)
    );

    static final Set<String> NEGATIONS = Set.of(
            "not", "no", "never", "none", "nothing", "neither", "nor", "without", "hardly",
            "cannot", "cant", "dont", "doesnt", "didnt", "isnt", "wasnt", "arent", "werent",
            "wont", "wouldnt", "shouldnt", "couldnt", "aint"
    );

    static final Map<String, Double> BOOSTERS = Map.ofEntries(
            Map.entry("very", 0.293), Map.entry("really", 0.293), Map.entry("extremely", 0.293),
            Map.entry("so", 0.293), Map.entry("totally", 0.293), Map.entry("absolutely", 0.293),
            Map.entry("incredibly", 0.293), Map.entry("constantly", 0.293), Map.entry("always", 0.2),
            Map.entry("super", 0.293), Map.entry("highly", 0.293), Map.entry("completely", 0.293),
            Map.entry("barely", -0.293), Map.entry("slightly", -0.293), Map.entry("somewhat", -0.293),
            Map.entry("kinda", -0.293), Map.entry("little", -0.293), Map.entry("occasionally", -0.293)
    );

    private SentimentLexicon() {
    }
}
