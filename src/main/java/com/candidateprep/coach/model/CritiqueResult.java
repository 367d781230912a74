package com.candidateprep.coach.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores for one draft. Superseded by the next iteration's critique, never mutated;
 * {@link #withAlignment(String)} returns a copy.
 */
public record CritiqueResult(
    Map<String, Double> scores,
    double overall,
    List<String> strengths,
    List<String> improvements,
    String factCheck,
    String alignment
) {
    public static final List<String> SCORE_NAMES = List.of(
        "authenticity", "relevance", "structure", "specificity", "impact", "length");

    static final double NEUTRAL_SCORE = 7.0;

    public CritiqueResult {
        scores = scores == null ? Map.of() : Map.copyOf(scores);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }

    /** Neutral score set used whenever the critic's output cannot be read. */
    public static CritiqueResult neutral() {
        Map<String, Double> neutral = new LinkedHashMap<>();
        for (String name : SCORE_NAMES) {
            neutral.put(name, NEUTRAL_SCORE);
        }
        return new CritiqueResult(
            neutral,
            NEUTRAL_SCORE,
            List.of("Answer provided"),
            List.of("Could be more specific"),
            null,
            null
        );
    }

    public CritiqueResult withAlignment(String alignmentText) {
        return new CritiqueResult(scores, overall, strengths, improvements, factCheck, alignmentText);
    }
}
