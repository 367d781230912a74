package com.candidateprep.coach.model;

import com.candidateprep.coach.critique.LoopState;
import java.util.List;

/**
 * Everything the critique loop hands back for one question. {@code critique} is the
 * last iteration's critique and is null only when the loop ended in {@code ERROR}
 * before any draft was scored.
 */
public record QuestionResult(
    String question,
    String answer,
    String analysis,
    List<String> keyPoints,
    List<String> deliveryTips,
    List<FollowUpPrediction> followUps,
    ParseOutcome<CritiqueResult> critique,
    int iterations,
    boolean shouldIterate,
    List<IterationRecord> iterationHistory,
    LoopState finalState,
    String error
) {
    public QuestionResult {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        deliveryTips = deliveryTips == null ? List.of() : List.copyOf(deliveryTips);
        followUps = followUps == null ? List.of() : List.copyOf(followUps);
        iterationHistory = iterationHistory == null ? List.of() : List.copyOf(iterationHistory);
    }

    public boolean scored() {
        return critique != null;
    }

    public double overallScore() {
        return critique == null ? 0.0 : critique.value().overall();
    }
}
