package com.candidateprep.coach.model;

public record FollowUpOutcome(
    boolean maxDepthReached,
    int depth,
    int maxDepth,
    String message,
    QuestionResult result
) {
    public static FollowUpOutcome maxDepthReached(int depth, int maxDepth) {
        return new FollowUpOutcome(true, depth, maxDepth,
            "Maximum follow-up depth reached. Start a new question to continue.", null);
    }

    public static FollowUpOutcome answered(int depth, int maxDepth, QuestionResult result) {
        return new FollowUpOutcome(false, depth, maxDepth, null, result);
    }
}
