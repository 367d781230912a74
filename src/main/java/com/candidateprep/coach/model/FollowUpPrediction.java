package com.candidateprep.coach.model;

public record FollowUpPrediction(
    String question,
    String reason,
    String guidance
) {}
