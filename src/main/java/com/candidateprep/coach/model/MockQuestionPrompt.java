package com.candidateprep.coach.model;

/** A mock question as presented to the candidate; {@code currentIndex} is 1-based. */
public record MockQuestionPrompt(
    MockQuestion question,
    int currentIndex,
    int totalQuestions
) {}
