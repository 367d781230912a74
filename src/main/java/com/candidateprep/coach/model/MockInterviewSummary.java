package com.candidateprep.coach.model;

import java.util.List;

public record MockInterviewSummary(
    PerformanceSummary performance,
    int questionsAnswered,
    int totalQuestions,
    Difficulty currentDifficulty,
    List<Difficulty> difficultyHistory,
    List<Double> scoresByQuestion
) {}
