package com.candidateprep.coach.model;

import java.util.List;

public record PerformanceSummary(
    double averageScore,
    int questionCount,
    int followUpCount,
    List<Double> latestScores
) {
    public static PerformanceSummary empty() {
        return new PerformanceSummary(0.0, 0, 0, List.of());
    }
}
