package com.candidateprep.coach.model;

import java.util.List;
import java.util.Map;

public record MockInterviewPackage(
    String company,
    String position,
    String jobDescription,
    ResearchData researchData,
    List<MockQuestion> questions,
    int totalQuestions,
    Map<Difficulty, Integer> difficultyDistribution,
    Map<QuestionType, Integer> typeDistribution
) {}
