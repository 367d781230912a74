package com.candidateprep.coach.model;

import java.util.Set;

public record MockQuestion(
    String question,
    QuestionType type,
    Difficulty difficulty,
    Set<String> themes,
    String expectedFramework
) {
    public MockQuestion {
        themes = themes == null ? Set.of() : Set.copyOf(themes);
    }
}
