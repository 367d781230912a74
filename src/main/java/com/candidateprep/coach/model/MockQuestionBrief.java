package com.candidateprep.coach.model;

public record MockQuestionBrief(
    QuestionType type,
    int count,
    Difficulty difficulty,
    JobContext job,
    String researchDigest
) {}
