package com.candidateprep.coach.model;

public record PracticeQuestionRequest(
    String question,
    Boolean useSessionContext
) {}
