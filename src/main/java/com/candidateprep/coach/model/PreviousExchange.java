package com.candidateprep.coach.model;

public record PreviousExchange(
    String question,
    String answer
) {}
