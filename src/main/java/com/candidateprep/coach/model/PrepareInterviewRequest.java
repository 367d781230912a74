package com.candidateprep.coach.model;

public record PrepareInterviewRequest(
    String company,
    String position,
    String jobDescription,
    boolean forceRefresh
) {}
