package com.candidateprep.coach.model;

public record FollowUpRequest(
    String question
) {}
