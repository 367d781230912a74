package com.candidateprep.coach.model;

import java.util.List;

public record CreateSessionRequest(
    String company,
    String position,
    String jobDescription,
    String mode,
    List<String> keyRequirements
) {}
