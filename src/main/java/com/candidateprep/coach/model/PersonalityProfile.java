package com.candidateprep.coach.model;

import java.util.List;

public record PersonalityProfile(
    String communicationStyle,
    List<String> workValues,
    List<String> strengths,
    List<String> weaknesses,
    String careerGoals
) {}
