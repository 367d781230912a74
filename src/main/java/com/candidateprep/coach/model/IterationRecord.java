package com.candidateprep.coach.model;

import java.time.Instant;

public record IterationRecord(
    int iteration,
    double score,
    boolean degraded,
    Instant recordedAt
) {}
