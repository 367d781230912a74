package com.candidateprep.coach.model;

import java.time.Instant;

public record ConversationEntry(
    String role,
    String content,
    Instant timestamp
) {}
