package com.candidateprep.coach.model;

import java.util.List;

/** Body for adding CV text or a single experience; tags apply to experiences only. */
public record ProfileTextRequest(
    String text,
    List<String> tags
) {}
