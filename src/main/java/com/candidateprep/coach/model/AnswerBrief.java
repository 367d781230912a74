package com.candidateprep.coach.model;

import java.util.List;

public record AnswerBrief(
    Question question,
    String analysis,
    RetrievedContext context,
    List<String> corrections
) {
    public AnswerBrief {
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
    }

    public boolean isRevision() {
        return !corrections.isEmpty();
    }
}
