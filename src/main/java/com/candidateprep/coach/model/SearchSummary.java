package com.candidateprep.coach.model;

import java.util.List;

public record SearchSummary(
    String summary,
    List<String> sources
) {
    public SearchSummary {
        summary = summary == null ? "" : summary;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
