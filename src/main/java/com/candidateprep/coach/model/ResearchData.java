package com.candidateprep.coach.model;

import java.time.Instant;
import java.util.Map;

/**
 * Company research as handed to a session. {@code fromCache} tells whether the
 * fields came from the cache; a failed run carries {@code error} and no fields.
 */
public record ResearchData(
    String company,
    String position,
    Map<ResearchField, SearchSummary> fields,
    Instant researchedAt,
    boolean fromCache,
    String error
) {
    public ResearchData {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public String summary(ResearchField field) {
        SearchSummary value = fields.get(field);
        return value == null ? "" : value.summary();
    }
}
