package com.candidateprep.coach.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResearchField {
    OVERVIEW("overview", "Company Overview"),
    CULTURE("culture", "Company Culture"),
    NEWS("news", "Recent News"),
    POSITION_ANALYSIS("position_analysis", "Position Analysis");

    private final String key;
    private final String heading;

    ResearchField(String key, String heading) {
        this.key = key;
        this.heading = heading;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String heading() {
        return heading;
    }
}
