package com.candidateprep.coach.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum InterviewMode {
    PREPARATION("preparation"),
    PRACTICE("practice"),
    MOCK_INTERVIEW("mock_interview");

    private final String value;

    InterviewMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static InterviewMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) return PRACTICE;
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (InterviewMode mode : values()) {
            if (mode.value.equals(normalized) || mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown interview mode: " + raw);
    }
}
