package com.candidateprep.coach.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum QuestionType {
    BEHAVIORAL("STAR"),
    TECHNICAL("Direct"),
    SITUATIONAL("CAR");

    private final String defaultFramework;

    QuestionType(String defaultFramework) {
        this.defaultFramework = defaultFramework;
    }

    public String defaultFramework() {
        return defaultFramework;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static QuestionType fromValue(String raw, QuestionType fallback) {
        if (raw == null) return fallback;
        for (QuestionType type : values()) {
            if (type.name().equalsIgnoreCase(raw.trim())) return type;
        }
        return fallback;
    }
}
