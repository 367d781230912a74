package com.candidateprep.coach.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Ordered difficulty levels; {@link #harder()} and {@link #easier()} saturate at the ends. */
public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    public Difficulty harder() {
        return this == EASY ? MEDIUM : HARD;
    }

    public Difficulty easier() {
        return this == HARD ? MEDIUM : EASY;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Difficulty fromValue(String raw) {
        return fromValue(raw, MEDIUM);
    }

    public static Difficulty fromValue(String raw, Difficulty fallback) {
        if (raw == null) return fallback;
        for (Difficulty level : values()) {
            if (level.name().equalsIgnoreCase(raw.trim())) return level;
        }
        return fallback;
    }
}
