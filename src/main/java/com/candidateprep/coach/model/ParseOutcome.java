package com.candidateprep.coach.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result of reading structured model output. A {@link Fallback} carries the
 * documented default value together with the reason the real output was unusable.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "status")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ParseOutcome.Parsed.class, name = "parsed"),
    @JsonSubTypes.Type(value = ParseOutcome.Fallback.class, name = "fallback")
})
public sealed interface ParseOutcome<T> permits ParseOutcome.Parsed, ParseOutcome.Fallback {

    T value();

    @JsonIgnore
    default boolean isFallback() {
        return this instanceof Fallback<?>;
    }

    static <T> ParseOutcome<T> parsed(T value) {
        return new Parsed<>(value);
    }

    static <T> ParseOutcome<T> fallback(T value, String reason) {
        return new Fallback<>(value, reason);
    }

    record Parsed<T>(T value) implements ParseOutcome<T> {}

    record Fallback<T>(T value, String reason) implements ParseOutcome<T> {}
}
