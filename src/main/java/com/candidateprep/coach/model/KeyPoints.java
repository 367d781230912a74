package com.candidateprep.coach.model;

import java.util.List;

public record KeyPoints(
    List<String> keyPoints,
    List<String> deliveryTips
) {
    public KeyPoints {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        deliveryTips = deliveryTips == null ? List.of() : List.copyOf(deliveryTips);
    }

    public static KeyPoints generic() {
        return new KeyPoints(List.of("Review the full answer"), List.of("Practice delivery out loud"));
    }
}
