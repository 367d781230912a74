package com.candidateprep.coach.service;

import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.model.Difficulty;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Staircase over easy, medium and hard. A single adjustment moves at most one level.
 */
@Component
public class AdaptiveDifficultyController {

    static final double PROMOTE_AT = 8.5;
    static final double DEMOTE_AT = 5.5;

    private final CoachProperties properties;

    public AdaptiveDifficultyController(CoachProperties properties) {
        this.properties = properties;
    }

    public Difficulty adjust(Difficulty current, double averageScore) {
        if (averageScore >= PROMOTE_AT) return current.harder();
        if (averageScore <= DEMOTE_AT) return current.easier();
        return current;
    }

    /** True after every {@code difficulty-cadence}-th scored answer. */
    public boolean shouldRecompute(int scoredCount) {
        int cadence = Math.max(1, properties.getDifficultyCadence());
        return scoredCount > 0 && scoredCount % cadence == 0;
    }

    /** Average of every score, or of the last {@code difficulty-window} scores when that is positive. */
    public double rollingAverage(List<Double> scores) {
        if (scores.isEmpty()) return 0.0;
        int window = properties.getDifficultyWindow();
        List<Double> considered = window > 0 && scores.size() > window
            ? scores.subList(scores.size() - window, scores.size())
            : scores;
        return considered.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /** Returns the level to use next; unchanged between cadence points. */
    public Difficulty recompute(Difficulty current, List<Double> scores) {
        if (!shouldRecompute(scores.size())) return current;
        return adjust(current, rollingAverage(scores));
    }
}
