package com.candidateprep.coach.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.model.Difficulty;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AdaptiveDifficultyControllerTest {

    private final CoachProperties properties = new CoachProperties();
    private final AdaptiveDifficultyController controller = new AdaptiveDifficultyController(properties);

    @ParameterizedTest
    @CsvSource({
        "MEDIUM, 9.0, HARD",
        "HARD, 9.0, HARD",
        "EASY, 4.0, EASY",
        "MEDIUM, 7.0, MEDIUM",
        "EASY, 8.5, MEDIUM",
        "HARD, 5.5, MEDIUM",
        "MEDIUM, 5.6, MEDIUM",
        "MEDIUM, 8.49, MEDIUM"
    })
    void movesAtMostOneLevel(Difficulty current, double average, Difficulty expected) {
        assertThat(controller.adjust(current, average)).isEqualTo(expected);
    }

    @Test
    void recomputesOnEveryThirdScore() {
        assertThat(controller.shouldRecompute(0)).isFalse();
        assertThat(controller.shouldRecompute(2)).isFalse();
        assertThat(controller.shouldRecompute(3)).isTrue();
        assertThat(controller.shouldRecompute(4)).isFalse();
        assertThat(controller.shouldRecompute(6)).isTrue();
    }

    @Test
    void averagesFullHistoryByDefault() {
        List<Double> scores = List.of(2.0, 2.0, 2.0, 9.0, 9.0, 9.0);

        assertThat(controller.rollingAverage(scores)).isEqualTo(5.5);
        assertThat(controller.recompute(Difficulty.MEDIUM, scores)).isEqualTo(Difficulty.EASY);
    }

    @Test
    void slidingWindowOnlyWhenConfigured() {
        properties.setDifficultyWindow(3);
        List<Double> scores = List.of(2.0, 2.0, 2.0, 9.0, 9.0, 9.0);

        assertThat(controller.rollingAverage(scores)).isEqualTo(9.0);
        assertThat(controller.recompute(Difficulty.MEDIUM, scores)).isEqualTo(Difficulty.HARD);
    }

    @Test
    void leavesLevelAloneBetweenCadencePoints() {
        assertThat(controller.recompute(Difficulty.MEDIUM, List.of(10.0, 10.0))).isEqualTo(Difficulty.MEDIUM);
    }
}
