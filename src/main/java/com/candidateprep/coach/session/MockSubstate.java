package com.candidateprep.coach.session;

import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.MockQuestion;
import java.util.ArrayList;
import java.util.List;

/**
 * Mock interview progress. {@code currentIndex} only grows and never passes
 * {@code questions.size()}; {@code answeredCount} never passes {@code currentIndex}.
 */
class MockSubstate {

    final List<MockQuestion> questions = new ArrayList<>();
    final List<Double> performanceScores = new ArrayList<>();
    final List<Difficulty> difficultyHistory = new ArrayList<>();
    int currentIndex;
    int answeredCount;
    Difficulty difficulty = Difficulty.MEDIUM;

    MockSubstate() {
        difficultyHistory.add(difficulty);
    }
}
