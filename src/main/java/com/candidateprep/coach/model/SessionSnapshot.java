package com.candidateprep.coach.model;

import java.time.Instant;
import java.util.List;

/** Plain serializable copy of a session, produced by export and accepted by import. */
public record SessionSnapshot(
    String sessionId,
    InterviewMode mode,
    JobContext job,
    List<String> keyRequirements,
    ResearchData researchData,
    Practice practice,
    Mock mock,
    List<ConversationEntry> conversationHistory,
    String currentQuestion,
    String currentAnswer,
    boolean awaitingFollowUp,
    int followUpDepth,
    Instant createdAt,
    Instant updatedAt
) {
    public record Practice(
        List<String> questionsAsked,
        List<String> answersGiven,
        List<String> followUpsAsked,
        List<String> followUpAnswers,
        List<CritiqueResult> critiques,
        List<IterationRecord> iterationHistory
    ) {}

    public record Mock(
        List<MockQuestion> generatedQuestions,
        int currentQuestionIndex,
        int answeredCount,
        Difficulty difficulty,
        List<Difficulty> difficultyHistory,
        List<Double> performanceScores
    ) {}
}
