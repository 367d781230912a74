package com.candidateprep.coach.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.candidateprep.coach.exception.NoActiveSessionException;
import com.candidateprep.coach.exception.SessionStateException;
import com.candidateprep.coach.model.CritiqueResult;
import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.InterviewMode;
import com.candidateprep.coach.model.IterationRecord;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.MockQuestion;
import com.candidateprep.coach.model.MockQuestionPrompt;
import com.candidateprep.coach.model.PerformanceSummary;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.QuestionType;
import com.candidateprep.coach.model.SessionContextView;
import com.candidateprep.coach.model.SessionSnapshot;
import com.candidateprep.coach.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionStateStoreTest {

    private static final JobContext ACME = new JobContext("Acme", "Backend Engineer", "Build payment APIs");

    private MutableClock clock;
    private SessionStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        store = new SessionStateStore(clock, 10);
    }

    @Test
    void mutatorsWithoutSessionAreNoOps() {
        store.addQuestion("Tell me about yourself");
        store.addAnswer("I build things", CritiqueResult.neutral());
        store.addFollowUp("Why?");
        store.addFollowUpAnswer("Because");
        store.addToConversation("interviewer", "hello");
        store.addMockQuestions(questions(3));
        store.recordMockAnswer(8.0);
        store.setMockDifficulty(Difficulty.HARD);
        store.resetFollowUpDepth();

        assertThat(store.hasSession()).isFalse();
        assertThat(store.sessionId()).isEmpty();
    }

    @Test
    void readsWithoutSessionThrow() {
        assertThatThrownBy(() -> store.getContext())
            .isInstanceOf(NoActiveSessionException.class)
            .hasMessageContaining("Create a session first");
        assertThatThrownBy(() -> store.getNextMockQuestion()).isInstanceOf(NoActiveSessionException.class);
        assertThatThrownBy(() -> store.performanceSummary()).isInstanceOf(NoActiveSessionException.class);
        assertThatThrownBy(() -> store.followUpDepth()).isInstanceOf(NoActiveSessionException.class);
    }

    @Test
    void createReplacesExistingSession() {
        String first = store.createSession(ACME, InterviewMode.PRACTICE, List.of());
        store.addQuestion("Q1");
        String second = store.createSession(JobContext.empty(), InterviewMode.PREPARATION, List.of("Java"));

        assertThat(second).isNotEqualTo(first);
        SessionContextView context = store.getContext();
        assertThat(context.sessionId()).isEqualTo(second);
        assertThat(context.conversationHistory()).isEmpty();
        assertThat(context.keyRequirements()).containsExactly("Java");
        assertThat(context.mode()).isEqualTo(InterviewMode.PREPARATION);
    }

    @Test
    void mockQuestionsAreHandedOutInOrderThenExhausted() {
        store.createSession(ACME, InterviewMode.MOCK_INTERVIEW, List.of());
        List<MockQuestion> generated = questions(4);
        store.addMockQuestions(generated);

        List<MockQuestionPrompt> served = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            served.add(store.getNextMockQuestion().orElseThrow());
        }

        assertThat(served).extracting(MockQuestionPrompt::question).containsExactlyElementsOf(generated);
        assertThat(served).extracting(MockQuestionPrompt::currentIndex).containsExactly(1, 2, 3, 4);
        assertThat(served).allSatisfy(prompt -> assertThat(prompt.totalQuestions()).isEqualTo(4));
        assertThat(store.getNextMockQuestion()).isEmpty();
        assertThat(store.getNextMockQuestion()).isEmpty();
        assertThat(store.mockAskedCount()).isEqualTo(4);
    }

    @Test
    void regeneratingQuestionsAfterStartIsRejected() {
        store.createSession(ACME, InterviewMode.MOCK_INTERVIEW, List.of());
        store.addMockQuestions(questions(3));
        store.addMockQuestions(questions(2));
        assertThat(store.mockQuestionCount()).isEqualTo(2);

        store.getNextMockQuestion();

        assertThatThrownBy(() -> store.addMockQuestions(questions(5)))
            .isInstanceOf(SessionStateException.class);
        assertThat(store.mockQuestionCount()).isEqualTo(2);
    }

    @Test
    void eachAskedMockQuestionTakesOneAnswer() {
        store.createSession(ACME, InterviewMode.MOCK_INTERVIEW, List.of());
        store.addMockQuestions(questions(2));

        assertThatThrownBy(() -> store.currentMockQuestion()).isInstanceOf(SessionStateException.class);
        assertThatThrownBy(() -> store.recordMockAnswer(7.0)).isInstanceOf(SessionStateException.class);

        MockQuestion first = store.getNextMockQuestion().orElseThrow().question();
        assertThat(store.currentMockQuestion()).isEqualTo(first);
        store.recordMockAnswer(8.0);

        assertThatThrownBy(() -> store.currentMockQuestion()).isInstanceOf(SessionStateException.class);
        assertThatThrownBy(() -> store.recordMockAnswer(6.0)).isInstanceOf(SessionStateException.class);

        store.getNextMockQuestion();
        store.recordMockAnswer(null);

        assertThat(store.mockAnsweredCount()).isEqualTo(2);
        assertThat(store.mockScores()).containsExactly(8.0);
    }

    @Test
    void difficultyHistoryRecordsChangesOnly() {
        store.createSession(ACME, InterviewMode.MOCK_INTERVIEW, List.of());

        store.setMockDifficulty(Difficulty.MEDIUM);
        store.setMockDifficulty(Difficulty.HARD);
        store.setMockDifficulty(Difficulty.HARD);
        store.setMockDifficulty(Difficulty.MEDIUM);

        assertThat(store.mockDifficulty()).isEqualTo(Difficulty.MEDIUM);
        assertThat(store.mockDifficultyHistory())
            .containsExactly(Difficulty.MEDIUM, Difficulty.HARD, Difficulty.MEDIUM);
    }

    @Test
    void contextShowsOnlyTheLatestTenConversationEntries() {
        store.createSession(ACME, InterviewMode.PRACTICE, List.of());
        IntStream.rangeClosed(1, 12).forEach(i -> store.addToConversation("interviewer", "message " + i));

        SessionContextView context = store.getContext();

        assertThat(context.conversationHistory()).hasSize(10);
        assertThat(context.conversationHistory().get(0).content()).isEqualTo("message 3");
        assertThat(context.conversationHistory().get(9).content()).isEqualTo("message 12");
    }

    @Test
    void followUpsTrackDepthAndCurrentExchange() {
        store.createSession(ACME, InterviewMode.PRACTICE, List.of());
        assertThatThrownBy(() -> store.currentExchange()).isInstanceOf(SessionStateException.class);

        store.addQuestion("Describe a conflict");
        store.addAnswer("I mediated between two teams", null);
        store.addFollowUp("What would you change?");

        SessionContextView awaiting = store.getContext();
        assertThat(awaiting.followUpDepth()).isEqualTo(1);
        assertThat(awaiting.awaitingFollowUp()).isTrue();

        store.addFollowUpAnswer("Involve them earlier");
        assertThat(store.currentExchange())
            .isEqualTo(new PreviousExchange("Describe a conflict", "I mediated between two teams"));
        assertThat(store.getContext().awaitingFollowUp()).isFalse();

        store.addFollowUp("How did the teams react?");
        store.addFollowUpAnswer("They agreed on a shared roadmap");
        assertThat(store.followUpDepth()).isEqualTo(2);
        assertThat(store.currentExchange())
            .isEqualTo(new PreviousExchange("Describe a conflict", "I mediated between two teams"));

        store.resetFollowUpDepth();
        assertThat(store.followUpDepth()).isZero();
    }

    @Test
    void performanceSummaryAveragesCritiquesAndKeepsLatestFive() {
        store.createSession(ACME, InterviewMode.PRACTICE, List.of());
        assertThat(store.performanceSummary()).isEqualTo(PerformanceSummary.empty());

        double[] scores = {4.0, 5.0, 6.0, 7.0, 8.0, 9.0};
        for (double score : scores) {
            store.addQuestion("Q" + score);
            store.addAnswer("A" + score, critique(score));
        }
        store.addFollowUp("Why?");

        PerformanceSummary summary = store.performanceSummary();

        assertThat(summary.averageScore()).isEqualTo(6.5);
        assertThat(summary.questionCount()).isEqualTo(6);
        assertThat(summary.followUpCount()).isEqualTo(1);
        assertThat(summary.latestScores()).containsExactly(5.0, 6.0, 7.0, 8.0, 9.0);
    }

    @Test
    void exportThenImportRestoresProgress() {
        String id = store.createSession(ACME, InterviewMode.MOCK_INTERVIEW, List.of("Kafka"));
        store.addMockQuestions(questions(3));
        store.getNextMockQuestion();
        store.recordMockAnswer(9.0);
        store.getNextMockQuestion();
        store.addIteration(new IterationRecord(1, 9.0, false, clock.instant()));
        SessionSnapshot snapshot = store.export();

        clock.advance(Duration.ofMinutes(5));
        SessionStateStore restored = new SessionStateStore(clock, 10);
        restored.importSnapshot(snapshot);

        assertThat(restored.sessionId()).contains(id);
        assertThat(restored.jobContext()).isEqualTo(ACME);
        assertThat(restored.mockAskedCount()).isEqualTo(2);
        assertThat(restored.mockAnsweredCount()).isEqualTo(1);
        assertThat(restored.currentMockQuestion()).isEqualTo(snapshot.mock().generatedQuestions().get(1));
        assertThat(restored.getNextMockQuestion()).map(MockQuestionPrompt::currentIndex).contains(3);
        assertThat(restored.export().practice().iterationHistory()).hasSize(1);
    }

    @Test
    void importRejectsOutOfRangeMockProgress() {
        SessionSnapshot bad = new SessionSnapshot(
            "s-1", InterviewMode.MOCK_INTERVIEW, ACME, List.of(), null, null,
            new SessionSnapshot.Mock(questions(2), 3, 0, Difficulty.MEDIUM, List.of(), List.of()),
            List.of(), null, null, false, 0, null, null);

        assertThatThrownBy(() -> store.importSnapshot(bad)).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.hasSession()).isFalse();
    }

    @Test
    void clearEndsTheSession() {
        store.createSession(ACME, InterviewMode.PRACTICE, List.of());
        store.clear();

        assertThat(store.hasSession()).isFalse();
        assertThat(store.sessionId()).isEqualTo(Optional.empty());
    }

    private static List<MockQuestion> questions(int count) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> new MockQuestion("Question " + i, QuestionType.BEHAVIORAL, Difficulty.MEDIUM,
                Set.of("teamwork"), "STAR"))
            .toList();
    }

    private static CritiqueResult critique(double overall) {
        return new CritiqueResult(Map.of("impact", overall), overall, List.of(), List.of(), null, null);
    }
}
