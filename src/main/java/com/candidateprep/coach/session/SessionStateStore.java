package com.candidateprep.coach.session;

import com.candidateprep.coach.exception.NoActiveSessionException;
import com.candidateprep.coach.exception.SessionStateException;
import com.candidateprep.coach.model.ConversationEntry;
import com.candidateprep.coach.model.CritiqueResult;
import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.InterviewMode;
import com.candidateprep.coach.model.IterationRecord;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.MockQuestion;
import com.candidateprep.coach.model.MockQuestionPrompt;
import com.candidateprep.coach.model.PerformanceSummary;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.ResearchData;
import com.candidateprep.coach.model.SessionContextView;
import com.candidateprep.coach.model.SessionSnapshot;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds at most one live session for one client.
 *
 * <p>Mutators are no-ops without a session. Reads that need session context throw
 * {@link NoActiveSessionException}. Not thread-safe: callers serialize access,
 * see {@link SessionRegistry}.
 */
public class SessionStateStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStateStore.class);

    static final String INTERVIEWER = "interviewer";
    static final String CANDIDATE = "candidate";
    private static final int LATEST_SCORES = 5;

    private final Clock clock;
    private final int conversationWindow;
    private Session current;

    public SessionStateStore(Clock clock, int conversationWindow) {
        this.clock = clock;
        this.conversationWindow = conversationWindow;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /** Replaces any existing session. */
    public String createSession(JobContext job, InterviewMode mode, List<String> keyRequirements) {
        Session session = new Session(UUID.randomUUID().toString(), job, mode, clock.instant());
        if (keyRequirements != null) session.keyRequirements.addAll(keyRequirements);
        if (current != null) {
            log.info("Replacing session id={} with id={}", current.id, session.id);
        }
        current = session;
        log.info("Session created id={} mode={} company={}", session.id, mode.value(), job.company());
        return session.id;
    }

    public boolean hasSession() {
        return current != null;
    }

    public Optional<String> sessionId() {
        return current == null ? Optional.empty() : Optional.of(current.id);
    }

    public void clear() {
        if (current != null) log.info("Session cleared id={}", current.id);
        current = null;
    }

    // -------------------------------------------------------------------------
    // Mutators
    // -------------------------------------------------------------------------

    public void setMode(InterviewMode mode) {
        if (current == null) return;
        current.mode = mode;
        touch();
    }

    public void addResearchData(ResearchData research) {
        if (current == null) return;
        current.researchData = research;
        touch();
    }

    public void addQuestion(String question) {
        if (current == null) return;
        current.practice.questionsAsked.add(question);
        current.currentQuestion = question;
        addToConversation(INTERVIEWER, question);
    }

    public void addAnswer(String answer, CritiqueResult critique) {
        if (current == null) return;
        current.practice.answersGiven.add(answer);
        current.currentAnswer = answer;
        if (critique != null) current.practice.critiques.add(critique);
        addToConversation(CANDIDATE, answer);
    }

    public void addIteration(IterationRecord record) {
        if (current == null) return;
        current.practice.iterationHistory.add(record);
        touch();
    }

    /** Logs a follow-up question and moves one level deeper. */
    public void addFollowUp(String question) {
        if (current == null) return;
        current.practice.followUpsAsked.add(question);
        current.followUpDepth++;
        current.awaitingFollowUp = true;
        addToConversation(INTERVIEWER, question);
    }

    public void addFollowUpAnswer(String answer) {
        if (current == null) return;
        current.practice.followUpAnswers.add(answer);
        current.awaitingFollowUp = false;
        addToConversation(CANDIDATE, answer);
    }

    public void resetFollowUpDepth() {
        if (current == null) return;
        current.followUpDepth = 0;
        current.awaitingFollowUp = false;
        touch();
    }

    public void addToConversation(String role, String content) {
        if (current == null) return;
        current.conversationHistory.add(new ConversationEntry(role, content, clock.instant()));
        touch();
    }

    /**
     * Replaces the generated sequence. Rejected once the first question has been
     * handed out, since the index would then point into a different list.
     */
    public void addMockQuestions(List<MockQuestion> questions) {
        if (current == null) return;
        MockSubstate mock = current.mock;
        if (mock.currentIndex > 0) {
            throw new SessionStateException("Mock interview already in progress; create a new session to regenerate questions.");
        }
        mock.questions.clear();
        mock.questions.addAll(questions);
        touch();
    }

    /** Marks the current mock question answered; a null score (unscored answer) is not recorded. */
    public void recordMockAnswer(Double score) {
        if (current == null) return;
        MockSubstate mock = current.mock;
        if (mock.answeredCount >= mock.currentIndex) {
            throw new SessionStateException("No unanswered mock question to record.");
        }
        if (score != null) mock.performanceScores.add(score);
        mock.answeredCount++;
        touch();
    }

    public void setMockDifficulty(Difficulty difficulty) {
        if (current == null) return;
        MockSubstate mock = current.mock;
        if (mock.difficulty != difficulty) {
            mock.difficulty = difficulty;
            mock.difficultyHistory.add(difficulty);
            touch();
        }
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    /** Hands out the question at the current index, then advances it. Empty once exhausted. */
    public Optional<MockQuestionPrompt> getNextMockQuestion() {
        MockSubstate mock = require().mock;
        if (mock.currentIndex >= mock.questions.size()) return Optional.empty();

        MockQuestion question = mock.questions.get(mock.currentIndex);
        mock.currentIndex++;
        touch();
        return Optional.of(new MockQuestionPrompt(question, mock.currentIndex, mock.questions.size()));
    }

    /** The question handed out last and not yet answered. */
    public MockQuestion currentMockQuestion() {
        MockSubstate mock = require().mock;
        if (mock.currentIndex == 0) {
            throw new SessionStateException("No mock question has been asked yet.");
        }
        if (mock.answeredCount >= mock.currentIndex) {
            throw new SessionStateException("Current mock question already answered; request the next one.");
        }
        return mock.questions.get(mock.currentIndex - 1);
    }

    public int mockQuestionCount() {
        return require().mock.questions.size();
    }

    public int mockAskedCount() {
        return require().mock.currentIndex;
    }

    public int mockAnsweredCount() {
        return require().mock.answeredCount;
    }

    public Difficulty mockDifficulty() {
        return require().mock.difficulty;
    }

    public List<Difficulty> mockDifficultyHistory() {
        return List.copyOf(require().mock.difficultyHistory);
    }

    public List<Double> mockScores() {
        return List.copyOf(require().mock.performanceScores);
    }

    public int followUpDepth() {
        return require().followUpDepth;
    }

    public PreviousExchange currentExchange() {
        Session session = require();
        if (session.currentQuestion == null || session.currentAnswer == null) {
            throw new SessionStateException("No answered question to follow up on.");
        }
        return new PreviousExchange(session.currentQuestion, session.currentAnswer);
    }

    public JobContext jobContext() {
        return require().job;
    }

    public InterviewMode mode() {
        return require().mode;
    }

    public SessionContextView getContext() {
        Session session = require();
        List<ConversationEntry> history = session.conversationHistory;
        int from = Math.max(0, history.size() - conversationWindow);
        return new SessionContextView(
            session.id,
            session.job,
            List.copyOf(session.keyRequirements),
            session.researchData,
            session.mode,
            List.copyOf(history.subList(from, history.size())),
            session.followUpDepth,
            session.awaitingFollowUp
        );
    }

    public PerformanceSummary performanceSummary() {
        Session session = require();
        List<CritiqueResult> critiques = session.practice.critiques;
        if (critiques.isEmpty()) return PerformanceSummary.empty();

        List<Double> scores = critiques.stream().map(CritiqueResult::overall).toList();
        double average = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new PerformanceSummary(
            average,
            session.practice.questionsAsked.size(),
            session.practice.followUpsAsked.size(),
            scores.subList(Math.max(0, scores.size() - LATEST_SCORES), scores.size())
        );
    }

    // -------------------------------------------------------------------------
    // Export / import
    // -------------------------------------------------------------------------

    public SessionSnapshot export() {
        Session s = require();
        PracticeSubstate p = s.practice;
        MockSubstate m = s.mock;
        return new SessionSnapshot(
            s.id,
            s.mode,
            s.job,
            List.copyOf(s.keyRequirements),
            s.researchData,
            new SessionSnapshot.Practice(
                List.copyOf(p.questionsAsked),
                List.copyOf(p.answersGiven),
                List.copyOf(p.followUpsAsked),
                List.copyOf(p.followUpAnswers),
                List.copyOf(p.critiques),
                List.copyOf(p.iterationHistory)
            ),
            new SessionSnapshot.Mock(
                List.copyOf(m.questions),
                m.currentIndex,
                m.answeredCount,
                m.difficulty,
                List.copyOf(m.difficultyHistory),
                List.copyOf(m.performanceScores)
            ),
            List.copyOf(s.conversationHistory),
            s.currentQuestion,
            s.currentAnswer,
            s.awaitingFollowUp,
            s.followUpDepth,
            s.createdAt,
            s.updatedAt
        );
    }

    /** Replaces the live session with the snapshot's content. */
    public void importSnapshot(SessionSnapshot snapshot) {
        if (snapshot == null || snapshot.job() == null) {
            throw new IllegalArgumentException("Snapshot with job context is required.");
        }
        SessionSnapshot.Mock mockSnapshot = snapshot.mock();
        if (mockSnapshot != null) {
            int size = nullToEmpty(mockSnapshot.generatedQuestions()).size();
            if (mockSnapshot.currentQuestionIndex() < 0 || mockSnapshot.currentQuestionIndex() > size
                || mockSnapshot.answeredCount() < 0
                || mockSnapshot.answeredCount() > mockSnapshot.currentQuestionIndex()) {
                throw new IllegalArgumentException("Snapshot mock progress is out of range.");
            }
        }

        String id = snapshot.sessionId() == null ? UUID.randomUUID().toString() : snapshot.sessionId();
        Session session = new Session(id, snapshot.job(),
            snapshot.mode() == null ? InterviewMode.PRACTICE : snapshot.mode(),
            snapshot.createdAt() == null ? clock.instant() : snapshot.createdAt());
        session.keyRequirements.addAll(nullToEmpty(snapshot.keyRequirements()));
        session.researchData = snapshot.researchData();
        session.conversationHistory.addAll(nullToEmpty(snapshot.conversationHistory()));
        session.currentQuestion = snapshot.currentQuestion();
        session.currentAnswer = snapshot.currentAnswer();
        session.awaitingFollowUp = snapshot.awaitingFollowUp();
        session.followUpDepth = Math.max(0, snapshot.followUpDepth());

        SessionSnapshot.Practice p = snapshot.practice();
        if (p != null) {
            session.practice.questionsAsked.addAll(nullToEmpty(p.questionsAsked()));
            session.practice.answersGiven.addAll(nullToEmpty(p.answersGiven()));
            session.practice.followUpsAsked.addAll(nullToEmpty(p.followUpsAsked()));
            session.practice.followUpAnswers.addAll(nullToEmpty(p.followUpAnswers()));
            session.practice.critiques.addAll(nullToEmpty(p.critiques()));
            session.practice.iterationHistory.addAll(nullToEmpty(p.iterationHistory()));
        }
        if (mockSnapshot != null) {
            MockSubstate mock = session.mock;
            mock.questions.addAll(nullToEmpty(mockSnapshot.generatedQuestions()));
            mock.currentIndex = mockSnapshot.currentQuestionIndex();
            mock.answeredCount = mockSnapshot.answeredCount();
            mock.performanceScores.addAll(nullToEmpty(mockSnapshot.performanceScores()));
            if (mockSnapshot.difficulty() != null) mock.difficulty = mockSnapshot.difficulty();
            if (mockSnapshot.difficultyHistory() != null && !mockSnapshot.difficultyHistory().isEmpty()) {
                mock.difficultyHistory.clear();
                mock.difficultyHistory.addAll(mockSnapshot.difficultyHistory());
            }
        }

        session.updatedAt = clock.instant();
        current = session;
        log.info("Session imported id={}", id);
    }

    // -------------------------------------------------------------------------

    private Session require() {
        if (current == null) throw new NoActiveSessionException();
        return current;
    }

    private void touch() {
        current.updatedAt = clock.instant();
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
