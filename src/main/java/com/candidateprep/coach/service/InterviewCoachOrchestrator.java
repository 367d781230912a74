package com.candidateprep.coach.service;

import com.candidateprep.coach.critique.CritiqueLoopController;
import com.candidateprep.coach.exception.SessionStateException;
import com.candidateprep.coach.model.Difficulty;
import com.candidateprep.coach.model.FollowUpOutcome;
import com.candidateprep.coach.model.InterviewMode;
import com.candidateprep.coach.model.IterationRecord;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.MockInterviewPackage;
import com.candidateprep.coach.model.MockInterviewSummary;
import com.candidateprep.coach.model.MockQuestion;
import com.candidateprep.coach.model.MockQuestionPrompt;
import com.candidateprep.coach.model.PerformanceSummary;
import com.candidateprep.coach.model.Question;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.model.SessionContextView;
import com.candidateprep.coach.model.SessionSnapshot;
import com.candidateprep.coach.session.SessionRegistry;
import com.candidateprep.coach.session.SessionStateStore;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The three workflows (prepare, practice, mock interview) plus session lifecycle,
 * each run against the calling client's own session store.
 */
@Service
public class InterviewCoachOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(InterviewCoachOrchestrator.class);

    private final SessionRegistry sessions;
    private final CritiqueLoopController critiqueLoop;
    private final FollowUpController followUps;
    private final AdaptiveDifficultyController difficulty;
    private final MockInterviewPreparer preparer;

    public InterviewCoachOrchestrator(
        SessionRegistry sessions,
        CritiqueLoopController critiqueLoop,
        FollowUpController followUps,
        AdaptiveDifficultyController difficulty,
        MockInterviewPreparer preparer
    ) {
        this.sessions = sessions;
        this.critiqueLoop = critiqueLoop;
        this.followUps = followUps;
        this.difficulty = difficulty;
        this.preparer = preparer;
    }

    // -------------------------------------------------------------------------
    // Session lifecycle
    // -------------------------------------------------------------------------

    public SessionContextView createSession(String clientId, JobContext job, InterviewMode mode, List<String> keyRequirements) {
        return sessions.withStore(clientId, store -> {
            store.createSession(job, mode, keyRequirements);
            return store.getContext();
        });
    }

    public SessionContextView getSessionContext(String clientId) {
        return sessions.withExistingStore(clientId, SessionStateStore::getContext);
    }

    public void clearSession(String clientId) {
        boolean removed = sessions.remove(clientId);
        log.info("Session cleared removed={}", removed);
    }

    public PerformanceSummary performanceSummary(String clientId) {
        return sessions.withExistingStore(clientId, SessionStateStore::performanceSummary);
    }

    public SessionSnapshot exportSession(String clientId) {
        return sessions.withExistingStore(clientId, SessionStateStore::export);
    }

    public SessionContextView importSession(String clientId, SessionSnapshot snapshot) {
        return sessions.withStore(clientId, store -> {
            store.importSnapshot(snapshot);
            return store.getContext();
        });
    }

    // -------------------------------------------------------------------------
    // Preparation
    // -------------------------------------------------------------------------

    /**
     * Researches the company and generates mock questions, then starts a fresh
     * preparation session holding both. Research and generation run before the
     * client's session is touched.
     */
    public MockInterviewPackage prepareForInterview(
        String clientId,
        JobContext job,
        boolean forceRefresh,
        Consumer<String> progress
    ) {
        MockInterviewPackage prepared = preparer.prepare(job, forceRefresh, Difficulty.MEDIUM, progress);
        sessions.withStore(clientId, store -> {
            store.createSession(job, InterviewMode.PREPARATION, List.of());
            store.addResearchData(prepared.researchData());
            store.addMockQuestions(prepared.questions());
            return null;
        });
        return prepared;
    }

    // -------------------------------------------------------------------------
    // Practice
    // -------------------------------------------------------------------------

    public QuestionResult practiceQuestion(String clientId, String questionText, boolean useSessionContext) {
        return sessions.withExistingStore(clientId,
            store -> practice(store, questionText, useSessionContext),
            () -> critiqueLoop.process(new Question(questionText, InterviewMode.PRACTICE, JobContext.empty())));
    }

    public FollowUpOutcome practiceFollowUp(String clientId, String followUpQuestion) {
        return sessions.withExistingStore(clientId, store -> followUps.handle(store, followUpQuestion));
    }

    private QuestionResult practice(SessionStateStore store, String questionText, boolean useSessionContext) {
        JobContext job = useSessionContext && store.hasSession() ? store.jobContext() : JobContext.empty();
        InterviewMode mode = store.hasSession() ? store.mode() : InterviewMode.PRACTICE;

        // new top-level question
        store.resetFollowUpDepth();
        QuestionResult result = critiqueLoop.process(new Question(questionText, mode, job));

        if (store.hasSession()) {
            store.addQuestion(questionText);
            store.addAnswer(result.answer(), result.scored() ? result.critique().value() : null);
            for (IterationRecord record : result.iterationHistory()) {
                store.addIteration(record);
            }
        }
        return result;
    }

    // -------------------------------------------------------------------------
    // Mock interview
    // -------------------------------------------------------------------------

    public MockQuestionPrompt startMockInterview(String clientId) {
        return sessions.withExistingStore(clientId, store -> {
            if (store.mockQuestionCount() == 0) {
                throw new SessionStateException("No mock questions available. Prepare for the interview first.");
            }
            if (store.mockAskedCount() > 0) {
                throw new SessionStateException("Mock interview already started; request the next question.");
            }
            store.setMode(InterviewMode.MOCK_INTERVIEW);
            return store.getNextMockQuestion()
                .orElseThrow(() -> new SessionStateException("Mock interview already finished."));
        });
    }

    public QuestionResult answerMockQuestion(String clientId) {
        return sessions.withExistingStore(clientId, store -> {
            MockQuestion current = store.currentMockQuestion();
            QuestionResult result = practice(store, current.question(), true);

            store.recordMockAnswer(result.scored() ? result.overallScore() : null);
            if (!result.scored()) return result;

            // cadence counts scored answers only
            List<Double> scores = store.mockScores();
            Difficulty before = store.mockDifficulty();
            Difficulty after = difficulty.recompute(before, scores);
            if (after != before) {
                store.setMockDifficulty(after);
                log.info("Mock difficulty adjusted {} -> {} after {} scored answers",
                    before.value(), after.value(), scores.size());
            }
            return result;
        });
    }

    public Optional<MockQuestionPrompt> nextMockQuestion(String clientId) {
        return sessions.withExistingStore(clientId, SessionStateStore::getNextMockQuestion);
    }

    public MockInterviewSummary mockInterviewSummary(String clientId) {
        return sessions.withExistingStore(clientId, store -> new MockInterviewSummary(
            store.performanceSummary(),
            store.mockAnsweredCount(),
            store.mockQuestionCount(),
            store.mockDifficulty(),
            store.mockDifficultyHistory(),
            store.mockScores()
        ));
    }
}
