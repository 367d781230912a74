package com.candidateprep.coach.service;

import com.candidateprep.coach.config.CoachProperties;
import com.candidateprep.coach.critique.CritiqueLoopController;
import com.candidateprep.coach.model.FollowUpOutcome;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.Question;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.session.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Answers follow-ups to the session's current question, up to the configured depth.
 * Depth only grows here; starting a new top-level question resets it.
 */
@Component
public class FollowUpController {

    private static final Logger log = LoggerFactory.getLogger(FollowUpController.class);

    private final CritiqueLoopController critiqueLoop;
    private final CoachProperties properties;

    public FollowUpController(CritiqueLoopController critiqueLoop, CoachProperties properties) {
        this.critiqueLoop = critiqueLoop;
        this.properties = properties;
    }

    public FollowUpOutcome handle(SessionStateStore store, String followUpQuestion) {
        int depth = store.followUpDepth();
        int maxDepth = properties.getFollowUpMaxDepth();
        if (depth >= maxDepth) {
            log.info("Follow-up rejected depth={} maxDepth={}", depth, maxDepth);
            return FollowUpOutcome.maxDepthReached(depth, maxDepth);
        }

        PreviousExchange original = store.currentExchange();
        store.addFollowUp(followUpQuestion);

        Question question = new Question(followUpQuestion, store.mode(), store.jobContext());
        QuestionResult result = critiqueLoop.process(question, original);
        store.addFollowUpAnswer(result.answer());

        log.info("Follow-up answered depth={} iterations={}", depth + 1, result.iterations());
        return FollowUpOutcome.answered(depth + 1, maxDepth, result);
    }
}
