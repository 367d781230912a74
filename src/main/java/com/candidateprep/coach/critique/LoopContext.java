package com.candidateprep.coach.critique;

import com.candidateprep.coach.model.CritiqueResult;
import com.candidateprep.coach.model.FollowUpPrediction;
import com.candidateprep.coach.model.IterationRecord;
import com.candidateprep.coach.model.KeyPoints;
import com.candidateprep.coach.model.ParseOutcome;
import com.candidateprep.coach.model.PreviousExchange;
import com.candidateprep.coach.model.Question;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.model.RetrievedContext;
import java.util.ArrayList;
import java.util.List;

/** Working state of one question's pass through the loop. Not shared between questions. */
final class LoopContext {

    static final String ERROR_ANSWER = "Unable to generate an answer right now. Please try again.";

    final Question question;
    final PreviousExchange previous;
    final List<IterationRecord> history = new ArrayList<>();

    String analysis = "";
    RetrievedContext context;
    String draft;
    int iterations;
    ParseOutcome<CritiqueResult> critique;
    boolean shouldIterate;
    String finalAnswer;
    KeyPoints keyPoints = KeyPoints.generic();
    List<FollowUpPrediction> followUps = List.of();
    String error;

    LoopContext(Question question, PreviousExchange previous) {
        this.question = question;
        this.previous = previous;
    }

    List<String> corrections() {
        if (iterations == 0 || critique == null) return List.of();
        return critique.value().improvements();
    }

    void recordError(String message) {
        error = error == null ? message : error + "; " + message;
    }

    QuestionResult toResult(LoopState finalState) {
        boolean failed = finalState == LoopState.ERROR;
        String answer = failed ? ERROR_ANSWER : (finalAnswer != null ? finalAnswer : draft);
        return new QuestionResult(
            question.text(),
            answer,
            analysis,
            failed ? KeyPoints.generic().keyPoints() : keyPoints.keyPoints(),
            failed ? KeyPoints.generic().deliveryTips() : keyPoints.deliveryTips(),
            failed ? List.of() : followUps,
            critique,
            iterations,
            shouldIterate,
            history,
            finalState,
            error
        );
    }
}
