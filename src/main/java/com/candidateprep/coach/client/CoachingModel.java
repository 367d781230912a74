package com.candidateprep.coach.client;

import com.candidateprep.coach.model.AnswerBrief;
import com.candidateprep.coach.model.MockQuestionBrief;
import com.candidateprep.coach.model.Question;
import java.util.List;

/**
 * Text-generation collaborator behind every step of the critique loop and mock
 * question generation. Structured steps return the raw model text; reading it is
 * the caller's job. Every method throws
 * {@link com.candidateprep.coach.exception.CollaboratorException} when the call fails.
 */
public interface CoachingModel {

    String analyzeQuestion(Question question);

    String draftAnswer(AnswerBrief brief);

    /** Raw critique text, expected to hold a JSON object with scores. */
    String critiqueAnswer(String question, String answer, String cvContext);

    String assessAlignment(String answer, String companyContext);

    /** Clarity and flow pass only; the listed strengths must survive. */
    String polishAnswer(String answer, List<String> strengths);

    String extractKeyPoints(String question, String answer);

    String predictFollowUps(String question, String answer);

    String generateMockQuestions(MockQuestionBrief brief);
}
