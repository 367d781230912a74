package com.candidateprep.coach.controller;

import com.candidateprep.coach.model.FollowUpOutcome;
import com.candidateprep.coach.model.FollowUpRequest;
import com.candidateprep.coach.model.PracticeQuestionRequest;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.service.InterviewCoachOrchestrator;
import com.candidateprep.coach.session.SessionRegistry;
import com.candidateprep.coach.validation.RequestValidator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/practice")
public class PracticeController {

    private final InterviewCoachOrchestrator orchestrator;
    private final RequestValidator validator;

    public PracticeController(InterviewCoachOrchestrator orchestrator, RequestValidator validator) {
        this.orchestrator = orchestrator;
        this.validator = validator;
    }

    @PostMapping("/questions")
    public QuestionResult practice(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId,
        @RequestBody PracticeQuestionRequest request
    ) {
        if (request == null) throw new IllegalArgumentException("Request body is required.");
        String question = validator.validateQuestion(request.question());
        boolean useSession = request.useSessionContext() == null || request.useSessionContext();
        return orchestrator.practiceQuestion(clientId, question, useSession);
    }

    @PostMapping("/follow-ups")
    public FollowUpOutcome followUp(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId,
        @RequestBody FollowUpRequest request
    ) {
        if (request == null) throw new IllegalArgumentException("Request body is required.");
        return orchestrator.practiceFollowUp(clientId, validator.validateQuestion(request.question()));
    }
}
