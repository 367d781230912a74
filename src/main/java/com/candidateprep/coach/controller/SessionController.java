package com.candidateprep.coach.controller;

import com.candidateprep.coach.model.CreateSessionRequest;
import com.candidateprep.coach.model.InterviewMode;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.PerformanceSummary;
import com.candidateprep.coach.model.SessionContextView;
import com.candidateprep.coach.model.SessionSnapshot;
import com.candidateprep.coach.service.InterviewCoachOrchestrator;
import com.candidateprep.coach.session.SessionRegistry;
import com.candidateprep.coach.validation.RequestValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final InterviewCoachOrchestrator orchestrator;
    private final RequestValidator validator;

    public SessionController(InterviewCoachOrchestrator orchestrator, RequestValidator validator) {
        this.orchestrator = orchestrator;
        this.validator = validator;
    }

    @PostMapping
    public SessionContextView create(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId,
        @RequestBody CreateSessionRequest request
    ) {
        JobContext job = validator.validateSession(request);
        InterviewMode mode = InterviewMode.fromValue(request.mode());
        return orchestrator.createSession(clientId, job, mode, validator.cleanTags(request.keyRequirements()));
    }

    @GetMapping("/current")
    public SessionContextView current(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.getSessionContext(clientId);
    }

    @GetMapping("/current/performance")
    public PerformanceSummary performance(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.performanceSummary(clientId);
    }

    @DeleteMapping("/current")
    public ResponseEntity<Void> clear(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        orchestrator.clearSession(clientId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/current/export")
    public SessionSnapshot export(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.exportSession(clientId);
    }

    @PostMapping("/import")
    public SessionContextView importSession(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId,
        @RequestBody SessionSnapshot snapshot
    ) {
        return orchestrator.importSession(clientId, snapshot);
    }
}
