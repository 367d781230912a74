package com.candidateprep.coach.controller;

import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.MockInterviewPackage;
import com.candidateprep.coach.model.MockInterviewSummary;
import com.candidateprep.coach.model.MockQuestionPrompt;
import com.candidateprep.coach.model.PrepareInterviewRequest;
import com.candidateprep.coach.model.QuestionResult;
import com.candidateprep.coach.service.InterviewCoachOrchestrator;
import com.candidateprep.coach.session.SessionRegistry;
import com.candidateprep.coach.validation.RequestValidator;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/mock-interview")
public class MockInterviewController {

    private static final Logger log = LoggerFactory.getLogger(MockInterviewController.class);

    private final InterviewCoachOrchestrator orchestrator;
    private final RequestValidator validator;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public MockInterviewController(InterviewCoachOrchestrator orchestrator, RequestValidator validator) {
        this.orchestrator = orchestrator;
        this.validator = validator;
    }

    @PostMapping("/prepare")
    public MockInterviewPackage prepare(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId,
        @RequestBody PrepareInterviewRequest request
    ) {
        JobContext job = validator.validatePreparation(request);
        return orchestrator.prepareForInterview(clientId, job, request.forceRefresh(), null);
    }

    @PostMapping(path = "/prepare/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamPreparation(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId,
        @RequestBody PrepareInterviewRequest request
    ) {
        JobContext job = validator.validatePreparation(request);
        SseEmitter emitter = new SseEmitter(0L);

        executor.submit(() -> {
            try {
                MockInterviewPackage prepared = orchestrator.prepareForInterview(
                    clientId,
                    job,
                    request.forceRefresh(),
                    message -> sendEvent(emitter, "progress", message)
                );
                sendEvent(emitter, "result", prepared);
                emitter.complete();
            } catch (Exception ex) {
                log.warn("Streaming preparation failed company={}: {}", job.company(), ex.getMessage());
                try {
                    sendEvent(emitter, "error", "Preparation failed. Please try again.");
                } finally {
                    emitter.completeWithError(ex);
                }
            }
        });

        return emitter;
    }

    @PostMapping("/start")
    public MockQuestionPrompt start(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.startMockInterview(clientId);
    }

    @PostMapping("/answer")
    public QuestionResult answer(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.answerMockQuestion(clientId);
    }

    /** 204 once every question has been asked. */
    @PostMapping("/next")
    public ResponseEntity<MockQuestionPrompt> next(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.nextMockQuestion(clientId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/summary")
    public MockInterviewSummary summary(
        @RequestHeader(value = SessionRegistry.CLIENT_HEADER, required = false) String clientId
    ) {
        return orchestrator.mockInterviewSummary(clientId);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    private void sendEvent(SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException ex) {
            emitter.completeWithError(ex);
        }
    }
}
