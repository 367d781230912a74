package com.candidateprep.coach.validation;

import com.candidateprep.coach.model.CreateSessionRequest;
import com.candidateprep.coach.model.JobContext;
import com.candidateprep.coach.model.PrepareInterviewRequest;
import com.candidateprep.coach.model.ProfileTextRequest;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Validates and trims inbound requests before they reach the orchestrator.
 * Failures are {@link IllegalArgumentException}s with user-safe messages.
 */
@Component
public class RequestValidator {

    private static final int MAX_COMPANY_CHARS = 200;
    private static final int MAX_POSITION_CHARS = 200;
    private static final int MAX_QUESTION_CHARS = 1_000;
    private static final int MAX_JOB_DESC_CHARS = 8_000;
    private static final int MAX_CV_CHARS = 50_000;
    private static final int MAX_EXPERIENCE_CHARS = 5_000;
    private static final int MAX_TAGS = 20;

    public JobContext validateSession(CreateSessionRequest request) {
        requireBody(request);
        return new JobContext(
            sanitize(request.company(), MAX_COMPANY_CHARS, "Company"),
            sanitize(request.position(), MAX_POSITION_CHARS, "Position"),
            sanitize(request.jobDescription(), MAX_JOB_DESC_CHARS, "Job description"));
    }

    public JobContext validatePreparation(PrepareInterviewRequest request) {
        requireBody(request);
        return new JobContext(
            requireNonBlank(sanitize(request.company(), MAX_COMPANY_CHARS, "Company"), "Company"),
            requireNonBlank(sanitize(request.position(), MAX_POSITION_CHARS, "Position"), "Position"),
            sanitize(request.jobDescription(), MAX_JOB_DESC_CHARS, "Job description"));
    }

    public String validateQuestion(String question) {
        return requireNonBlank(sanitize(question, MAX_QUESTION_CHARS, "Question"), "Question");
    }

    public String validateCv(ProfileTextRequest request) {
        requireBody(request);
        return requireNonBlank(sanitize(request.text(), MAX_CV_CHARS, "CV text"), "CV text");
    }

    public String validateExperience(ProfileTextRequest request) {
        requireBody(request);
        if (request.tags() != null && request.tags().size() > MAX_TAGS) {
            throw new IllegalArgumentException("At most " + MAX_TAGS + " tags are allowed.");
        }
        return requireNonBlank(sanitize(request.text(), MAX_EXPERIENCE_CHARS, "Experience"), "Experience");
    }

    public List<String> cleanTags(List<String> tags) {
        if (tags == null) return List.of();
        return tags.stream().filter(t -> t != null && !t.isBlank()).map(String::strip).toList();
    }

    // -------------------------------------------------------------------------

    private void requireBody(Object request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required.");
        }
    }

    private String sanitize(String value, int maxChars, String fieldName) {
        if (value == null) return null;
        String trimmed = value.strip();
        if (trimmed.length() > maxChars) {
            throw new IllegalArgumentException(
                fieldName + " exceeds maximum length of " + maxChars + " characters.");
        }
        return trimmed;
    }

    private String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        return value;
    }
}
