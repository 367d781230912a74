package com.candidateprep.coach.model;

import java.util.Objects;

/**
 * A question as handed to the critique loop. The context is never null;
 * questions asked outside a session carry {@link JobContext#empty()}.
 */
public record Question(
    String text,
    InterviewMode mode,
    JobContext context
) {
    public Question {
        Objects.requireNonNull(text, "text");
        mode = mode == null ? InterviewMode.PRACTICE : mode;
        context = context == null ? JobContext.empty() : context;
    }

    public static Question practice(String text, JobContext context) {
        return new Question(text, InterviewMode.PRACTICE, context);
    }
}
