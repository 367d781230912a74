package com.candidateprep.coach.model;

/**
 * Context gathered once per question and left untouched for the rest of the loop.
 * {@code previous} is set only when answering a follow-up.
 */
public record RetrievedContext(
    String cv,
    String experience,
    String personality,
    String company,
    PreviousExchange previous
) {
    public boolean hasCompanyContext() {
        return company != null && !company.isBlank();
    }
}
