package com.candidateprep.coach.model;

public record JobContext(
    String company,
    String position,
    String description
) {
    private static final JobContext EMPTY = new JobContext("", "", "");

    public JobContext {
        company = company == null ? "" : company.trim();
        position = position == null ? "" : position.trim();
        description = description == null ? "" : description.trim();
    }

    public static JobContext empty() {
        return EMPTY;
    }

    public boolean hasCompany() {
        return !company.isEmpty();
    }
}
