package com.candidateprep.coach.critique;

public enum LoopState {
    ANALYZE,
    RETRIEVE,
    GENERATE,
    CRITIQUE,
    ITERATE,
    REFINE,
    EXTRACT,
    PREDICT_FOLLOWUPS,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
