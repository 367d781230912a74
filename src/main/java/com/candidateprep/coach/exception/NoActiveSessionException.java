package com.candidateprep.coach.exception;

public class NoActiveSessionException extends SessionStateException {

    public NoActiveSessionException() {
        super("No active session. Create a session first.");
    }
}
