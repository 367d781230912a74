package com.candidateprep.coach.exception;

/** The caller asked for something the current session state does not allow. */
public class SessionStateException extends RuntimeException {

    public SessionStateException(String message) {
        super(message);
    }
}
