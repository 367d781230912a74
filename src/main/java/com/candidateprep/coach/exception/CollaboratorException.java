package com.candidateprep.coach.exception;

/**
 * Failure of an external call (model completion or web search): HTTP error,
 * timeout, or a response envelope that could not be read.
 */
public class CollaboratorException extends RuntimeException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
