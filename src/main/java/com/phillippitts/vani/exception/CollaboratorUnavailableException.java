package com.phillippitts.vani.exception;

/**
 * The collaborator could not be reached or is not configured.
 */
public class CollaboratorUnavailableException extends CollaboratorException {

    public CollaboratorUnavailableException(String message, String collaborator) {
        super(message, collaborator);
    }

    public CollaboratorUnavailableException(String message, String collaborator, Throwable cause) {
        super(message, collaborator, cause);
    }
}
