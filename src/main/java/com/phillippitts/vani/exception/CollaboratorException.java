package com.phillippitts.vani.exception;

/**
 * Thrown when an external collaborator (language model, vision model, search, desktop, speech)
 * fails. Collaborators must report failures this way rather than return empty data.
 */
public class CollaboratorException extends VaniException {

    private final String collaborator;

    public CollaboratorException(String message, String collaborator) {
        super(message + " (collaborator: " + collaborator + ")");
        this.collaborator = collaborator;
    }

    public CollaboratorException(String message, String collaborator, Throwable cause) {
        super(message + " (collaborator: " + collaborator + ")", cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
