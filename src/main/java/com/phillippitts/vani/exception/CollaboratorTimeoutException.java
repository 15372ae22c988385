package com.phillippitts.vani.exception;

/**
 * The collaborator did not answer within its own timeout.
 */
public class CollaboratorTimeoutException extends CollaboratorException {

    private final long timeoutMs;

    public CollaboratorTimeoutException(String collaborator, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms", collaborator);
        this.timeoutMs = timeoutMs;
    }

    public CollaboratorTimeoutException(String collaborator, long timeoutMs, Throwable cause) {
        super("Timed out after " + timeoutMs + "ms", collaborator, cause);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
