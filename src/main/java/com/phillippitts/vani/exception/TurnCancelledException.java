package com.phillippitts.vani.exception;

/**
 * The user interrupted the turn. Held devices are released and the context store keeps its
 * last committed state.
 */
public class TurnCancelledException extends VaniException {

    public TurnCancelledException(String message) {
        super(message);
    }

    public TurnCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
