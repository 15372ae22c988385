package com.phillippitts.vani.exception;

/**
 * Base exception for all assistant-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class VaniException extends RuntimeException {

    public VaniException(String message) {
        super(message);
    }

    public VaniException(String message, Throwable cause) {
        super(message, cause);
    }

    public VaniException(Throwable cause) {
        super(cause);
    }
}
