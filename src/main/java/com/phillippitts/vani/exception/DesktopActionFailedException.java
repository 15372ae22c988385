package com.phillippitts.vani.exception;

/**
 * A desktop action ran but did not succeed. The reason is user-facing and surfaced verbatim,
 * e.g. "firefox is not running".
 */
public class DesktopActionFailedException extends VaniException {

    private final String reason;

    public DesktopActionFailedException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public DesktopActionFailedException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
