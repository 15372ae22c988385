package com.phillippitts.vani.exception;

import java.util.Locale;

/**
 * A follow-up referenced vision or search context that has already expired.
 */
public class StaleContextException extends VaniException {

    public enum ContextKind { VISION, SEARCH }

    private final ContextKind kind;

    public StaleContextException(ContextKind kind) {
        super("Referenced " + kind.name().toLowerCase(Locale.ROOT) + " context has expired");
        this.kind = kind;
    }

    public ContextKind getKind() {
        return kind;
    }
}
