package com.phillippitts.vani.exception;

import com.phillippitts.vani.domain.Language;

/**
 * Signals that no trigger pattern matched. Never surfaced to users because conversation is the
 * default intent; kept so resolver completeness can be tested with a strict lookup.
 */
public class UnresolvableIntentException extends VaniException {

    private final Language language;

    public UnresolvableIntentException(String text, Language language) {
        super("No trigger matched (" + language.tag() + ", chars=" + text.length() + ")");
        this.language = language;
    }

    public Language getLanguage() {
        return language;
    }
}
