package com.phillippitts.vani.domain;

import com.phillippitts.vani.exception.EmptyUtteranceException;

import java.util.Objects;

/**
 * Output of the language normalizer.
 *
 * @param text     lower-cased, whitespace-collapsed text without terminal punctuation
 * @param language language detected from the script of the text
 */
public record NormalizedUtterance(String text, Language language) {

    public NormalizedUtterance {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(language, "language must not be null");
    }

    /**
     * Sentinel for empty or whitespace-only input. The dispatcher re-prompts instead of
     * attempting an intent match.
     */
    public static NormalizedUtterance empty(Language language) {
        return new NormalizedUtterance("", language);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /**
     * @return the text, never empty
     * @throws EmptyUtteranceException if nothing but whitespace or punctuation was heard
     */
    public String requireText() {
        if (text.isEmpty()) {
            throw new EmptyUtteranceException();
        }
        return text;
    }
}
