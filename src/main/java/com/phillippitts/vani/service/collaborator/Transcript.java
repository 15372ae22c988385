package com.phillippitts.vani.service.collaborator;

import com.phillippitts.vani.domain.Language;

import java.util.Objects;

/**
 * Speech-to-text output.
 *
 * @param text         transcript, possibly empty
 * @param languageHint language reported by the engine; may be null and is not trusted over script detection
 */
public record Transcript(String text, Language languageHint) {

    public Transcript {
        Objects.requireNonNull(text, "text must not be null");
    }
}
