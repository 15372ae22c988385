package com.phillippitts.vani.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Raw transcript as handed over by the speech-to-text collaborator.
 *
 * @param text         transcript text (may be empty; silence transcribes to nothing)
 * @param languageHint language reported by the STT engine; unreliable and nullable
 * @param timestamp    when the transcript was produced
 */
public record Utterance(String text, Language languageHint, Instant timestamp) {

    public Utterance {
        Objects.requireNonNull(text, "Utterance text must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
    }

    public static Utterance of(String text, Language languageHint) {
        return new Utterance(text, languageHint, Instant.now());
    }
}
