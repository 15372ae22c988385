package com.phillippitts.vani.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the bounded conversation history.
 */
public record ConversationTurn(Speaker speaker, String text, Language language, Instant timestamp) {

    public ConversationTurn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static ConversationTurn user(String text, Language language) {
        return new ConversationTurn(Speaker.USER, text, language, Instant.now());
    }

    public static ConversationTurn assistant(String text, Language language) {
        return new ConversationTurn(Speaker.ASSISTANT, text, language, Instant.now());
    }
}
