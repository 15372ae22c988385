package com.phillippitts.vani.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Languages the assistant understands. Selects the trigger set and the response templates.
 */
public enum Language {
    ENGLISH("en"),
    HINDI("hi"),
    GUJARATI("gu");

    private final String tag;

    Language(String tag) {
        this.tag = tag;
    }

    /**
     * @return ISO 639-1 tag used by the speech collaborators ("en", "hi", "gu")
     */
    public String tag() {
        return tag;
    }

    /**
     * Looks up a language by its ISO 639-1 tag.
     *
     * @param tag language tag, case-insensitive (nullable)
     * @return the matching language, or empty when the tag is null, blank or unsupported
     */
    public static Optional<Language> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.tag.equals(normalized)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
