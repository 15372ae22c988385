package com.phillippitts.vani.service.dispatch;

import com.phillippitts.vani.domain.Language;

import java.util.Objects;

/**
 * Fixed configuration handed to the dispatcher at construction.
 *
 * @param name                assistant name used in English responses and prompts
 * @param nameHindi           assistant name in Devanagari
 * @param nameGujarati        assistant name in Gujarati script
 * @param defaultBrowser      browser used when a website command names none; blank for the system default
 * @param webSearchEnabled    when false, search and knowledge turns go to the conversation model
 * @param maxSearchResults    web search hits requested and summarized
 * @param promptHistorySize   history turns considered for each conversation prompt
 */
public record DispatchSettings(String name,
                               String nameHindi,
                               String nameGujarati,
                               String defaultBrowser,
                               boolean webSearchEnabled,
                               int maxSearchResults,
                               int promptHistorySize) {

    public DispatchSettings {
        Objects.requireNonNull(name, "name must not be null");
        nameHindi = nameHindi == null || nameHindi.isBlank() ? name : nameHindi;
        nameGujarati = nameGujarati == null || nameGujarati.isBlank() ? name : nameGujarati;
        defaultBrowser = defaultBrowser == null ? "" : defaultBrowser.trim();
        if (maxSearchResults <= 0) {
            throw new IllegalArgumentException("maxSearchResults must be > 0, got: " + maxSearchResults);
        }
        if (promptHistorySize < 0) {
            throw new IllegalArgumentException("promptHistorySize must be >= 0, got: " + promptHistorySize);
        }
    }

    public static DispatchSettings defaults() {
        return new DispatchSettings("Vani", "वाणी", "વાણી", "firefox", true, 3, 6);
    }

    public String nameIn(Language language) {
        return switch (language) {
            case ENGLISH -> name;
            case HINDI -> nameHindi;
            case GUJARATI -> nameGujarati;
        };
    }

    public boolean hasDefaultBrowser() {
        return !defaultBrowser.isEmpty();
    }
}
