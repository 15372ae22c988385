package com.phillippitts.vani.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Last search query and its result, kept for "tell me more" follow-ups.
 */
public record SearchContext(String query, String result, SearchSource source, Instant at) {

    public SearchContext {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
