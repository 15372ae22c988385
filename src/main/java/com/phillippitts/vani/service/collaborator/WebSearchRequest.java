package com.phillippitts.vani.service.collaborator;

import java.util.Objects;

public record WebSearchRequest(String query, SearchKind kind, int maxResults) {

    public WebSearchRequest {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be > 0, got: " + maxResults);
        }
    }
}
