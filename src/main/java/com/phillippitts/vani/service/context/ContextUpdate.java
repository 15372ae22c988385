package com.phillippitts.vani.service.context;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.SearchSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything one turn writes to the {@link ContextStore}, applied in a single
 * {@link ContextStore#apply(ContextUpdate)} call so a failed turn leaves no partial state.
 *
 * <p>Application order: turns are appended in order; the vision description (or refresh) is
 * recorded right after the first user turn, so it is owned by that turn; the search context
 * is replaced last.
 */
public final class ContextUpdate {

    private final List<ConversationTurn> turns;
    private final String visionDescription;
    private final boolean refreshVision;
    private final String searchQuery;
    private final String searchResult;
    private final SearchSource searchSource;

    private ContextUpdate(Builder b) {
        this.turns = List.copyOf(b.turns);
        this.visionDescription = b.visionDescription;
        this.refreshVision = b.refreshVision;
        this.searchQuery = b.searchQuery;
        this.searchResult = b.searchResult;
        this.searchSource = b.searchSource;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ConversationTurn> turns() {
        return turns;
    }

    /** New vision description, or null to leave the vision context alone. */
    public String visionDescription() {
        return visionDescription;
    }

    /** True when a follow-up reused the current vision context and its age resets. */
    public boolean refreshVision() {
        return refreshVision;
    }

    public boolean hasSearch() {
        return searchSource != null;
    }

    public String searchQuery() {
        return searchQuery;
    }

    public String searchResult() {
        return searchResult;
    }

    public SearchSource searchSource() {
        return searchSource;
    }

    public boolean isEmpty() {
        return turns.isEmpty() && visionDescription == null && !refreshVision && !hasSearch();
    }

    public static final class Builder {
        private final List<ConversationTurn> turns = new ArrayList<>();
        private String visionDescription;
        private boolean refreshVision;
        private String searchQuery;
        private String searchResult;
        private SearchSource searchSource;

        private Builder() {
        }

        public Builder turn(ConversationTurn turn) {
            turns.add(Objects.requireNonNull(turn, "turn must not be null"));
            return this;
        }

        public Builder vision(String description) {
            this.visionDescription = Objects.requireNonNull(description, "description must not be null");
            return this;
        }

        public Builder refreshVision() {
            this.refreshVision = true;
            return this;
        }

        public Builder search(String query, String result, SearchSource source) {
            this.searchQuery = Objects.requireNonNull(query, "query must not be null");
            this.searchResult = Objects.requireNonNull(result, "result must not be null");
            this.searchSource = Objects.requireNonNull(source, "source must not be null");
            return this;
        }

        public ContextUpdate build() {
            return new ContextUpdate(this);
        }
    }
}
