package com.phillippitts.vani.service.context;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.SearchContext;
import com.phillippitts.vani.domain.SearchSource;
import com.phillippitts.vani.domain.VisionContext;

import java.util.List;
import java.util.Optional;

/**
 * Bounded short-term memory of one session: conversation history, last visual description
 * and last search result.
 *
 * <p>Only the dispatcher writes to it. Capacity and staleness thresholds are fixed when the
 * store is created.
 */
public interface ContextStore {

    /**
     * Appends a turn, evicting the oldest one when the history is full. Each user turn ages the
     * vision context by one.
     */
    void appendTurn(ConversationTurn turn);

    /**
     * @param n maximum number of turns; non-positive yields an empty list
     * @return most recent turns, oldest first
     */
    List<ConversationTurn> recentTurns(int n);

    /**
     * Records a fresh visual description owned by the latest user turn.
     */
    void setVisionContext(String description);

    /**
     * @return the vision context, or empty when none was captured, it was reset, or it went stale
     */
    Optional<VisionContext> getVisionContext();

    /**
     * @return true when a vision context existed but expired through staleness (as opposed to
     *         never existing or being reset)
     */
    boolean isVisionContextExpired();

    /**
     * Resets the age of the current vision context after a follow-up referenced it.
     */
    void refreshVisionContext();

    void setSearchContext(String query, String result, SearchSource source);

    Optional<SearchContext> getSearchContext();

    /**
     * Clears history, vision and search context atomically.
     */
    void reset();

    /**
     * Applies every write of one turn atomically.
     */
    void apply(ContextUpdate update);

    /**
     * @return user turns committed since creation or the last reset
     */
    long committedUserTurns();
}
