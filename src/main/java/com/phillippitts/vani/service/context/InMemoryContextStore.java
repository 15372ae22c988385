package com.phillippitts.vani.service.context;

import com.phillippitts.vani.domain.ConversationTurn;
import com.phillippitts.vani.domain.SearchContext;
import com.phillippitts.vani.domain.SearchSource;
import com.phillippitts.vani.domain.Speaker;
import com.phillippitts.vani.domain.VisionContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link ContextStore}.
 *
 * <p><b>Staleness:</b> a vision context is owned by the user turn that produced (or last
 * referenced) it. Its age is the number of user turns committed since. Once the age reaches
 * the configured threshold the context is dropped and {@link #isVisionContextExpired()}
 * reports it until a new description arrives or the store is reset.
 *
 * <p><b>Thread Safety:</b> every read-modify-write runs under one {@link ReentrantLock}, so
 * {@link #apply(ContextUpdate)} is atomic with respect to readers.
 *
 * @since 1.0
 */
public final class InMemoryContextStore implements ContextStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryContextStore.class);

    private final Lock lock = new ReentrantLock();
    private final ConversationHistory history;
    private final int visionStalenessTurns;
    private final Clock clock;

    private long userTurns;
    private String visionDescription;
    private Instant visionCapturedAt;
    private long visionOwnerTurn;
    private boolean visionExpired;
    private SearchContext search;

    public InMemoryContextStore(int historyCapacity, int visionStalenessTurns) {
        this(historyCapacity, visionStalenessTurns, Clock.systemUTC());
    }

    public InMemoryContextStore(int historyCapacity, int visionStalenessTurns, Clock clock) {
        if (visionStalenessTurns <= 0) {
            throw new IllegalArgumentException("visionStalenessTurns must be > 0, got: " + visionStalenessTurns);
        }
        this.history = new ConversationHistory(historyCapacity);
        this.visionStalenessTurns = visionStalenessTurns;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void appendTurn(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        lock.lock();
        try {
            appendLocked(turn, false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ConversationTurn> recentTurns(int n) {
        lock.lock();
        try {
            return history.recent(n);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setVisionContext(String description) {
        Objects.requireNonNull(description, "description must not be null");
        lock.lock();
        try {
            setVisionLocked(description);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<VisionContext> getVisionContext() {
        lock.lock();
        try {
            if (visionDescription == null) {
                return Optional.empty();
            }
            return Optional.of(new VisionContext(visionDescription, visionCapturedAt, visionOwnerTurn,
                    userTurns - visionOwnerTurn));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isVisionContextExpired() {
        lock.lock();
        try {
            return visionExpired;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void refreshVisionContext() {
        lock.lock();
        try {
            if (visionDescription != null) {
                visionOwnerTurn = userTurns;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setSearchContext(String query, String result, SearchSource source) {
        lock.lock();
        try {
            search = new SearchContext(query, result, source, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SearchContext> getSearchContext() {
        lock.lock();
        try {
            return Optional.ofNullable(search);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            history.clear();
            userTurns = 0;
            clearVision();
            visionExpired = false;
            search = null;
            LOG.info("Context store reset");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void apply(ContextUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        if (update.isEmpty()) {
            return;
        }
        // Validate before the first write so a bad update changes nothing.
        SearchContext newSearch = update.hasSearch()
                ? new SearchContext(update.searchQuery(), update.searchResult(), update.searchSource(), clock.instant())
                : null;
        lock.lock();
        try {
            boolean visionRecorded = false;
            for (ConversationTurn turn : update.turns()) {
                boolean owner = !visionRecorded && turn.speaker() == Speaker.USER;
                appendLocked(turn, owner && touchesVision(update));
                if (owner) {
                    recordVisionLocked(update);
                    visionRecorded = true;
                }
            }
            if (!visionRecorded) {
                recordVisionLocked(update);
            }
            if (newSearch != null) {
                search = newSearch;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long committedUserTurns() {
        lock.lock();
        try {
            return userTurns;
        } finally {
            lock.unlock();
        }
    }

    public int historyCapacity() {
        return history.capacity();
    }

    private boolean touchesVision(ContextUpdate update) {
        return update.visionDescription() != null || (update.refreshVision() && visionDescription != null);
    }

    private void recordVisionLocked(ContextUpdate update) {
        if (update.visionDescription() != null) {
            setVisionLocked(update.visionDescription());
        } else if (update.refreshVision() && visionDescription != null) {
            visionOwnerTurn = userTurns;
        }
    }

    /**
     * @param visionTouched the turn being appended produces or references the vision context,
     *                      so it must not expire it
     */
    private void appendLocked(ConversationTurn turn, boolean visionTouched) {
        history.append(turn);
        if (turn.speaker() != Speaker.USER) {
            return;
        }
        userTurns++;
        if (!visionTouched && visionDescription != null && userTurns - visionOwnerTurn >= visionStalenessTurns) {
            LOG.debug("Vision context expired after {} user turns", userTurns - visionOwnerTurn);
            clearVision();
            visionExpired = true;
        }
    }

    private void setVisionLocked(String description) {
        visionDescription = description;
        visionCapturedAt = clock.instant();
        visionOwnerTurn = userTurns;
        visionExpired = false;
    }

    private void clearVision() {
        visionDescription = null;
        visionCapturedAt = null;
        visionOwnerTurn = 0;
    }
}
