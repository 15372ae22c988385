package com.phillippitts.vani.service.context;

import com.phillippitts.vani.domain.ConversationTurn;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Fixed-capacity FIFO of conversation turns. Appending to a full history evicts the oldest turn.
 *
 * <p>Not thread-safe; {@link InMemoryContextStore} guards it.
 */
final class ConversationHistory {

    private final int capacity;
    private final Deque<ConversationTurn> turns;

    ConversationHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.turns = new ArrayDeque<>(capacity);
    }

    void append(ConversationTurn turn) {
        if (turns.size() == capacity) {
            turns.removeFirst();
        }
        turns.addLast(turn);
    }

    /**
     * @return up to {@code n} most recent turns, oldest first
     */
    List<ConversationTurn> recent(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<ConversationTurn> out = new ArrayList<>(Math.min(n, turns.size()));
        Iterator<ConversationTurn> it = turns.descendingIterator();
        while (it.hasNext() && out.size() < n) {
            out.add(0, it.next());
        }
        return List.copyOf(out);
    }

    int size() {
        return turns.size();
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        turns.clear();
    }
}
