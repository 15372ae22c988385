package com.phillippitts.vani.service.turn.event;

import com.phillippitts.vani.domain.TurnResponse;

import java.time.Instant;

/**
 * Emitted after every turn, once the context store holds the turn's outcome.
 *
 * @param turnId    correlation id also present in the log ThreadContext
 * @param response  the turn's response
 * @param timestamp when the turn completed
 */
public record TurnCompletedEvent(
        String turnId,
        TurnResponse response,
        Instant timestamp
) {}
