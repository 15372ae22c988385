package com.phillippitts.vani.service.dispatch.event;

import java.time.Instant;

/**
 * Published whenever a collaborator call fails, including failures a fallback recovered from.
 *
 * <p>PII note: {@code message} carries the exception message only, never utterance text.
 *
 * @param collaborator collaborator name
 * @param reason       unavailable, timeout or failed
 * @param message      technical diagnostic
 * @param recovered    true when a fallback still produced an answer
 * @param at           when the failure was observed
 */
public record CollaboratorFailureEvent(
        String collaborator,
        String reason,
        String message,
        boolean recovered,
        Instant at
) {
    public CollaboratorFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
