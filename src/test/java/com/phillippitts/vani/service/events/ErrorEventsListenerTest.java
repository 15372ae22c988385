package com.phillippitts.vani.service.events;

import com.phillippitts.vani.service.dispatch.event.CollaboratorFailureEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThat(l.shouldLog("collaborator-camera-unavailable")).isTrue();
        assertThat(l.shouldLog("collaborator-camera-unavailable")).isFalse();
        // other keys are throttled separately
        assertThat(l.shouldLog("collaborator-camera-timeout")).isTrue();
    }

    @Test
    void handlerDoesNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThatCode(() -> {
            l.onCollaboratorFailure(new CollaboratorFailureEvent("web-search", "timeout", "Timed out", true,
                    Instant.now()));
            l.onCollaboratorFailure(new CollaboratorFailureEvent("camera", "unavailable", "no device", false,
                    null));
        }).doesNotThrowAnyException();
    }

    @Test
    void eventDefaultsMissingTimestamp() {
        CollaboratorFailureEvent e = new CollaboratorFailureEvent("desktop", "failed", "x", false, null);
        assertThat(e.at()).isNotNull();
    }
}
