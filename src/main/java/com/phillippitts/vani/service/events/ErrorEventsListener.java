package com.phillippitts.vani.service.events;

import com.phillippitts.vani.service.dispatch.event.CollaboratorFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for collaborator failure events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCollaboratorFailure(CollaboratorFailureEvent e) {
        String key = "collaborator-" + e.collaborator() + '-' + e.reason();
        if (!shouldLog(key)) {
            return;
        }
        if (e.recovered()) {
            LOG.info("Collaborator {} {} ({}); fallback answered", e.collaborator(), e.reason(), e.message());
        } else {
            LOG.warn("Collaborator {} {}: {}. Check that it is configured and reachable.",
                    e.collaborator(), e.reason(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
