package com.phillippitts.vani.service.metrics;

import com.phillippitts.vani.domain.Intent;
import com.phillippitts.vani.domain.TurnStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Records turn and collaborator metrics on behalf of the turn service and the dispatcher.
 *
 * <p><b>Null Safety:</b> all methods tolerate a missing {@link AssistantMetrics}, so the
 * pipeline runs without a meter registry in unit tests.
 *
 * @since 1.0
 * @see AssistantMetrics
 */
@Component
public final class TurnMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TurnMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and metric-less wiring. Never throws, records nothing.
     */
    public static final TurnMetricsPublisher NOOP = new TurnMetricsPublisher(null);

    private final AssistantMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public TurnMetricsPublisher(AssistantMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TurnMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records latency and outcome of a finished turn.
     */
    public void recordTurn(Intent intent, TurnStatus status, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String intentTag = tag(intent.name());
        metrics.recordTurnLatency(intentTag, durationNanos);
        metrics.incrementOutcome(intentTag, tag(status.name()));
    }

    public void recordCollaboratorFailure(String collaborator, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCollaboratorFailure(collaborator, reason);
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private static String tag(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
