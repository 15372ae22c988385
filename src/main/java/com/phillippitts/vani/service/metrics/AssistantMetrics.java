package com.phillippitts.vani.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for assistant turns.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Turn latency per intent</li>
 *   <li>Turn outcomes per intent and status</li>
 *   <li>Collaborator failures per collaborator and reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class AssistantMetrics {

    private static final String METRIC_PREFIX = "vani";

    private final MeterRegistry registry;

    public AssistantMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end latency of one turn.
     *
     * @param intent        intent that handled the turn (lower-case name)
     * @param durationNanos duration in nanoseconds
     */
    public void recordTurnLatency(String intent, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time taken to process one utterance")
                .tag("intent", intent)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a finished turn.
     *
     * @param intent intent that handled the turn
     * @param status turn status (ok, missing_parameter, ...)
     */
    public void incrementOutcome(String intent, String status) {
        Counter.builder(METRIC_PREFIX + ".turn.outcome")
                .description("Number of turns by intent and outcome")
                .tag("intent", intent)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Counts a collaborator failure, recovered or not.
     *
     * @param collaborator collaborator name (web-search, camera, ...)
     * @param reason       failure reason (unavailable, timeout, failed)
     */
    public void incrementCollaboratorFailure(String collaborator, String reason) {
        Counter.builder(METRIC_PREFIX + ".collaborator.failure")
                .description("Number of failed collaborator calls")
                .tag("collaborator", collaborator)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
