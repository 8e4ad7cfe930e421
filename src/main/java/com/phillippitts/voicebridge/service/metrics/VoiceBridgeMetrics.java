package com.phillippitts.voicebridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for the broker, the process bridge and the speech backends.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Backend call latency and failures (whisper, piper)</li>
 *   <li>Turn latency, failures and process respawns</li>
 *   <li>Claim outcomes and request timeouts</li>
 *   <li>Live session and pending request gauges</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class VoiceBridgeMetrics {

    private static final String METRIC_PREFIX = "voicebridge";

    private final MeterRegistry registry;

    public VoiceBridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a backend call.
     *
     * @param backend backend name (whisper, piper)
     * @param durationNanos duration in nanoseconds
     */
    public void recordBackendLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".backend.latency")
                .description("Time taken by speech backend calls")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementBackendFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".backend.failure")
                .description("Number of failed speech backend calls")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTurnLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time from writing a turn to receiving its complete reply")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the turn failure counter.
     *
     * @param reason timeout, conflict, process-death, capacity
     */
    public void incrementTurnFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".turn.failure")
                .description("Number of failed turns")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementRespawn() {
        Counter.builder(METRIC_PREFIX + ".process.respawn")
                .description("Number of assistant processes replaced after dying")
                .register(registry)
                .increment();
    }

    public void recordClaim(String outcome) {
        Counter.builder(METRIC_PREFIX + ".request.claim")
                .description("Claim attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementRequestTimedOut() {
        Counter.builder(METRIC_PREFIX + ".request.timeout")
                .description("Voice requests that timed out")
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge sampling {@code supplier}. Re-registering the same name is a no-op.
     */
    public void registerGauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(METRIC_PREFIX + "." + name, supplier)
                .description(description)
                .register(registry);
    }
}
