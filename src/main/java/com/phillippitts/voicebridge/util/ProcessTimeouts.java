package com.phillippitts.voicebridge.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and pump-thread management.
 *
 * <p>Used by {@link com.phillippitts.voicebridge.service.bridge.InteractiveProcess} for the
 * conversational subprocess lifecycle. The graceful shutdown window itself is configurable
 * ({@code bridge.shutdown-grace}); the values here bound the steps that follow it.
 *
 * @see com.phillippitts.voicebridge.service.bridge.InteractiveProcess
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for pump threads during cleanup (best-effort; they are daemon threads).
     */
    public static final Duration PUMP_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     *
     * <p>Processes that survive this are typically unkillable due to OS bugs.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Interval at which a waiting turn re-checks for new output and quiescence.
     */
    public static final Duration OUTPUT_POLL_INTERVAL = Duration.ofMillis(25);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
