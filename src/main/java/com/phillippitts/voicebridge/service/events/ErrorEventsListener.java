package com.phillippitts.voicebridge.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for backend error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onUpstreamFailure(UpstreamFailureEvent e) {
        String key = "upstream-" + e.component() + '-' + e.context().getOrDefault("reason", "error");
        if (shouldLog(key)) {
            LOG.warn("Backend failure: component={}, message={}, context={}",
                    e.component(), e.message(), e.context());
        }
    }

    @EventListener
    void onProcessRespawned(ProcessRespawnedEvent e) {
        if (shouldLog("respawn-" + e.sessionId())) {
            LOG.warn("Assistant process for session {} died (exit={}) and was respawned; context was lost",
                    e.sessionId(), e.exitCode());
        }
    }

    @EventListener
    void onStaleOutputDiscarded(StaleOutputDiscardedEvent e) {
        if (shouldLog("stale-" + e.sessionId())) {
            LOG.warn("Discarded {} chars of late output for session {} after a timed-out turn",
                    e.discardedChars(), e.sessionId());
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
