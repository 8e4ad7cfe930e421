package com.phillippitts.voicebridge.service.bridge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically closes sessions whose last turn is older than {@code bridge.idle-timeout}.
 */
@Component
class IdleSessionEvictor {

    private static final Logger LOG = LogManager.getLogger(IdleSessionEvictor.class);

    private final ProcessBridge bridge;

    IdleSessionEvictor(ProcessBridge bridge) {
        this.bridge = bridge;
    }

    @Scheduled(fixedDelayString = "${bridge.eviction-interval-ms:60000}",
            initialDelayString = "${bridge.eviction-interval-ms:60000}")
    void sweep() {
        int evicted = bridge.evictIdle();
        if (evicted > 0) {
            LOG.info("Idle sweep closed {} session(s); {} still live", evicted, bridge.liveSessions());
        }
    }
}
