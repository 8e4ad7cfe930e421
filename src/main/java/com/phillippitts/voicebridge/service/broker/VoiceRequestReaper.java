package com.phillippitts.voicebridge.service.broker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs {@link VoiceRequestBroker#reap()} on a fixed delay ({@code broker.reap-interval-ms}).
 */
@Component
class VoiceRequestReaper {

    private static final Logger LOG = LogManager.getLogger(VoiceRequestReaper.class);

    private final VoiceRequestBroker broker;

    VoiceRequestReaper(VoiceRequestBroker broker) {
        this.broker = broker;
    }

    @Scheduled(fixedDelayString = "${broker.reap-interval-ms:1000}")
    void sweep() {
        ReapSummary summary = broker.reap();
        if (!summary.isEmpty()) {
            LOG.debug("Reaper: reverted={}, timedOut={}, removed={}, remaining={}",
                    summary.reverted(), summary.timedOut(), summary.removed(), broker.size());
        }
    }
}
