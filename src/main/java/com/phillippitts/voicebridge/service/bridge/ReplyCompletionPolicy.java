package com.phillippitts.voicebridge.service.bridge;

import com.phillippitts.voicebridge.config.properties.BridgeProperties;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides when the output buffered since a turn was sent forms a complete reply.
 *
 * <p>Evaluated repeatedly while a turn waits, each time with the whole buffer and the time
 * elapsed since the last output arrived.
 */
public interface ReplyCompletionPolicy {

    /**
     * @param buffered output received so far and not yet consumed
     * @param idleFor  time since the most recent output (or since the turn was sent, if none)
     * @return the completed reply, or empty while more output is expected
     */
    Optional<Completion> evaluate(CharSequence buffered, Duration idleFor);

    /**
     * A complete reply.
     *
     * @param reply    reply text
     * @param consumed number of leading buffer characters the reply used up
     */
    record Completion(String reply, int consumed) {
    }

    static ReplyCompletionPolicy from(BridgeProperties.Completion config) {
        return switch (config.getMode()) {
            case QUIESCENCE -> new QuiescencePolicy(config.getQuietPeriod());
            case SENTINEL -> new SentinelPolicy(config.getSentinel());
        };
    }
}
