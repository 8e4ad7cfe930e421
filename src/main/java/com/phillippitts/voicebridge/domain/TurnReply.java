package com.phillippitts.voicebridge.domain;

import java.util.Objects;

/**
 * Reply produced by one turn of a session's conversational process.
 *
 * @param sessionId            session that handled the turn
 * @param text                 reply text, trimmed
 * @param respawned            true when the process was restarted before or during this turn,
 *                             so earlier context is gone
 * @param staleOutputDiscarded true when late output of an earlier timed-out turn was dropped
 *                             before this turn started
 * @param durationMs           wall time spent on the turn
 */
public record TurnReply(
        String sessionId,
        String text,
        boolean respawned,
        boolean staleOutputDiscarded,
        long durationMs
) {
    public TurnReply {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
