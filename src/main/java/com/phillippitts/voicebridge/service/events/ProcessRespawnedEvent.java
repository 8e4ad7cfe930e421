package com.phillippitts.voicebridge.service.events;

import java.time.Instant;

/**
 * Published when a session's conversational process was found dead and replaced.
 *
 * @param sessionId affected session
 * @param at        when the replacement was spawned
 * @param exitCode  exit code of the dead process, or -1 when unknown
 * @param duringTurn true when the death was detected mid-turn (the turn was retried)
 */
public record ProcessRespawnedEvent(String sessionId, Instant at, int exitCode, boolean duringTurn) {
}
