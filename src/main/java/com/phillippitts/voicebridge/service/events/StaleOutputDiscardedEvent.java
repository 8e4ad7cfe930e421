package com.phillippitts.voicebridge.service.events;

import java.time.Instant;

/**
 * Published when output of a timed-out turn arrived late and was dropped before the next turn.
 */
public record StaleOutputDiscardedEvent(String sessionId, Instant at, int discardedChars) {
}
