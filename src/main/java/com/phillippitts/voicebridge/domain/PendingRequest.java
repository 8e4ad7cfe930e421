package com.phillippitts.voicebridge.domain;

import java.time.Instant;

/**
 * A voice request waiting for a recording surface to claim it.
 */
public record PendingRequest(String requestId, String language, Instant createdAt) {
}
