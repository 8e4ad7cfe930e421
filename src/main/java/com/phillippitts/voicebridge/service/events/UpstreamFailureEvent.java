package com.phillippitts.voicebridge.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a backend (transcription, synthesis, assistant process) fails or rejects work.
 *
 * <p>PII note: Do not include transcript or reply text in context. Restrict to technical diagnostics.
 */
public record UpstreamFailureEvent(
        String component,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public UpstreamFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
