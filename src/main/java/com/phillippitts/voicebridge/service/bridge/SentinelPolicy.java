package com.phillippitts.voicebridge.service.bridge;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Treats a reply as complete when a line starting with a marker appears, typically the
 * CLI's input prompt. Text before the marker line is the reply.
 *
 * <p>A marker with nothing but whitespace before it (a bare prompt) does not complete the
 * reply; the marker is skipped and any text following it on the same line belongs to the reply.
 * A late startup prompt therefore never ends a turn with an empty reply.
 */
public final class SentinelPolicy implements ReplyCompletionPolicy {

    private final String marker;

    public SentinelPolicy(String marker) {
        this.marker = Objects.requireNonNull(marker, "marker");
        if (marker.isEmpty()) {
            throw new IllegalArgumentException("marker must not be empty");
        }
    }

    @Override
    public Optional<Completion> evaluate(CharSequence buffered, Duration idleFor) {
        String text = buffered.toString();
        int replyStart = 0;
        int lineStart = 0;
        while (true) {
            if (text.startsWith(marker, lineStart)) {
                String reply = text.substring(replyStart, lineStart);
                if (!reply.isBlank()) {
                    int lineEnd = text.indexOf('\n', lineStart);
                    return Optional.of(new Completion(reply, lineEnd < 0 ? text.length() : lineEnd + 1));
                }
                // bare prompt: skip the marker, keep whatever follows it on the line
                replyStart = lineStart + marker.length();
            }
            int next = text.indexOf('\n', lineStart);
            if (next < 0) {
                return Optional.empty();
            }
            lineStart = next + 1;
        }
    }

    @Override
    public String toString() {
        return "sentinel('" + marker + "')";
    }
}
