package com.phillippitts.voicebridge.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a session's conversation history.
 *
 * @param speaker who produced the text
 * @param text    message text (may be empty)
 * @param at      when the entry was recorded
 */
public record Turn(Speaker speaker, String text, Instant at) {

    public Turn {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
