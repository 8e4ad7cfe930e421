package com.phillippitts.voicebridge.service.bridge;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Treats a reply as complete once non-blank output has been followed by a quiet period.
 */
public final class QuiescencePolicy implements ReplyCompletionPolicy {

    private final Duration quietPeriod;

    public QuiescencePolicy(Duration quietPeriod) {
        this.quietPeriod = Objects.requireNonNull(quietPeriod, "quietPeriod");
        if (quietPeriod.isNegative() || quietPeriod.isZero()) {
            throw new IllegalArgumentException("quietPeriod must be positive");
        }
    }

    @Override
    public Optional<Completion> evaluate(CharSequence buffered, Duration idleFor) {
        if (buffered.toString().isBlank() || idleFor.compareTo(quietPeriod) < 0) {
            return Optional.empty();
        }
        return Optional.of(new Completion(buffered.toString(), buffered.length()));
    }

    @Override
    public String toString() {
        return "quiescence(" + quietPeriod.toMillis() + "ms)";
    }
}
