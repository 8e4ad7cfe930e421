package com.phillippitts.voicebridge.service.events;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThat(l.shouldLog("upstream-whisper-timeout")).isTrue();
        assertThat(l.shouldLog("upstream-whisper-timeout")).isFalse();
        assertThat(l.shouldLog("upstream-piper-timeout")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();

        assertThatCode(() -> {
            l.onUpstreamFailure(new UpstreamFailureEvent("whisper", Instant.now(), "unreachable",
                    new IOException("Connection refused"), Map.of("reason", "io")));
            l.onUpstreamFailure(new UpstreamFailureEvent("piper", null, "no audio", null, null));
            l.onProcessRespawned(new ProcessRespawnedEvent("a1b2c3d4", Instant.now(), 137, true));
            l.onStaleOutputDiscarded(new StaleOutputDiscardedEvent("a1b2c3d4", Instant.now(), 42));
        }).doesNotThrowAnyException();
    }

    @Test
    void upstreamFailureEventNormalizesMissingFields() {
        UpstreamFailureEvent e = new UpstreamFailureEvent("piper", null, "no audio", null, null);

        assertThat(e.at()).isNotNull();
        assertThat(e.context()).isEmpty();
    }
}
