package com.phillippitts.voicebridge.service.broker;

import com.phillippitts.voicebridge.config.properties.BrokerProperties;
import com.phillippitts.voicebridge.domain.VoiceRequestState;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceRequestReaperTest {

    @Test
    void sweepTimesOutAndLaterRemovesAbandonedRequests() {
        MutableClock clock = new MutableClock();
        BrokerProperties props = new BrokerProperties();
        props.setRetention(Duration.ofMinutes(5));
        InMemoryVoiceRequestBroker broker = new InMemoryVoiceRequestBroker(props,
                new VoiceBridgeMetrics(new SimpleMeterRegistry()), clock);
        VoiceRequestReaper reaper = new VoiceRequestReaper(broker);
        String id = broker.createRequest("fr", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(11));
        reaper.sweep();
        assertThat(broker.getResult(id)).map(VoiceRequestStatus::state).contains(VoiceRequestState.TIMED_OUT);

        clock.advance(Duration.ofMinutes(6));
        reaper.sweep();
        assertThat(broker.getResult(id)).isEmpty();
        assertThat(broker.size()).isZero();
    }
}
