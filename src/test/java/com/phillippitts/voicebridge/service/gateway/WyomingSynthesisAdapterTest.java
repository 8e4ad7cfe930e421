package com.phillippitts.voicebridge.service.gateway;

import com.phillippitts.voicebridge.config.properties.PiperEndpointConfig;
import com.phillippitts.voicebridge.exception.SynthesisException;
import com.phillippitts.voicebridge.service.audio.WavFormat;
import com.phillippitts.voicebridge.service.gateway.wyoming.WyomingEvent;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WyomingSynthesisAdapterTest {

    private SimpleMeterRegistry registry;
    private VoiceBridgeMetrics metrics;
    private EventCapturingPublisher publisher;
    private FakeWyomingServer server;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new VoiceBridgeMetrics(registry);
        publisher = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (server != null) {
            server.close();
        }
    }

    @Test
    void wrapsCollectedChunksInWavWithAnnouncedFormat() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            JSONObject format = new JSONObject().put("rate", 16000).put("width", 2).put("channels", 1);
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_START, format));
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, format, new byte[300]));
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, format, new byte[200]));
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_STOP, new JSONObject()));
        });

        byte[] wav = adapter(server.port(), "fr_FR-siwis-medium").synthesize("Bonjour", null);

        assertThat(WavFormat.isWav(wav)).isTrue();
        assertThat(wav).hasSize(44 + 500);
        ByteBuffer header = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(header.getShort(22)).isEqualTo((short) 1);
        assertThat(header.getInt(24)).isEqualTo(16000);
        assertThat(header.getInt(40)).isEqualTo(500);
        assertThat(registry.find("voicebridge.backend.latency").tag("backend", "piper").timer().count())
                .isEqualTo(1);
    }

    @Test
    void sendsTextAndConfiguredVoice() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, new JSONObject(), new byte[100]));
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_STOP, new JSONObject()));
        });

        adapter(server.port(), "fr_FR-siwis-medium").synthesize("Salut", null);

        JSONObject data = server.received.get(0).data();
        assertThat(data.getString("text")).isEqualTo("Salut");
        assertThat(data.getJSONObject("voice").getString("name")).isEqualTo("fr_FR-siwis-medium");
    }

    @Test
    void explicitVoiceOverridesConfiguredOne() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, new JSONObject(), new byte[100]));
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_STOP, new JSONObject()));
        });

        adapter(server.port(), "fr_FR-siwis-medium").synthesize("Hello", "en_US-lessac-medium");

        assertThat(server.received.get(0).data().getJSONObject("voice").getString("name"))
                .isEqualTo("en_US-lessac-medium");
    }

    @Test
    void defaultsToSynthesisFormatWhenNoneAnnounced() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, new JSONObject(), new byte[100]));
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_STOP, new JSONObject()));
        });

        byte[] wav = adapter(server.port(), "").synthesize("Hello", null);

        assertThat(server.received.get(0).data().has("voice")).isFalse();
        assertThat(ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN).getInt(24)).isEqualTo(22050);
    }

    @Test
    void blankTextIsRejectedWithoutConnecting() throws Exception {
        server = new FakeWyomingServer((conn, received) ->
                FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE));
        WyomingSynthesisAdapter adapter = adapter(server.port(), "");

        assertThatThrownBy(() -> adapter.synthesize("   ", null))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("blank");
        assertThat(server.received).isEmpty();
    }

    @Test
    void errorEventFails() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            conn.write(WyomingEvent.of(WyomingEvent.ERROR, new JSONObject().put("text", "unknown voice")));
        });
        WyomingSynthesisAdapter adapter = adapter(server.port(), "");

        assertThatThrownBy(() -> adapter.synthesize("Hello", null))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("unknown voice");
        assertThat(registry.find("voicebridge.backend.failure")
                .tag("backend", "piper").tag("reason", "protocol").counter().count()).isEqualTo(1.0);
    }

    @Test
    void stopWithoutAudioFails() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_START, new JSONObject()));
            conn.write(WyomingEvent.of(WyomingEvent.AUDIO_STOP, new JSONObject()));
        });
        WyomingSynthesisAdapter adapter = adapter(server.port(), "");

        assertThatThrownBy(() -> adapter.synthesize("Hello", null))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("no audio");
    }

    @Test
    void connectionClosedBeforeStopFails() throws Exception {
        server = new FakeWyomingServer((conn, received) -> {
            FakeWyomingServer.readUntil(conn, received, WyomingEvent.SYNTHESIZE);
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, new JSONObject(), new byte[100]));
        });
        WyomingSynthesisAdapter adapter = adapter(server.port(), "");

        assertThatThrownBy(() -> adapter.synthesize("Hello", null))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("before audio-stop");
    }

    private WyomingSynthesisAdapter adapter(int port, String voice) {
        return new WyomingSynthesisAdapter(new PiperEndpointConfig("127.0.0.1", port, 1000, 2000, voice),
                publisher, metrics);
    }
}
