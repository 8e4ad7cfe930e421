package com.phillippitts.voicebridge.service.gateway;

import com.phillippitts.voicebridge.config.properties.PiperEndpointConfig;
import com.phillippitts.voicebridge.exception.SynthesisException;
import com.phillippitts.voicebridge.exception.UpstreamFailureExceptionBuilder;
import com.phillippitts.voicebridge.service.audio.SampleFormat;
import com.phillippitts.voicebridge.service.audio.WavWriter;
import com.phillippitts.voicebridge.service.events.UpstreamFailureEvent;
import com.phillippitts.voicebridge.service.gateway.wyoming.WyomingConnection;
import com.phillippitts.voicebridge.service.gateway.wyoming.WyomingEvent;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Synthesizes speech through a Wyoming text-to-speech service (wyoming-piper).
 *
 * <p>Sends {@code synthesize{text, voice}} and collects {@code audio-chunk} payloads until
 * {@code audio-stop}. The PCM is wrapped in a WAV container using the layout announced in
 * {@code audio-start} or the chunks, defaulting to 22050 Hz 16-bit mono.
 */
@Component
public class WyomingSynthesisAdapter implements SynthesisAdapter {

    private static final Logger LOG = LogManager.getLogger(WyomingSynthesisAdapter.class);
    static final String BACKEND = "piper";

    private final PiperEndpointConfig config;
    private final ApplicationEventPublisher publisher;
    private final VoiceBridgeMetrics metrics;

    public WyomingSynthesisAdapter(PiperEndpointConfig config,
                                   ApplicationEventPublisher publisher,
                                   VoiceBridgeMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public byte[] synthesize(String text, String voiceProfile) {
        if (text == null || text.isBlank()) {
            throw new SynthesisException("Nothing to synthesize: text is blank");
        }
        long start = System.nanoTime();
        try {
            byte[] wav = exchange(text, voiceProfile);
            metrics.recordBackendLatency(BACKEND, System.nanoTime() - start);
            LOG.info("Synthesized {} chars into {} bytes of WAV in {} ms", text.length(), wav.length,
                    TimeUtils.elapsedMillis(start));
            return wav;
        } catch (SynthesisException e) {
            metrics.incrementBackendFailure(BACKEND, "protocol");
            throw e;
        } catch (SocketTimeoutException e) {
            throw fail("timeout", "No audio within " + config.readTimeoutMs() + " ms", start, e);
        } catch (IOException e) {
            throw fail("io", "Synthesis service unavailable at " + endpoint(), start, e);
        }
    }

    private byte[] exchange(String text, String voiceProfile) throws IOException {
        String voice = voiceProfile != null && !voiceProfile.isBlank() ? voiceProfile : config.voice();
        JSONObject data = new JSONObject().put("text", text);
        if (voice != null && !voice.isBlank()) {
            data.put("voice", new JSONObject().put("name", voice));
        }

        try (WyomingConnection conn = WyomingConnection.open(config.host(), config.port(),
                config.connectTimeoutMs(), config.readTimeoutMs())) {
            conn.write(WyomingEvent.of(WyomingEvent.SYNTHESIZE, data));

            ByteArrayOutputStream pcm = new ByteArrayOutputStream();
            SampleFormat format = SampleFormat.SYNTHESIS_DEFAULT;
            while (true) {
                WyomingEvent event = conn.read();
                if (event == null) {
                    throw new SynthesisException("Synthesis service closed the connection before audio-stop");
                }
                if (event.is(WyomingEvent.AUDIO_START) || event.is(WyomingEvent.AUDIO_CHUNK)) {
                    format = formatOf(event.data(), format);
                    pcm.write(event.payload());
                } else if (event.is(WyomingEvent.AUDIO_STOP)) {
                    break;
                } else if (event.is(WyomingEvent.ERROR)) {
                    throw new SynthesisException("Synthesis service error: "
                            + event.data().optString("text", "unknown"));
                }
            }
            if (pcm.size() == 0) {
                throw new SynthesisException("Synthesis service returned no audio");
            }
            return WavWriter.toWav(pcm.toByteArray(), format);
        }
    }

    private static SampleFormat formatOf(JSONObject data, SampleFormat fallback) {
        return new SampleFormat(
                data.optInt("rate", fallback.rate()),
                data.optInt("width", fallback.width()),
                data.optInt("channels", fallback.channels()));
    }

    private SynthesisException fail(String reason, String message, long startNanos, Throwable cause) {
        metrics.incrementBackendFailure(BACKEND, reason);
        if (publisher != null) {
            publisher.publishEvent(new UpstreamFailureEvent(BACKEND, Instant.now(), message, cause,
                    Map.of("reason", reason, "endpoint", endpoint())));
        }
        return UpstreamFailureExceptionBuilder.create(message)
                .cause(cause)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("endpoint", endpoint())
                .build(SynthesisException::new);
    }

    @Override
    public String endpoint() {
        return config.endpoint();
    }
}
