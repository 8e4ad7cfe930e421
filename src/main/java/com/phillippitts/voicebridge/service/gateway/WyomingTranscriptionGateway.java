package com.phillippitts.voicebridge.service.gateway;

import com.phillippitts.voicebridge.config.properties.WhisperEndpointConfig;
import com.phillippitts.voicebridge.exception.TranscriptionException;
import com.phillippitts.voicebridge.exception.UpstreamFailureExceptionBuilder;
import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.audio.SampleFormat;
import com.phillippitts.voicebridge.service.events.UpstreamFailureEvent;
import com.phillippitts.voicebridge.service.gateway.wyoming.WyomingConnection;
import com.phillippitts.voicebridge.service.gateway.wyoming.WyomingEvent;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.util.LogSanitizer;
import com.phillippitts.voicebridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Transcribes audio through a Wyoming speech-to-text service (wyoming-faster-whisper).
 *
 * <p>Event sequence per call: {@code transcribe{language}}, {@code audio-start}, one
 * {@code audio-chunk} per 1024 samples, {@code audio-stop}, then events are read until a
 * {@code transcript} arrives. The service handles one stream at a time well, so calls are
 * serialized through a {@link ConcurrencyGuard} sized by {@code wyoming.whisper.max-concurrent}.
 */
@Component
public class WyomingTranscriptionGateway implements TranscriptionGateway {

    private static final Logger LOG = LogManager.getLogger(WyomingTranscriptionGateway.class);
    static final String BACKEND = "whisper";

    private final WhisperEndpointConfig config;
    private final ConcurrencyGuard guard;
    private final ApplicationEventPublisher publisher;
    private final VoiceBridgeMetrics metrics;

    public WyomingTranscriptionGateway(WhisperEndpointConfig config,
                                       ApplicationEventPublisher publisher,
                                       VoiceBridgeMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.guard = new ConcurrencyGuard(config.maxConcurrent(), config.acquireTimeoutMs(), BACKEND, publisher);
    }

    @Override
    public String transcribe(byte[] pcm, SampleFormat format, String language) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(format, "format must not be null");

        guard.acquire();
        long start = System.nanoTime();
        try {
            String text = exchange(pcm, format, language);
            metrics.recordBackendLatency(BACKEND, System.nanoTime() - start);
            LOG.info("Transcribed {} bytes in {} ms ({} chars)", pcm.length, TimeUtils.elapsedMillis(start),
                    text.length());
            LOG.debug("Transcript: {}", LogSanitizer.preview(text, 120));
            return text;
        } catch (TranscriptionException e) {
            metrics.incrementBackendFailure(BACKEND, "protocol");
            throw e;
        } catch (SocketTimeoutException e) {
            throw fail("timeout", "No transcript within " + config.readTimeoutMs() + " ms", start, e);
        } catch (IOException e) {
            throw fail("io", "Transcription service unavailable at " + endpoint(), start, e);
        } finally {
            guard.release();
        }
    }

    private String exchange(byte[] pcm, SampleFormat format, String language) throws IOException {
        try (WyomingConnection conn = WyomingConnection.open(config.host(), config.port(),
                config.connectTimeoutMs(), config.readTimeoutMs())) {

            JSONObject transcribe = new JSONObject();
            if (language != null && !language.isBlank()) {
                transcribe.put("language", language);
            }
            conn.write(WyomingEvent.of(WyomingEvent.TRANSCRIBE, transcribe));
            streamAudio(conn, pcm, format);

            for (int i = 0; i < config.maxEvents(); i++) {
                WyomingEvent event = conn.read();
                if (event == null) {
                    throw new TranscriptionException("Transcription service closed the connection without a transcript");
                }
                if (event.is(WyomingEvent.TRANSCRIPT)) {
                    return event.data().optString("text", "").strip();
                }
                if (event.is(WyomingEvent.ERROR)) {
                    throw new TranscriptionException("Transcription service error: "
                            + event.data().optString("text", "unknown"));
                }
                LOG.debug("Ignoring Wyoming event '{}' while awaiting transcript", event.type());
            }
            throw new TranscriptionException("No transcript among the first " + config.maxEvents() + " events");
        }
    }

    private static void streamAudio(WyomingConnection conn, byte[] pcm, SampleFormat format) throws IOException {
        conn.write(WyomingEvent.of(WyomingEvent.AUDIO_START, audioData(format, 0)));

        int chunkBytes = AudioFormat.SAMPLES_PER_CHUNK * format.blockAlign();
        for (int offset = 0; offset < pcm.length; offset += chunkBytes) {
            int end = Math.min(pcm.length, offset + chunkBytes);
            long timestampMs = format.durationMillis(offset);
            conn.write(new WyomingEvent(WyomingEvent.AUDIO_CHUNK, audioData(format, timestampMs),
                    Arrays.copyOfRange(pcm, offset, end)));
        }

        conn.write(WyomingEvent.of(WyomingEvent.AUDIO_STOP,
                new JSONObject().put("timestamp", format.durationMillis(pcm.length))));
    }

    private static JSONObject audioData(SampleFormat format, long timestampMs) {
        return new JSONObject()
                .put("rate", format.rate())
                .put("width", format.width())
                .put("channels", format.channels())
                .put("timestamp", timestampMs);
    }

    private TranscriptionException fail(String reason, String message, long startNanos, Throwable cause) {
        metrics.incrementBackendFailure(BACKEND, reason);
        if (publisher != null) {
            publisher.publishEvent(new UpstreamFailureEvent(BACKEND, Instant.now(), message, cause,
                    Map.of("reason", reason, "endpoint", endpoint())));
        }
        return UpstreamFailureExceptionBuilder.create(message)
                .cause(cause)
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("endpoint", endpoint())
                .build(TranscriptionException::new);
    }

    @Override
    public String endpoint() {
        return config.endpoint();
    }
}
