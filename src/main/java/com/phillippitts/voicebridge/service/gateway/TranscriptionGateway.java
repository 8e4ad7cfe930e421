package com.phillippitts.voicebridge.service.gateway;

import com.phillippitts.voicebridge.service.audio.SampleFormat;

/**
 * Speech-to-text backend.
 *
 * <p>Implementations must be thread-safe. Callers pass PCM only; containers are stripped
 * upstream by {@link com.phillippitts.voicebridge.service.audio.AudioValidator}.
 */
public interface TranscriptionGateway {

    /**
     * Transcribes PCM audio.
     *
     * @param pcm      little-endian PCM samples
     * @param format   layout of {@code pcm}, normally {@link SampleFormat#PCM_16K_MONO}
     * @param language ISO language hint such as "fr" or "en"
     * @return transcript with surrounding whitespace removed; empty when no speech was recognized
     * @throws com.phillippitts.voicebridge.exception.TranscriptionException if the backend fails
     * @throws com.phillippitts.voicebridge.exception.CapacityExceededException if no transcription
     *         slot frees up in time
     */
    String transcribe(byte[] pcm, SampleFormat format, String language);

    /** Human-readable backend address for health reporting. */
    String endpoint();
}
