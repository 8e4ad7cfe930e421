package com.phillippitts.voicebridge.service.audio;

/**
 * Single source of truth for the audio format accepted for transcription.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes

    /** Samples per Wyoming audio-chunk event. */
    public static final int SAMPLES_PER_CHUNK = 1024;

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}
}
