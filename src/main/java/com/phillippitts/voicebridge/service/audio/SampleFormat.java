package com.phillippitts.voicebridge.service.audio;

/**
 * PCM sample layout of an audio payload.
 *
 * @param rate samples per second
 * @param width bytes per sample
 * @param channels interleaved channel count
 */
public record SampleFormat(int rate, int width, int channels) {

    /** Layout the transcription service expects: 16 kHz, 16-bit, mono. */
    public static final SampleFormat PCM_16K_MONO = new SampleFormat(
            AudioFormat.REQUIRED_SAMPLE_RATE,
            AudioFormat.REQUIRED_BITS_PER_SAMPLE / 8,
            AudioFormat.REQUIRED_CHANNELS);

    /** Default layout announced by the synthesis service when it omits one. */
    public static final SampleFormat SYNTHESIS_DEFAULT = new SampleFormat(22_050, 2, 1);

    public SampleFormat {
        if (rate <= 0 || width <= 0 || channels <= 0) {
            throw new IllegalArgumentException("Invalid sample format: rate=" + rate
                    + ", width=" + width + ", channels=" + channels);
        }
    }

    public int blockAlign() {
        return width * channels;
    }

    public int byteRate() {
        return rate * blockAlign();
    }

    public int bitsPerSample() {
        return width * 8;
    }

    /** Duration in milliseconds of {@code bytes} bytes of PCM in this layout. */
    public long durationMillis(long bytes) {
        return (bytes * 1000L) / byteRate();
    }
}
