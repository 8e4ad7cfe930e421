package com.phillippitts.voicebridge.service.audio;

/**
 * Constants for WAV (RIFF/WAVE) container parsing.
 *
 * <pre>
 * RIFF header (12 bytes)      "RIFF" + size + "WAVE"
 * fmt chunk  (8 + &gt;=16 bytes) format fields
 * data chunk (8 + n bytes)    PCM payload
 * </pre>
 *
 * @see AudioValidator
 */
public final class WavFormat {

    /** "RIFF" + little-endian file size - 8 + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** 4-character chunk ID followed by a little-endian uint32 chunk size. */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** A plain PCM fmt chunk carries 16 bytes; extensible formats carry more. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** fmt chunk format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    private WavFormat() {
    }

    /** True when {@code data} starts with a RIFF/WAVE header. */
    public static boolean isWav(byte[] data) {
        return data != null && data.length >= RIFF_HEADER_SIZE
                && data[0] == 'R' && data[1] == 'I' && data[2] == 'F' && data[3] == 'F'
                && data[8] == 'W' && data[9] == 'A' && data[10] == 'V' && data[11] == 'E';
    }
}
