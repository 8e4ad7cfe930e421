package com.phillippitts.voicebridge.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Wraps raw little-endian PCM in a minimal 44-byte WAV header.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Returns a WAV container holding {@code pcm} in the given layout.
     *
     * @param pcm    raw little-endian PCM
     * @param format sample layout of {@code pcm}
     * @return header followed by the payload
     */
    public static byte[] toWav(byte[] pcm, SampleFormat format) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(format, "format must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(AudioFormat.WAV_HEADER_SIZE + pcm.length);
        try {
            writeHeader(out, pcm.length, format);
            out.write(pcm);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw; kept for the OutputStream signature
            throw new UncheckedIOException("Failed to build WAV container", e);
        }
        return out.toByteArray();
    }

    private static void writeHeader(OutputStream os, int dataSize, SampleFormat format) throws IOException {
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, (short) WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, (short) format.channels());
        writeLEInt(os, format.rate());
        writeLEInt(os, format.byteRate());
        writeLEShort(os, (short) format.blockAlign());
        writeLEShort(os, (short) format.bitsPerSample());

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
