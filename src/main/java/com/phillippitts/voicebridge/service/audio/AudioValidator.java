package com.phillippitts.voicebridge.service.audio;

import com.phillippitts.voicebridge.config.properties.AudioValidationProperties;
import com.phillippitts.voicebridge.exception.InvalidAudioException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Validates uploaded audio and extracts the PCM payload sent for transcription.
 *
 * <p>WAV uploads are parsed chunk by chunk (extra chunks and extended fmt chunks are tolerated);
 * anything else is treated as raw PCM16LE mono at 16 kHz.
 */
@Component
public class AudioValidator {

    private final AudioValidationProperties props;

    public AudioValidator(AudioValidationProperties props) {
        this.props = props;
    }

    /**
     * Validates {@code data} and returns its PCM samples.
     *
     * @param data WAV bytes or raw PCM16LE mono at 16 kHz
     * @return PCM payload without any container header
     * @throws InvalidAudioException when size, format or duration constraints are violated
     */
    public byte[] extractPcm(byte[] data) {
        if (data == null || data.length == 0) {
            throw new InvalidAudioException("Audio data is empty");
        }
        if (data.length > props.getMaxFileSizeBytes()) {
            throw new InvalidAudioException(data.length,
                    "Audio payload too large: " + data.length + " bytes. Max: "
                    + props.getMaxFileSizeBytes() + " bytes");
        }

        byte[] pcm = WavFormat.isWav(data) ? pcmFromWav(data) : data;
        if (pcm.length % REQUIRED_BLOCK_ALIGN != 0) {
            throw new InvalidAudioException(pcm.length,
                    "PCM not aligned to block size (" + REQUIRED_BLOCK_ALIGN + " bytes)");
        }
        validateDuration(pcm.length);
        return pcm;
    }

    private byte[] pcmFromWav(byte[] wav) {
        int offset = WavFormat.RIFF_HEADER_SIZE;
        boolean fmtSeen = false;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = new String(wav, offset, 4, StandardCharsets.US_ASCII);
            int chunkSize = readLEInt(wav, offset + 4);
            int body = offset + WavFormat.CHUNK_HEADER_SIZE;

            if (chunkSize < 0 || body + chunkSize > wav.length) {
                throw new InvalidAudioException("Invalid chunk size: " + chunkSize + " at offset " + offset);
            }
            if ("fmt ".equals(chunkId)) {
                validateFmtChunk(wav, body, chunkSize);
                fmtSeen = true;
            } else if ("data".equals(chunkId)) {
                if (!fmtSeen) {
                    throw new InvalidAudioException("Missing fmt chunk before data chunk");
                }
                return Arrays.copyOfRange(wav, body, body + chunkSize);
            }

            offset = body + chunkSize + (chunkSize % 2);
        }
        throw new InvalidAudioException(fmtSeen ? "Missing data chunk in WAV file" : "Missing fmt chunk in WAV file");
    }

    private void validateFmtChunk(byte[] wav, int offset, int size) {
        if (size < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException("fmt chunk too small: " + size + " bytes (expected at least "
                    + WavFormat.FMT_CHUNK_MIN_SIZE + ")");
        }
        int audioFormat = readLEShort(wav, offset);
        int channels = readLEShort(wav, offset + 2);
        int sampleRate = readLEInt(wav, offset + 4);
        int bitsPerSample = readLEShort(wav, offset + 14);

        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM) {
            throw new InvalidAudioException("Unsupported audio format: " + audioFormat
                    + " (expected " + WavFormat.AUDIO_FORMAT_PCM + " for PCM)");
        }
        if (channels != REQUIRED_CHANNELS) {
            throw new InvalidAudioException("Invalid channel count: " + channels + ". Expected: " + REQUIRED_CHANNELS);
        }
        if (sampleRate != REQUIRED_SAMPLE_RATE) {
            throw new InvalidAudioException("Invalid sample rate: " + sampleRate + " Hz. Expected: "
                    + REQUIRED_SAMPLE_RATE + " Hz");
        }
        if (bitsPerSample != REQUIRED_BITS_PER_SAMPLE) {
            throw new InvalidAudioException("Invalid bit depth: " + bitsPerSample + "-bit. Expected: "
                    + REQUIRED_BITS_PER_SAMPLE + "-bit");
        }
    }

    private void validateDuration(int bytes) {
        long durationMs = SampleFormat.PCM_16K_MONO.durationMillis(bytes);
        if (durationMs < props.getMinDurationMs()) {
            throw new InvalidAudioException(bytes, "Audio too short: ~" + durationMs
                    + " ms. Min: " + props.getMinDurationMs() + " ms");
        }
        if (durationMs > props.getMaxDurationMs()) {
            throw new InvalidAudioException(bytes, "Audio too long: ~" + durationMs
                    + " ms. Max: " + props.getMaxDurationMs() + " ms");
        }
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
