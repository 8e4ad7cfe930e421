package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bounds applied to uploaded audio before it is sent for transcription.
 */
@ConfigurationProperties(prefix = "audio.validation")
@Validated
public class AudioValidationProperties {

    /** Shortest clip accepted, in milliseconds. */
    @Positive
    private int minDurationMs = 250;

    /** Longest clip accepted, in milliseconds. */
    @Positive
    private int maxDurationMs = 300_000;

    /** Largest upload accepted, in bytes. */
    @Positive
    private int maxFileSizeBytes = 20 * 1024 * 1024;

    public int getMinDurationMs() {
        return minDurationMs;
    }

    public void setMinDurationMs(int minDurationMs) {
        this.minDurationMs = minDurationMs;
    }

    public int getMaxDurationMs() {
        return maxDurationMs;
    }

    public void setMaxDurationMs(int maxDurationMs) {
        this.maxDurationMs = maxDurationMs;
    }

    public int getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(int maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
