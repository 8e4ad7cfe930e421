package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Wyoming speech-to-text service.
 * Binds to properties prefixed with "wyoming.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * wyoming.whisper.host=localhost
 * wyoming.whisper.port=10300
 * wyoming.whisper.connect-timeout-ms=5000
 * wyoming.whisper.read-timeout-ms=30000
 * wyoming.whisper.max-concurrent=1
 * wyoming.whisper.acquire-timeout-ms=120000
 * </pre>
 *
 * @param host service host
 * @param port service port
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs maximum wait for the next event while awaiting the transcript
 * @param maxConcurrent transcriptions allowed at once (the service handles one stream well)
 * @param acquireTimeoutMs how long a transcription waits for a free slot
 * @param maxEvents events read before giving up on a transcript
 */
@ConfigurationProperties(prefix = "wyoming.whisper")
@Validated
public record WhisperEndpointConfig(
        @DefaultValue("localhost")
        @NotBlank(message = "Whisper host must not be blank")
        String host,

        @DefaultValue("10300")
        @Positive(message = "Whisper port must be positive")
        int port,

        @DefaultValue("5000")
        @Positive
        int connectTimeoutMs,

        @DefaultValue("30000")
        @Positive
        int readTimeoutMs,

        @DefaultValue("1")
        @Positive
        int maxConcurrent,

        @DefaultValue("120000")
        @Positive
        long acquireTimeoutMs,

        @DefaultValue("100")
        @Positive
        int maxEvents
) {
    public String endpoint() {
        return "tcp://" + host + ":" + port;
    }
}
