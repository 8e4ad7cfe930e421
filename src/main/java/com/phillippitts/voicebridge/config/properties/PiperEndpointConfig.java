package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Wyoming text-to-speech service.
 * Binds to properties prefixed with "wyoming.piper".
 *
 * @param host service host
 * @param port service port
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs maximum wait for the next audio event
 * @param voice default voice profile; blank lets the service choose
 */
@ConfigurationProperties(prefix = "wyoming.piper")
@Validated
public record PiperEndpointConfig(
        @DefaultValue("localhost")
        @NotBlank(message = "Piper host must not be blank")
        String host,

        @DefaultValue("10200")
        @Positive(message = "Piper port must be positive")
        int port,

        @DefaultValue("5000")
        @Positive
        int connectTimeoutMs,

        @DefaultValue("60000")
        @Positive
        int readTimeoutMs,

        @DefaultValue("")
        String voice
) {
    public String endpoint() {
        return "tcp://" + host + ":" + port;
    }
}
