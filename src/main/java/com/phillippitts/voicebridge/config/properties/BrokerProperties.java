package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for the voice request broker and the requester-side await loop.
 *
 * <p>Properties:
 * <ul>
 *   <li>broker.default-language - language used when a request names none (default: fr)</li>
 *   <li>broker.default-timeout - overall timeout when a request names none (default: 60s)</li>
 *   <li>broker.max-timeout - upper clamp for requested overall timeouts (default: 120s)</li>
 *   <li>broker.claim-timeout - time a claimant has to submit audio (default: 30s)</li>
 *   <li>broker.retention - how long unretrieved terminal requests are kept (default: 5m)</li>
 *   <li>broker.reap-interval-ms - reaper period (default: 1000)</li>
 *   <li>broker.poll-interval - await loop poll period (default: 1s)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "broker")
@Validated
public class BrokerProperties {

    @NotBlank(message = "Default language must not be blank")
    private String defaultLanguage = "fr";

    @NotNull
    private Duration defaultTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration maxTimeout = Duration.ofSeconds(120);

    @NotNull
    private Duration claimTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration retention = Duration.ofMinutes(5);

    @Positive(message = "Reap interval must be positive")
    private long reapIntervalMs = 1000;

    @NotNull
    private Duration pollInterval = Duration.ofSeconds(1);

    /**
     * Applies the default and the upper clamp to a requested overall timeout.
     */
    public Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isNegative() || requested.isZero()) {
            return defaultTimeout;
        }
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(String defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getMaxTimeout() {
        return maxTimeout;
    }

    public void setMaxTimeout(Duration maxTimeout) {
        this.maxTimeout = maxTimeout;
    }

    public Duration getClaimTimeout() {
        return claimTimeout;
    }

    public void setClaimTimeout(Duration claimTimeout) {
        this.claimTimeout = claimTimeout;
    }

    public Duration getRetention() {
        return retention;
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }

    public long getReapIntervalMs() {
        return reapIntervalMs;
    }

    public void setReapIntervalMs(long reapIntervalMs) {
        this.reapIntervalMs = reapIntervalMs;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }
}
