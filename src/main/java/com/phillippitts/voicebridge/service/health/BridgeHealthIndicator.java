package com.phillippitts.voicebridge.service.health;

import com.phillippitts.voicebridge.config.properties.PiperEndpointConfig;
import com.phillippitts.voicebridge.config.properties.WhisperEndpointConfig;
import com.phillippitts.voicebridge.service.bridge.ProcessBridge;
import com.phillippitts.voicebridge.service.broker.VoiceRequestBroker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Health indicator for the speech backends and the in-memory state.
 *
 * <ul>
 *   <li>UP: both Wyoming endpoints accept connections</li>
 *   <li>DEGRADED: exactly one endpoint is reachable</li>
 *   <li>DOWN: neither endpoint is reachable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BridgeHealthIndicator implements HealthIndicator {

    static final int PROBE_TIMEOUT_MS = 250;

    private final WhisperEndpointConfig whisper;
    private final PiperEndpointConfig piper;
    private final ProcessBridge bridge;
    private final VoiceRequestBroker broker;

    public BridgeHealthIndicator(WhisperEndpointConfig whisper,
                                 PiperEndpointConfig piper,
                                 ProcessBridge bridge,
                                 VoiceRequestBroker broker) {
        this.whisper = whisper;
        this.piper = piper;
        this.bridge = bridge;
        this.broker = broker;
    }

    @Override
    public Health health() {
        boolean whisperUp = reachable(whisper.host(), whisper.port());
        boolean piperUp = reachable(piper.host(), piper.port());

        Health.Builder builder;
        if (whisperUp && piperUp) {
            builder = Health.up();
        } else if (whisperUp || piperUp) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.down();
        }
        return builder
                .withDetail("whisper", describe(whisper.endpoint(), whisperUp))
                .withDetail("piper", describe(piper.endpoint(), piperUp))
                .withDetail("liveSessions", bridge.liveSessions())
                .withDetail("trackedRequests", broker.size())
                .build();
    }

    private static String describe(String endpoint, boolean up) {
        return endpoint + (up ? " (reachable)" : " (unreachable)");
    }

    private static boolean reachable(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), PROBE_TIMEOUT_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
