package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.config.properties.PiperEndpointConfig;
import com.phillippitts.voicebridge.config.properties.WhisperEndpointConfig;
import com.phillippitts.voicebridge.service.bridge.ProcessBridge;
import com.phillippitts.voicebridge.service.broker.VoiceRequestBroker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe for clients. Backend reachability lives in the actuator health indicator.
 */
@RestController
class HealthController {

    private final WhisperEndpointConfig whisper;
    private final PiperEndpointConfig piper;
    private final ProcessBridge bridge;
    private final VoiceRequestBroker broker;

    HealthController(WhisperEndpointConfig whisper, PiperEndpointConfig piper,
                     ProcessBridge bridge, VoiceRequestBroker broker) {
        this.whisper = whisper;
        this.piper = piper;
        this.bridge = bridge;
        this.broker = broker;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(ResponseBodies.of(
                "status", "ok",
                "whisper", whisper.endpoint(),
                "piper", piper.endpoint(),
                "live_sessions", bridge.liveSessions(),
                "pending_requests", broker.listPending().size()));
    }
}
