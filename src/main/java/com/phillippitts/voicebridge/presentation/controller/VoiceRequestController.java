package com.phillippitts.voicebridge.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.voicebridge.domain.ClaimResult;
import com.phillippitts.voicebridge.domain.PendingRequest;
import com.phillippitts.voicebridge.domain.VoiceInputOutcome;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;
import com.phillippitts.voicebridge.service.broker.VoiceInputAwaiter;
import com.phillippitts.voicebridge.service.broker.VoiceRequestBroker;
import com.phillippitts.voicebridge.service.conversation.VoiceSubmissionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Voice request broker API used by requesters (an agent waiting for speech) and recording
 * surfaces (browser tabs that record it).
 */
@RestController
@RequestMapping("/api")
class VoiceRequestController {

    private static final Logger LOG = LogManager.getLogger(VoiceRequestController.class);

    private final VoiceRequestBroker broker;
    private final VoiceSubmissionService submissions;
    private final VoiceInputAwaiter awaiter;

    VoiceRequestController(VoiceRequestBroker broker, VoiceSubmissionService submissions,
                           VoiceInputAwaiter awaiter) {
        this.broker = broker;
        this.submissions = submissions;
        this.awaiter = awaiter;
    }

    /**
     * Body of request-voice and voice-input. Both fields are optional.
     *
     * @param language transcription language
     * @param timeout  requester's wait in seconds
     */
    record VoiceRequestBody(String language, @JsonProperty("timeout") Double timeoutSeconds) {

        Duration timeout() {
            if (timeoutSeconds == null) {
                return null;
            }
            return Duration.ofMillis(Math.round(timeoutSeconds * 1000));
        }
    }

    @PostMapping("/request-voice")
    ResponseEntity<Map<String, Object>> requestVoice(@RequestBody(required = false) VoiceRequestBody body) {
        VoiceRequestBody b = body == null ? new VoiceRequestBody(null, null) : body;
        String requestId = broker.createRequest(b.language(), b.timeout());
        return ResponseEntity.ok(ResponseBodies.of("request_id", requestId, "status", "pending"));
    }

    @GetMapping("/pending-requests")
    ResponseEntity<Map<String, Object>> pendingRequests() {
        List<Map<String, Object>> pending = broker.listPending().stream()
                .map(VoiceRequestController::pendingJson)
                .toList();
        return ResponseEntity.ok(ResponseBodies.of("requests", pending));
    }

    @PostMapping("/claim-request/{requestId}")
    ResponseEntity<Map<String, Object>> claim(@PathVariable String requestId) {
        ClaimResult result = broker.claim(requestId);
        return switch (result.outcome()) {
            case SUCCESS -> ResponseEntity.ok(ResponseBodies.of(
                    "status", "claimed",
                    "claim_token", result.claimToken(),
                    "language", result.language()));
            case NOT_FOUND -> outcome(HttpStatus.NOT_FOUND, "not_found", "Request not found");
            case ALREADY_CLAIMED -> outcome(HttpStatus.CONFLICT, "already_claimed", "Request already claimed");
            case EXPIRED -> outcome(HttpStatus.GONE, "expired", "Request expired");
        };
    }

    @PostMapping(value = "/submit-voice/{requestId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> submitVoice(@PathVariable String requestId,
                                                    @RequestPart("audio") MultipartFile audio,
                                                    @RequestParam("claim_token") String claimToken)
            throws IOException {
        LOG.info("Voice request {} received {} bytes of audio", requestId, audio.getSize());
        VoiceSubmissionService.Submission submission = submissions.submit(requestId, claimToken, audio.getBytes());
        return switch (submission.outcome()) {
            case SUCCESS -> ResponseEntity.ok(ResponseBodies.of(
                    "status", "completed",
                    "transcript", submission.transcript()));
            case NOT_FOUND -> outcome(HttpStatus.NOT_FOUND, "not_found", "Request not found");
            case WRONG_STATE -> outcome(HttpStatus.CONFLICT, "wrong_state",
                    "Request is not held by this claim token");
        };
    }

    @GetMapping("/result/{requestId}")
    ResponseEntity<Map<String, Object>> result(@PathVariable String requestId) {
        return broker.getResult(requestId)
                .map(VoiceRequestController::statusJson)
                .map(ResponseEntity::ok)
                .orElseGet(() -> outcome(HttpStatus.NOT_FOUND, "not_found", "Request not found"));
    }

    /**
     * Creates a request and blocks until it resolves or the requester's budget runs out.
     */
    @PostMapping("/voice-input")
    ResponseEntity<Map<String, Object>> voiceInput(@RequestBody(required = false) VoiceRequestBody body) {
        VoiceRequestBody b = body == null ? new VoiceRequestBody(null, null) : body;
        VoiceInputOutcome outcome = awaiter.awaitVoiceInput(b.language(), b.timeout());
        return ResponseEntity.ok(ResponseBodies.of(
                "request_id", outcome.requestId(),
                "status", outcome.kind().name().toLowerCase(Locale.ROOT),
                "transcript", outcome.transcript(),
                "error", outcome.error()));
    }

    private static Map<String, Object> pendingJson(PendingRequest request) {
        return ResponseBodies.of(
                "id", request.requestId(),
                "language", request.language(),
                "created_at", request.createdAt().toString());
    }

    private static Map<String, Object> statusJson(VoiceRequestStatus status) {
        return ResponseBodies.of(
                "request_id", status.requestId(),
                "status", status.state().name().toLowerCase(Locale.ROOT),
                "language", status.language(),
                "transcript", status.transcript(),
                "error", status.error());
    }

    private static ResponseEntity<Map<String, Object>> outcome(HttpStatus status, String code, String error) {
        return ResponseEntity.status(status).body(ResponseBodies.of("status", code, "error", error));
    }
}
