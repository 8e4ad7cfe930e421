package com.phillippitts.voicebridge.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.voicebridge.domain.Turn;
import com.phillippitts.voicebridge.domain.TurnReply;
import com.phillippitts.voicebridge.domain.VoiceTurnResult;
import com.phillippitts.voicebridge.service.bridge.ProcessBridge;
import com.phillippitts.voicebridge.service.conversation.VoiceConversationService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Session-scoped conversation routes: speech in / speech out, speech in / text out, text only,
 * and session management.
 *
 * <p>The session id travels as the {@code session_id} form field or JSON property, or as the
 * {@code X-Session-ID} header. Responses always carry the session id that handled the turn.
 */
@RestController
class ConversationController {

    private static final Logger LOG = LogManager.getLogger(ConversationController.class);

    static final String SESSION_HEADER = "X-Session-ID";
    static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final VoiceConversationService conversation;
    private final ProcessBridge bridge;

    ConversationController(VoiceConversationService conversation, ProcessBridge bridge) {
        this.conversation = conversation;
        this.bridge = bridge;
    }

    record TextTurnBody(@JsonProperty("session_id") String sessionId, String text) {
    }

    @PostMapping(value = "/voice", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<byte[]> voice(@RequestPart("audio") MultipartFile audio,
                                 @RequestParam(value = "session_id", required = false) String sessionId,
                                 @RequestParam(value = "language", required = false) String language,
                                 @RequestHeader(value = SESSION_HEADER, required = false) String sessionHeader)
            throws IOException {
        VoiceTurnResult result = conversation.voiceTurn(
                firstNonBlank(sessionId, sessionHeader), audio.getBytes(), language, true);
        LOG.info("Voice turn done: session={}, replyChars={}, wavBytes={}",
                result.sessionId(), result.reply().text().length(), result.audio().length);
        return ResponseEntity.ok()
                .contentType(AUDIO_WAV)
                .header(SESSION_HEADER, result.sessionId())
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"response.wav\"")
                .body(result.audio());
    }

    @PostMapping(value = "/voice-text", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> voiceText(@RequestPart("audio") MultipartFile audio,
                                                  @RequestParam(value = "session_id", required = false) String sessionId,
                                                  @RequestParam(value = "language", required = false) String language,
                                                  @RequestHeader(value = SESSION_HEADER, required = false) String sessionHeader)
            throws IOException {
        VoiceTurnResult result = conversation.voiceTurn(
                firstNonBlank(sessionId, sessionHeader), audio.getBytes(), language, false);
        Map<String, Object> body = replyJson(result.reply());
        body.put("transcript", result.transcript());
        return ResponseEntity.ok()
                .header(SESSION_HEADER, result.sessionId())
                .body(body);
    }

    @PostMapping("/text")
    ResponseEntity<Map<String, Object>> text(@RequestBody TextTurnBody body,
                                             @RequestHeader(value = SESSION_HEADER, required = false) String sessionHeader) {
        TurnReply reply = conversation.textTurn(firstNonBlank(body.sessionId(), sessionHeader), body.text());
        return ResponseEntity.ok()
                .header(SESSION_HEADER, reply.sessionId())
                .body(replyJson(reply));
    }

    @PostMapping("/session/new")
    ResponseEntity<Map<String, Object>> newSession() {
        String sessionId = bridge.getOrCreate(null).id();
        return ResponseEntity.ok(ResponseBodies.of("session_id", sessionId));
    }

    /**
     * Idempotent: clearing an unknown or already cleared session succeeds with {@code existed=false}.
     */
    @PostMapping("/session/{sessionId}/clear")
    ResponseEntity<Map<String, Object>> clear(@PathVariable String sessionId) {
        boolean existed = bridge.clear(sessionId);
        return ResponseEntity.ok(ResponseBodies.of(
                "session_id", sessionId,
                "status", "cleared",
                "existed", existed));
    }

    @GetMapping("/session/{sessionId}/history")
    ResponseEntity<Map<String, Object>> history(@PathVariable String sessionId) {
        List<Map<String, Object>> turns = bridge.history(sessionId).stream()
                .map(ConversationController::turnJson)
                .toList();
        return ResponseEntity.ok(ResponseBodies.of("session_id", sessionId, "history", turns));
    }

    private static Map<String, Object> replyJson(TurnReply reply) {
        return ResponseBodies.of(
                "session_id", reply.sessionId(),
                "response", reply.text(),
                "respawned", reply.respawned(),
                "stale_output_discarded", reply.staleOutputDiscarded(),
                "duration_ms", reply.durationMs());
    }

    private static Map<String, Object> turnJson(Turn turn) {
        return ResponseBodies.of(
                "speaker", turn.speaker().name().toLowerCase(Locale.ROOT),
                "text", turn.text(),
                "at", turn.at().toString());
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
