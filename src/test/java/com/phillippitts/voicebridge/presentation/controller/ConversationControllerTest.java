package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.domain.Speaker;
import com.phillippitts.voicebridge.domain.Turn;
import com.phillippitts.voicebridge.domain.TurnReply;
import com.phillippitts.voicebridge.domain.VoiceTurnResult;
import com.phillippitts.voicebridge.service.bridge.ProcessBridge;
import com.phillippitts.voicebridge.service.conversation.VoiceConversationService;
import com.phillippitts.voicebridge.service.session.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationControllerTest {

    private static final byte[] WAV = {'R', 'I', 'F', 'F', 0, 0};

    private VoiceConversationService conversation;
    private ProcessBridge bridge;
    private ConversationController controller;

    @BeforeEach
    void setUp() {
        conversation = mock(VoiceConversationService.class);
        bridge = mock(ProcessBridge.class);
        controller = new ConversationController(conversation, bridge);
    }

    @Test
    void voiceReturnsWavAndSessionHeader() throws Exception {
        MockMultipartFile audio = new MockMultipartFile("audio", "in.wav", "audio/wav", new byte[16_000]);
        when(conversation.voiceTurn(eq("s1"), any(), eq("en"), eq(true)))
                .thenReturn(new VoiceTurnResult("hello", reply("s1", "hi"), WAV));

        ResponseEntity<byte[]> response = controller.voice(audio, null, "en", "s1");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getContentType()).isEqualTo(ConversationController.AUDIO_WAV);
        assertThat(response.getHeaders().getFirst(ConversationController.SESSION_HEADER)).isEqualTo("s1");
        assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION)).contains("response.wav");
        assertThat(response.getBody()).isEqualTo(WAV);
    }

    @Test
    void formSessionIdWinsOverHeader() throws Exception {
        MockMultipartFile audio = new MockMultipartFile("audio", new byte[16_000]);
        when(conversation.voiceTurn(eq("form"), any(), any(), eq(false)))
                .thenReturn(new VoiceTurnResult("bonjour", reply("form", "salut"), null));

        ResponseEntity<Map<String, Object>> response = controller.voiceText(audio, "form", null, "header");

        assertThat(response.getBody())
                .containsEntry("session_id", "form")
                .containsEntry("response", "salut")
                .containsEntry("transcript", "bonjour")
                .containsEntry("respawned", false);
    }

    @Test
    void textTurnReportsRecoveryFlags() {
        when(conversation.textTurn("s1", "hello"))
                .thenReturn(new TurnReply("s1", "hi", true, true, 840));

        ResponseEntity<Map<String, Object>> response =
                controller.text(new ConversationController.TextTurnBody(null, "hello"), "s1");

        assertThat(response.getBody())
                .containsEntry("session_id", "s1")
                .containsEntry("respawned", true)
                .containsEntry("stale_output_discarded", true)
                .containsEntry("duration_ms", 840L);
        assertThat(response.getHeaders().getFirst(ConversationController.SESSION_HEADER)).isEqualTo("s1");
    }

    @Test
    void newSessionReturnsMintedId() {
        when(bridge.getOrCreate(null)).thenReturn(new Session("a1b2c3d4", Instant.now(), List.of()));

        assertThat(controller.newSession().getBody()).containsEntry("session_id", "a1b2c3d4");
    }

    @Test
    void clearIsIdempotent() {
        when(bridge.clear("gone")).thenReturn(false);

        ResponseEntity<Map<String, Object>> response = controller.clear("gone");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("status", "cleared")
                .containsEntry("existed", false);
    }

    @Test
    void historyListsTurnsInOrder() {
        Instant at = Instant.parse("2025-01-01T10:00:00Z");
        when(bridge.history("s1")).thenReturn(List.of(
                new Turn(Speaker.USER, "hello", at),
                new Turn(Speaker.ASSISTANT, "hi", at.plusSeconds(1))));

        Map<String, Object> body = controller.history("s1").getBody();

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> turns = (List<Map<String, Object>>) body.get("history");
        assertThat(turns).hasSize(2);
        assertThat(turns.get(0))
                .containsEntry("speaker", "user")
                .containsEntry("text", "hello")
                .containsEntry("at", "2025-01-01T10:00:00Z");
        assertThat(turns.get(1)).containsEntry("speaker", "assistant");
    }

    private static TurnReply reply(String sessionId, String text) {
        return new TurnReply(sessionId, text, false, false, 10);
    }
}
