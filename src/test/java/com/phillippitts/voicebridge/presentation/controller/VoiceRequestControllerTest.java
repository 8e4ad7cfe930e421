package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.config.properties.AudioValidationProperties;
import com.phillippitts.voicebridge.config.properties.BrokerProperties;
import com.phillippitts.voicebridge.domain.VoiceInputOutcome;
import com.phillippitts.voicebridge.service.audio.AudioValidator;
import com.phillippitts.voicebridge.service.broker.InMemoryVoiceRequestBroker;
import com.phillippitts.voicebridge.service.broker.VoiceInputAwaiter;
import com.phillippitts.voicebridge.service.conversation.VoiceSubmissionService;
import com.phillippitts.voicebridge.service.gateway.TranscriptionGateway;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VoiceRequestControllerTest {

    private final MutableClock clock = new MutableClock();
    private TranscriptionGateway transcription;
    private VoiceInputAwaiter awaiter;
    private VoiceRequestController controller;

    @BeforeEach
    void setUp() {
        InMemoryVoiceRequestBroker broker = new InMemoryVoiceRequestBroker(new BrokerProperties(),
                new VoiceBridgeMetrics(new SimpleMeterRegistry()), clock);
        transcription = mock(TranscriptionGateway.class);
        awaiter = mock(VoiceInputAwaiter.class);
        VoiceSubmissionService submissions = new VoiceSubmissionService(broker,
                new AudioValidator(new AudioValidationProperties()), transcription);
        controller = new VoiceRequestController(broker, submissions, awaiter);
    }

    @Test
    void requestClaimSubmitAndFetchResult() throws Exception {
        String id = (String) controller.requestVoice(
                new VoiceRequestController.VoiceRequestBody("en", 60.0)).getBody().get("request_id");

        Map<String, Object> claim = controller.claim(id).getBody();
        assertThat(claim).containsEntry("status", "claimed").containsEntry("language", "en");

        when(transcription.transcribe(any(), any(), any())).thenReturn("hello there");
        ResponseEntity<Map<String, Object>> submitted = controller.submitVoice(id,
                new MockMultipartFile("audio", new byte[16_000]), (String) claim.get("claim_token"));
        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(submitted.getBody())
                .containsEntry("status", "completed")
                .containsEntry("transcript", "hello there");

        assertThat(controller.result(id).getBody())
                .containsEntry("request_id", id)
                .containsEntry("status", "completed")
                .containsEntry("transcript", "hello there")
                .containsEntry("error", null);
    }

    @Test
    void missingBodyUsesDefaults() {
        ResponseEntity<Map<String, Object>> created = controller.requestVoice(null);

        assertThat(created.getBody()).containsEntry("status", "pending");
        String id = (String) created.getBody().get("request_id");
        assertThat(controller.result(id).getBody()).containsEntry("language", "fr");
    }

    @Test
    void pendingListShowsUnclaimedRequestsOnly() {
        String first = (String) controller.requestVoice(null).getBody().get("request_id");
        String second = (String) controller.requestVoice(null).getBody().get("request_id");
        controller.claim(first);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> pending =
                (List<Map<String, Object>>) controller.pendingRequests().getBody().get("requests");

        assertThat(pending).singleElement().satisfies(p -> {
            assertThat(p).containsEntry("id", second);
            assertThat(p).containsKeys("language", "created_at");
        });
    }

    @Test
    void claimOutcomesMapToStatusCodes() {
        String id = (String) controller.requestVoice(
                new VoiceRequestController.VoiceRequestBody(null, 2.0)).getBody().get("request_id");
        controller.claim(id);

        ResponseEntity<Map<String, Object>> again = controller.claim(id);
        assertThat(again.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(again.getBody()).containsEntry("status", "already_claimed");

        assertThat(controller.claim("0000000000000000").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);

        String late = (String) controller.requestVoice(
                new VoiceRequestController.VoiceRequestBody(null, 2.0)).getBody().get("request_id");
        clock.advance(Duration.ofSeconds(3));
        ResponseEntity<Map<String, Object>> expired = controller.claim(late);
        assertThat(expired.getStatusCode()).isEqualTo(HttpStatus.GONE);
        assertThat(expired.getBody()).containsEntry("status", "expired");
    }

    @Test
    void submitWithWrongTokenIsConflict() throws Exception {
        String id = (String) controller.requestVoice(null).getBody().get("request_id");
        controller.claim(id);

        ResponseEntity<Map<String, Object>> response = controller.submitVoice(id,
                new MockMultipartFile("audio", new byte[16_000]), "forged");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).containsEntry("status", "wrong_state");
    }

    @Test
    void unknownResultIs404() {
        assertThat(controller.result("ffffffffffffffff").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void voiceInputReportsOutcomeKind() {
        when(awaiter.awaitVoiceInput("en", Duration.ofMillis(1500)))
                .thenReturn(VoiceInputOutcome.received("abc", ""));

        Map<String, Object> body = controller.voiceInput(
                new VoiceRequestController.VoiceRequestBody("en", 1.5)).getBody();

        assertThat(body)
                .containsEntry("request_id", "abc")
                .containsEntry("status", "received")
                .containsEntry("transcript", "");
    }

    @Test
    void voiceInputTimeout() {
        when(awaiter.awaitVoiceInput(null, null)).thenReturn(VoiceInputOutcome.timedOut("abc"));

        assertThat(controller.voiceInput(null).getBody()).containsEntry("status", "timed_out");
    }
}
