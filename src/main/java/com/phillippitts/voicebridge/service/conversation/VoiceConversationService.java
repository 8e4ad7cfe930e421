package com.phillippitts.voicebridge.service.conversation;

import com.phillippitts.voicebridge.domain.TurnReply;
import com.phillippitts.voicebridge.domain.VoiceTurnResult;
import com.phillippitts.voicebridge.exception.NoSpeechDetectedException;
import com.phillippitts.voicebridge.service.audio.AudioValidator;
import com.phillippitts.voicebridge.service.audio.SampleFormat;
import com.phillippitts.voicebridge.service.bridge.ProcessBridge;
import com.phillippitts.voicebridge.service.gateway.SynthesisAdapter;
import com.phillippitts.voicebridge.service.gateway.TranscriptionGateway;
import com.phillippitts.voicebridge.service.session.Session;
import com.phillippitts.voicebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Conversation pipeline: audio to transcript, transcript to assistant turn, reply to speech.
 *
 * <p>Backend failures surface immediately; only the assistant process gets a retry, inside the bridge.
 */
@Service
public class VoiceConversationService {

    private static final Logger LOG = LogManager.getLogger(VoiceConversationService.class);

    private final AudioValidator audioValidator;
    private final TranscriptionGateway transcription;
    private final SynthesisAdapter synthesis;
    private final ProcessBridge bridge;
    private final String defaultLanguage;

    public VoiceConversationService(AudioValidator audioValidator,
                                    TranscriptionGateway transcription,
                                    SynthesisAdapter synthesis,
                                    ProcessBridge bridge,
                                    @Value("${voice.default-language:fr}") String defaultLanguage) {
        this.audioValidator = Objects.requireNonNull(audioValidator, "audioValidator");
        this.transcription = Objects.requireNonNull(transcription, "transcription");
        this.synthesis = Objects.requireNonNull(synthesis, "synthesis");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.defaultLanguage = defaultLanguage;
    }

    /**
     * Sends typed text as one turn, creating or adopting the session as needed.
     */
    public TurnReply textTurn(String sessionId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text must not be blank");
        }
        Session session = bridge.getOrCreate(sessionId);
        ThreadContext.put("sessionId", session.id());
        return bridge.sendTurn(session.id(), text.strip(), null);
    }

    /**
     * Transcribes {@code audio} and sends the transcript as one turn.
     *
     * @param withSpeech also synthesize the reply
     * @throws NoSpeechDetectedException if the recording contains no recognizable speech
     */
    public VoiceTurnResult voiceTurn(String sessionId, byte[] audio, String language, boolean withSpeech) {
        byte[] pcm = audioValidator.extractPcm(audio);
        Session session = bridge.getOrCreate(sessionId);
        ThreadContext.put("sessionId", session.id());

        String lang = language == null || language.isBlank() ? defaultLanguage : language;
        String transcript = transcription.transcribe(pcm, SampleFormat.PCM_16K_MONO, lang);
        if (transcript.isBlank()) {
            LOG.info("No speech recognized in {} bytes of audio for session {}", pcm.length, session.id());
            throw new NoSpeechDetectedException();
        }
        LOG.debug("Session {} heard: {}", session.id(), LogSanitizer.preview(transcript, 120));

        TurnReply reply = bridge.sendTurn(session.id(), transcript, null);
        VoiceTurnResult result = new VoiceTurnResult(transcript, reply, null);
        if (!withSpeech) {
            return result;
        }
        return result.withAudio(synthesis.synthesize(speakable(reply.text()), null));
    }

    private static String speakable(String reply) {
        // an empty reply still produces audible feedback rather than a synthesis error
        return reply.isBlank() ? "..." : reply;
    }
}
