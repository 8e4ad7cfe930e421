package com.phillippitts.voicebridge.service.conversation;

import com.phillippitts.voicebridge.domain.SubmitOutcome;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;
import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.UpstreamFailureException;
import com.phillippitts.voicebridge.exception.VoiceBridgeException;
import com.phillippitts.voicebridge.service.audio.AudioValidator;
import com.phillippitts.voicebridge.service.audio.SampleFormat;
import com.phillippitts.voicebridge.service.broker.VoiceRequestBroker;
import com.phillippitts.voicebridge.service.gateway.TranscriptionGateway;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a claimed voice request with the claimant's recording.
 *
 * <p>Audio is validated before the request changes state, so a malformed upload can be retried
 * under the same claim. Once accepted, the request moves to RECORDING_SUBMITTED and is resolved
 * with either the transcript (possibly empty) or the backend error. A transcription service
 * with no free slot leaves the request CLAIMED, so the claimant can retry the upload.
 */
@Service
public class VoiceSubmissionService {

    private static final Logger LOG = LogManager.getLogger(VoiceSubmissionService.class);

    private final VoiceRequestBroker broker;
    private final AudioValidator audioValidator;
    private final TranscriptionGateway transcription;

    public VoiceSubmissionService(VoiceRequestBroker broker,
                                  AudioValidator audioValidator,
                                  TranscriptionGateway transcription) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.audioValidator = Objects.requireNonNull(audioValidator, "audioValidator");
        this.transcription = Objects.requireNonNull(transcription, "transcription");
    }

    /**
     * Outcome of a submission.
     *
     * @param outcome    broker outcome; the transcript is only meaningful on SUCCESS
     * @param transcript recognized text, possibly empty
     */
    public record Submission(SubmitOutcome outcome, String transcript) {
    }

    /**
     * @throws com.phillippitts.voicebridge.exception.InvalidAudioException if the upload is unusable;
     *         the request is left untouched
     * @throws UpstreamFailureException if transcription failed; the request is resolved as FAILED first
     * @throws CapacityExceededException if the transcription service is saturated; the request
     *         goes back to CLAIMED under the same token
     */
    public Submission submit(String requestId, String claimToken, byte[] audio) {
        byte[] pcm = audioValidator.extractPcm(audio);

        SubmitOutcome begun = broker.beginSubmission(requestId, claimToken);
        if (begun != SubmitOutcome.SUCCESS) {
            return new Submission(begun, null);
        }
        String language = broker.getResult(requestId)
                .map(VoiceRequestStatus::language)
                .orElse(null);

        String transcript;
        try {
            transcript = transcription.transcribe(pcm, SampleFormat.PCM_16K_MONO, language);
        } catch (CapacityExceededException e) {
            SubmitOutcome reverted = broker.abortSubmission(requestId, claimToken);
            LOG.warn("No transcription slot for voice request {}; submission returned to claimant ({})",
                    requestId, reverted);
            throw e;
        } catch (VoiceBridgeException e) {
            SubmitOutcome failed = broker.submitError(requestId, claimToken, e.getMessage());
            LOG.warn("Transcription for voice request {} failed; request resolved as {}", requestId,
                    failed == SubmitOutcome.SUCCESS ? "FAILED" : "unchanged (" + failed + ")");
            throw e;
        }

        SubmitOutcome outcome = broker.submitTranscript(requestId, claimToken, transcript);
        return new Submission(outcome, Optional.ofNullable(transcript).orElse(""));
    }
}
