package com.phillippitts.voicebridge.service.broker;

import com.phillippitts.voicebridge.domain.ClaimResult;
import com.phillippitts.voicebridge.domain.PendingRequest;
import com.phillippitts.voicebridge.domain.SubmitOutcome;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Coordinates voice-input requests between a requester and recording surfaces.
 *
 * <p>A requester creates a request and polls {@link #getResult}; recording surfaces poll
 * {@link #listPending}, {@link #claim} one request, and resolve it with the claim token they
 * received. Every operation is non-blocking and linearizable per request. NotFound and
 * Conflict are reported as outcomes, never as exceptions.
 */
public interface VoiceRequestBroker {

    /**
     * Creates a PENDING request.
     *
     * @param language       transcription language; blank means the configured default
     * @param overallTimeout requester's end-to-end wait; null or non-positive means the configured
     *                       default, and values above the configured maximum are clamped
     * @return new request id (16 hex chars)
     */
    String createRequest(String language, Duration overallTimeout);

    /**
     * PENDING, unexpired requests in creation order. Expired ones time out as a side effect.
     */
    List<PendingRequest> listPending();

    /**
     * Single-winner transition PENDING to CLAIMED, including the expiry check.
     */
    ClaimResult claim(String requestId);

    /**
     * Marks that the claimant's audio arrived and transcription is in progress (CLAIMED to
     * RECORDING_SUBMITTED).
     */
    SubmitOutcome beginSubmission(String requestId, String claimToken);

    /**
     * Returns a submission that could not be processed to CLAIMED (RECORDING_SUBMITTED to CLAIMED),
     * so the claimant may upload again under the same token before its claim deadline.
     */
    SubmitOutcome abortSubmission(String requestId, String claimToken);

    /**
     * Resolves a held claim with a transcript (COMPLETED). Rejections have no side effects.
     */
    SubmitOutcome submitTranscript(String requestId, String claimToken, String transcript);

    /**
     * Resolves a held claim with an error (FAILED). Rejections have no side effects.
     */
    SubmitOutcome submitError(String requestId, String claimToken, String error);

    /**
     * Current status; empty when the id is unknown or already garbage-collected.
     * A terminal status returned here is marked retrieved and removed by the next sweep.
     */
    Optional<VoiceRequestStatus> getResult(String requestId);

    /**
     * Applies claim and overall deadlines to every request and removes retrieved or expired
     * terminal requests.
     */
    ReapSummary reap();

    int size();
}
