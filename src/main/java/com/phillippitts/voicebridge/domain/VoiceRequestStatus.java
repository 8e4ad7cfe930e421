package com.phillippitts.voicebridge.domain;

import java.util.Objects;

/**
 * Point-in-time view of a voice request as returned by a result lookup.
 *
 * @param requestId  request id
 * @param state      state at the time of the lookup
 * @param language   language the request was created with
 * @param transcript transcript when COMPLETED, else null
 * @param error      error detail when FAILED, else null
 */
public record VoiceRequestStatus(
        String requestId,
        VoiceRequestState state,
        String language,
        String transcript,
        String error
) {
    public VoiceRequestStatus {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
