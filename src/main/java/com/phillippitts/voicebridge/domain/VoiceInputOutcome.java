package com.phillippitts.voicebridge.domain;

import java.util.Objects;

/**
 * What a requester gets back after waiting for voice input.
 *
 * <p>{@link Kind#RECEIVED} with an empty transcript means a recording arrived but contained
 * no recognizable speech, which is distinct from {@link Kind#TIMED_OUT} (nobody recorded) and
 * {@link Kind#FAILED} (the transcription backend reported an error).
 *
 * @param requestId  broker request that carried the wait
 * @param kind       outcome kind
 * @param transcript transcript when RECEIVED, else null
 * @param error      error detail when FAILED, else null
 */
public record VoiceInputOutcome(String requestId, Kind kind, String transcript, String error) {

    public enum Kind { RECEIVED, TIMED_OUT, FAILED }

    public VoiceInputOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static VoiceInputOutcome received(String requestId, String transcript) {
        return new VoiceInputOutcome(requestId, Kind.RECEIVED, transcript == null ? "" : transcript, null);
    }

    public static VoiceInputOutcome timedOut(String requestId) {
        return new VoiceInputOutcome(requestId, Kind.TIMED_OUT, null, null);
    }

    public static VoiceInputOutcome failed(String requestId, String error) {
        return new VoiceInputOutcome(requestId, Kind.FAILED, null, error);
    }

    public boolean isEmptyTranscript() {
        return kind == Kind.RECEIVED && transcript.isBlank();
    }
}
