package com.phillippitts.voicebridge.domain;

/**
 * Lifecycle of a voice request.
 *
 * <pre>
 * PENDING -&gt; CLAIMED -&gt; RECORDING_SUBMITTED -&gt; COMPLETED | FAILED
 *    |          |                |
 *    +----------+----------------+-------------&gt; TIMED_OUT
 * CLAIMED -&gt; PENDING once, when the claimant lets the claim deadline lapse
 * </pre>
 */
public enum VoiceRequestState {
    PENDING,
    CLAIMED,
    RECORDING_SUBMITTED,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }

    /** True while a claimant holds the request. */
    public boolean isClaimed() {
        return this == CLAIMED || this == RECORDING_SUBMITTED;
    }
}
