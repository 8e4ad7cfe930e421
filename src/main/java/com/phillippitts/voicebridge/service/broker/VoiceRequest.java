package com.phillippitts.voicebridge.service.broker;

import com.phillippitts.voicebridge.domain.ClaimOutcome;
import com.phillippitts.voicebridge.domain.ClaimResult;
import com.phillippitts.voicebridge.domain.SubmitOutcome;
import com.phillippitts.voicebridge.domain.VoiceRequestState;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable broker entry for one voice request.
 *
 * <p>Every operation takes the entry's own lock and first applies any elapsed deadline, so a
 * check and the transition it guards are one atomic step. Terminal states are absorbing.
 *
 * <p><b>Deadline rules</b> (applied in this order):
 * <ol>
 *   <li>Any non-terminal state past {@code overallDeadline} becomes TIMED_OUT.</li>
 *   <li>CLAIMED past {@code claimDeadline} reverts to PENDING the first time and times out
 *       the second time. RECORDING_SUBMITTED is not subject to the claim deadline.</li>
 * </ol>
 */
final class VoiceRequest {

    private final Lock lock = new ReentrantLock();

    private final String id;
    private final long sequence;
    private final String language;
    private final Instant createdAt;
    private final Instant overallDeadline;

    private VoiceRequestState state = VoiceRequestState.PENDING;
    private String claimToken;
    private Instant claimDeadline;
    private boolean reverted;
    private String transcript;
    private String error;
    private Instant finishedAt;
    private boolean retrieved;

    VoiceRequest(String id, long sequence, String language, Instant createdAt, Duration overallTimeout) {
        this.id = id;
        this.sequence = sequence;
        this.language = language;
        this.createdAt = createdAt;
        this.overallDeadline = createdAt.plus(overallTimeout);
    }

    String id() {
        return id;
    }

    long sequence() {
        return sequence;
    }

    String language() {
        return language;
    }

    Instant createdAt() {
        return createdAt;
    }

    /**
     * Applies elapsed deadlines.
     *
     * @return the transition that happened, or {@code null} when nothing changed
     */
    DeadlineTransition applyDeadlines(Instant now) {
        lock.lock();
        try {
            return applyDeadlinesLocked(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if the request is PENDING after deadlines were applied
     */
    boolean isPending(Instant now) {
        lock.lock();
        try {
            applyDeadlinesLocked(now);
            return state == VoiceRequestState.PENDING;
        } finally {
            lock.unlock();
        }
    }

    ClaimResult claim(Instant now, Duration claimTimeout, String newToken) {
        lock.lock();
        try {
            applyDeadlinesLocked(now);
            if (state == VoiceRequestState.PENDING) {
                state = VoiceRequestState.CLAIMED;
                claimToken = newToken;
                claimDeadline = now.plus(claimTimeout);
                return ClaimResult.success(newToken, language);
            }
            return ClaimResult.rejected(state == VoiceRequestState.TIMED_OUT
                    ? ClaimOutcome.EXPIRED
                    : ClaimOutcome.ALREADY_CLAIMED);
        } finally {
            lock.unlock();
        }
    }

    SubmitOutcome beginSubmission(Instant now, String token) {
        lock.lock();
        try {
            applyDeadlinesLocked(now);
            if (state != VoiceRequestState.CLAIMED || !holdsClaim(token)) {
                return SubmitOutcome.WRONG_STATE;
            }
            state = VoiceRequestState.RECORDING_SUBMITTED;
            return SubmitOutcome.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    SubmitOutcome abortSubmission(Instant now, String token) {
        lock.lock();
        try {
            applyDeadlinesLocked(now);
            if (state != VoiceRequestState.RECORDING_SUBMITTED || !holdsClaim(token)) {
                return SubmitOutcome.WRONG_STATE;
            }
            state = VoiceRequestState.CLAIMED;
            return SubmitOutcome.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    SubmitOutcome resolve(Instant now, String token, String transcriptText, String errorDetail) {
        lock.lock();
        try {
            applyDeadlinesLocked(now);
            if (!state.isClaimed() || !holdsClaim(token)) {
                return SubmitOutcome.WRONG_STATE;
            }
            if (errorDetail != null) {
                state = VoiceRequestState.FAILED;
                error = errorDetail;
            } else {
                state = VoiceRequestState.COMPLETED;
                transcript = transcriptText == null ? "" : transcriptText;
            }
            finishedAt = now;
            return SubmitOutcome.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current state after applying deadlines; a terminal state observed here is marked retrieved.
     */
    Observation observe(Instant now) {
        lock.lock();
        try {
            DeadlineTransition transition = applyDeadlinesLocked(now);
            if (state.isTerminal()) {
                retrieved = true;
            }
            return new Observation(new VoiceRequestStatus(id, state, language, transcript, error), transition);
        } finally {
            lock.unlock();
        }
    }

    boolean isRemovable(Instant now, Duration retention) {
        lock.lock();
        try {
            return state.isTerminal() && (retrieved || !now.isBefore(finishedAt.plus(retention)));
        } finally {
            lock.unlock();
        }
    }

    private boolean holdsClaim(String token) {
        return claimToken != null && claimToken.equals(token);
    }

    private DeadlineTransition applyDeadlinesLocked(Instant now) {
        if (state.isTerminal()) {
            return null;
        }
        if (!now.isBefore(overallDeadline)) {
            timeOut(now);
            return DeadlineTransition.TIMED_OUT;
        }
        if (state == VoiceRequestState.CLAIMED && !now.isBefore(claimDeadline)) {
            if (reverted) {
                timeOut(now);
                return DeadlineTransition.TIMED_OUT;
            }
            reverted = true;
            state = VoiceRequestState.PENDING;
            claimToken = null;
            claimDeadline = null;
            return DeadlineTransition.REVERTED;
        }
        return null;
    }

    private void timeOut(Instant now) {
        state = VoiceRequestState.TIMED_OUT;
        claimToken = null;
        finishedAt = now;
    }

    enum DeadlineTransition { REVERTED, TIMED_OUT }

    record Observation(VoiceRequestStatus status, DeadlineTransition transition) {
    }
}
