package com.phillippitts.voicebridge.service.broker;

import com.phillippitts.voicebridge.config.properties.BrokerProperties;
import com.phillippitts.voicebridge.domain.ClaimOutcome;
import com.phillippitts.voicebridge.domain.ClaimResult;
import com.phillippitts.voicebridge.domain.PendingRequest;
import com.phillippitts.voicebridge.domain.SubmitOutcome;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.util.TokenGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link VoiceRequestBroker} holding requests in memory.
 *
 * <p>The table is a {@link ConcurrentHashMap}; each {@link VoiceRequest} guards its own state,
 * so operations on different requests never contend. State does not survive a restart.
 */
@Component
public class InMemoryVoiceRequestBroker implements VoiceRequestBroker {

    private static final Logger LOG = LogManager.getLogger(InMemoryVoiceRequestBroker.class);
    private static final int REQUEST_ID_BYTES = 8;
    private static final int CLAIM_TOKEN_BYTES = 16;

    private final Map<String, VoiceRequest> requests = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final BrokerProperties props;
    private final VoiceBridgeMetrics metrics;
    private final Clock clock;

    public InMemoryVoiceRequestBroker(BrokerProperties props, VoiceBridgeMetrics metrics, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        metrics.registerGauge("requests.pending", "Voice requests waiting to be claimed",
                () -> listPending().size());
    }

    @Override
    public String createRequest(String language, Duration overallTimeout) {
        String lang = language == null || language.isBlank() ? props.getDefaultLanguage() : language.strip();
        Duration timeout = props.effectiveTimeout(overallTimeout);

        String id;
        VoiceRequest request;
        do {
            id = TokenGenerator.hex(REQUEST_ID_BYTES);
            request = new VoiceRequest(id, sequence.incrementAndGet(), lang, clock.instant(), timeout);
        } while (requests.putIfAbsent(id, request) != null);

        LOG.info("Voice request {} created (language={}, timeout={}s)", id, lang, timeout.toSeconds());
        return id;
    }

    @Override
    public List<PendingRequest> listPending() {
        Instant now = clock.instant();
        return requests.values().stream()
                .filter(r -> observePending(r, now))
                .sorted(Comparator.comparingLong(VoiceRequest::sequence))
                .map(r -> new PendingRequest(r.id(), r.language(), r.createdAt()))
                .toList();
    }

    private boolean observePending(VoiceRequest request, Instant now) {
        // isPending applies deadlines first; count the timeouts it causes
        VoiceRequest.DeadlineTransition transition = request.applyDeadlines(now);
        recordTransition(request.id(), transition);
        return request.isPending(now);
    }

    @Override
    public ClaimResult claim(String requestId) {
        VoiceRequest request = lookup(requestId);
        if (request == null) {
            metrics.recordClaim(ClaimOutcome.NOT_FOUND.name());
            return ClaimResult.rejected(ClaimOutcome.NOT_FOUND);
        }
        Instant now = clock.instant();
        recordTransition(requestId, request.applyDeadlines(now));
        ClaimResult result = request.claim(now, props.getClaimTimeout(), TokenGenerator.hex(CLAIM_TOKEN_BYTES));
        metrics.recordClaim(result.outcome().name());
        LOG.info("Claim on voice request {}: {}", requestId, result.outcome());
        return result;
    }

    @Override
    public SubmitOutcome beginSubmission(String requestId, String claimToken) {
        VoiceRequest request = lookup(requestId);
        if (request == null) {
            return SubmitOutcome.NOT_FOUND;
        }
        Instant now = clock.instant();
        recordTransition(requestId, request.applyDeadlines(now));
        SubmitOutcome outcome = request.beginSubmission(now, claimToken);
        LOG.debug("Recording submitted for voice request {}: {}", requestId, outcome);
        return outcome;
    }

    @Override
    public SubmitOutcome abortSubmission(String requestId, String claimToken) {
        VoiceRequest request = lookup(requestId);
        if (request == null) {
            return SubmitOutcome.NOT_FOUND;
        }
        Instant now = clock.instant();
        recordTransition(requestId, request.applyDeadlines(now));
        SubmitOutcome outcome = request.abortSubmission(now, claimToken);
        LOG.info("Submission for voice request {} returned to its claimant: {}", requestId, outcome);
        return outcome;
    }

    @Override
    public SubmitOutcome submitTranscript(String requestId, String claimToken, String transcript) {
        return resolve(requestId, claimToken, transcript == null ? "" : transcript, null);
    }

    @Override
    public SubmitOutcome submitError(String requestId, String claimToken, String error) {
        return resolve(requestId, claimToken, null, error == null || error.isBlank() ? "unknown error" : error);
    }

    private SubmitOutcome resolve(String requestId, String claimToken, String transcript, String error) {
        VoiceRequest request = lookup(requestId);
        if (request == null) {
            return SubmitOutcome.NOT_FOUND;
        }
        Instant now = clock.instant();
        recordTransition(requestId, request.applyDeadlines(now));
        SubmitOutcome outcome = request.resolve(now, claimToken, transcript, error);
        if (outcome == SubmitOutcome.SUCCESS) {
            LOG.info("Voice request {} {}", requestId, error == null
                    ? "completed (" + transcript.length() + " chars)"
                    : "failed");
        } else {
            LOG.info("Rejected submission for voice request {}: {}", requestId, outcome);
        }
        return outcome;
    }

    @Override
    public Optional<VoiceRequestStatus> getResult(String requestId) {
        VoiceRequest request = lookup(requestId);
        if (request == null) {
            return Optional.empty();
        }
        VoiceRequest.Observation observation = request.observe(clock.instant());
        recordTransition(requestId, observation.transition());
        return Optional.of(observation.status());
    }

    @Override
    public ReapSummary reap() {
        Instant now = clock.instant();
        int reverted = 0;
        int timedOut = 0;
        int removed = 0;
        for (VoiceRequest request : requests.values()) {
            VoiceRequest.DeadlineTransition transition = request.applyDeadlines(now);
            recordTransition(request.id(), transition);
            if (transition == VoiceRequest.DeadlineTransition.REVERTED) {
                reverted++;
            } else if (transition == VoiceRequest.DeadlineTransition.TIMED_OUT) {
                timedOut++;
            }
            if (request.isRemovable(now, props.getRetention()) && requests.remove(request.id(), request)) {
                removed++;
            }
        }
        return new ReapSummary(reverted, timedOut, removed);
    }

    @Override
    public int size() {
        return requests.size();
    }

    private VoiceRequest lookup(String requestId) {
        return requestId == null ? null : requests.get(requestId);
    }

    private void recordTransition(String requestId, VoiceRequest.DeadlineTransition transition) {
        if (transition == VoiceRequest.DeadlineTransition.TIMED_OUT) {
            metrics.incrementRequestTimedOut();
            LOG.info("Voice request {} timed out", requestId);
        } else if (transition == VoiceRequest.DeadlineTransition.REVERTED) {
            LOG.info("Claim on voice request {} lapsed; request is pending again", requestId);
        }
    }
}
