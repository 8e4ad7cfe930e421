package com.phillippitts.voicebridge.service.broker;

import com.phillippitts.voicebridge.config.properties.BrokerProperties;
import com.phillippitts.voicebridge.domain.VoiceInputOutcome;
import com.phillippitts.voicebridge.domain.VoiceRequestStatus;
import com.phillippitts.voicebridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Requester side of the broker: creates a request and polls it until it resolves or the
 * caller's wait budget runs out.
 *
 * <p>Blocks the calling thread for at most the effective budget (the requested one after the
 * broker's default and clamp are applied) plus one poll interval.
 */
@Component
public class VoiceInputAwaiter {

    private static final Logger LOG = LogManager.getLogger(VoiceInputAwaiter.class);

    private final VoiceRequestBroker broker;
    private final BrokerProperties props;

    public VoiceInputAwaiter(VoiceRequestBroker broker, BrokerProperties props) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Asks for spoken input and waits for it.
     *
     * @param language   transcription language; blank means the configured default
     * @param waitBudget how long to wait; null or non-positive means the configured default
     * @return RECEIVED with the transcript (possibly empty), TIMED_OUT, or FAILED with the error
     */
    public VoiceInputOutcome awaitVoiceInput(String language, Duration waitBudget) {
        Duration budget = props.effectiveTimeout(waitBudget);
        String requestId = broker.createRequest(language, budget);
        long deadline = TimeUtils.deadlineNanos(budget);
        long pollMillis = Math.max(1, props.getPollInterval().toMillis());

        while (true) {
            Optional<VoiceRequestStatus> status = broker.getResult(requestId);
            if (status.isEmpty()) {
                LOG.warn("Voice request {} disappeared before resolving", requestId);
                return VoiceInputOutcome.timedOut(requestId);
            }
            VoiceRequestStatus current = status.get();
            if (current.state().isTerminal()) {
                return switch (current.state()) {
                    case COMPLETED -> VoiceInputOutcome.received(requestId, current.transcript());
                    case FAILED -> VoiceInputOutcome.failed(requestId, current.error());
                    default -> VoiceInputOutcome.timedOut(requestId);
                };
            }

            long remainingMillis = TimeUtils.remainingMillis(deadline);
            if (remainingMillis <= 0) {
                LOG.info("Gave up waiting for voice request {} after {}s", requestId, budget.toSeconds());
                return VoiceInputOutcome.timedOut(requestId);
            }
            try {
                Thread.sleep(Math.min(pollMillis, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Wait for voice request {} interrupted", requestId);
                return VoiceInputOutcome.timedOut(requestId);
            }
        }
    }
}
