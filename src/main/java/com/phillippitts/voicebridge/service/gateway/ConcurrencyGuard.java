package com.phillippitts.voicebridge.service.gateway;

import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.TranscriptionException;
import com.phillippitts.voicebridge.service.events.UpstreamFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent calls into a backend with a fair semaphore.
 *
 * <p>Waiting callers block up to the configured timeout; a caller that times out gets a
 * {@link CapacityExceededException} and a failure event is published.
 *
 * <pre>{@code
 * guard.acquire();
 * try {
 *     // ... call the backend ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final int limit;
    private final long timeoutMs;
    private final String backendName;
    private final ApplicationEventPublisher publisher;

    /**
     * @param limit concurrent calls allowed
     * @param timeoutMs maximum time to wait for a permit in milliseconds
     * @param backendName backend name for error messages and events
     * @param publisher event publisher for failure notifications (nullable)
     */
    public ConcurrencyGuard(int limit, long timeoutMs, String backendName, ApplicationEventPublisher publisher) {
        this.semaphore = new Semaphore(limit, true);
        this.limit = limit;
        this.timeoutMs = timeoutMs;
        this.backendName = backendName;
        this.publisher = publisher;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * @throws CapacityExceededException if no permit frees up within the timeout
     * @throws TranscriptionException if the thread is interrupted while waiting
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                publishLimitReached();
                throw new CapacityExceededException(backendName, limit);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException(backendName + " call interrupted while waiting for a slot",
                    backendName, e);
        }
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    private void publishLimitReached() {
        if (publisher != null) {
            publisher.publishEvent(new UpstreamFailureEvent(
                    backendName,
                    Instant.now(),
                    "concurrency limit reached after " + timeoutMs + "ms wait",
                    null,
                    Map.of("reason", "concurrency-limit", "timeoutMs", String.valueOf(timeoutMs))));
        }
    }
}
