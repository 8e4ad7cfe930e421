package com.phillippitts.voicebridge.service.bridge;

import com.phillippitts.voicebridge.config.properties.BridgeProperties;
import com.phillippitts.voicebridge.domain.Speaker;
import com.phillippitts.voicebridge.domain.Turn;
import com.phillippitts.voicebridge.domain.TurnReply;
import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.ProcessFailureException;
import com.phillippitts.voicebridge.exception.SessionNotFoundException;
import com.phillippitts.voicebridge.exception.TurnInProgressException;
import com.phillippitts.voicebridge.exception.TurnTimeoutException;
import com.phillippitts.voicebridge.exception.UpstreamFailureExceptionBuilder;
import com.phillippitts.voicebridge.service.events.ProcessRespawnedEvent;
import com.phillippitts.voicebridge.service.events.StaleOutputDiscardedEvent;
import com.phillippitts.voicebridge.service.events.UpstreamFailureEvent;
import com.phillippitts.voicebridge.service.metrics.VoiceBridgeMetrics;
import com.phillippitts.voicebridge.service.session.Session;
import com.phillippitts.voicebridge.service.session.SessionHistoryRepository;
import com.phillippitts.voicebridge.service.session.SessionStore;
import com.phillippitts.voicebridge.util.LogSanitizer;
import com.phillippitts.voicebridge.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ProcessBridge} that runs the configured assistant CLI once per session.
 *
 * <p>Concurrency model:
 * <ul>
 *   <li>Each session has its own fair turn lock; sessions never wait on each other.</li>
 *   <li>Live processes are bounded by a semaphore of {@code bridge.max-sessions} permits.
 *       A permit is taken at spawn and returned when the process is closed.</li>
 *   <li>Process handles are replaced and history is saved only while holding the session's turn
 *       lock. {@link #clear} closes a handle without the lock so an in-flight turn is cut short,
 *       then deletes the history under it.</li>
 * </ul>
 *
 * <p>Timeouts leave the process running with its reply outstanding. The next turn first waits,
 * within its own budget, for that reply to complete and discards it as a SYSTEM history entry.
 * A new line is written only once the outstanding reply is done, so late text never leaks into
 * another reply. If it does not complete in time the new turn is rejected unsent.
 */
@Component
public class DefaultProcessBridge implements ProcessBridge {

    private static final Logger LOG = LogManager.getLogger(DefaultProcessBridge.class);
    private static final int STDERR_SNIPPET_CHARS = 500;
    private static final String COMPONENT = "assistant-process";

    private final BridgeProperties props;
    private final SessionStore store;
    private final SessionHistoryRepository historyRepository;
    private final ProcessFactory processFactory;
    private final ApplicationEventPublisher publisher;
    private final VoiceBridgeMetrics metrics;
    private final Clock clock;
    private final ReplyCompletionPolicy policy;
    private final Semaphore processSlots;

    @Autowired
    public DefaultProcessBridge(BridgeProperties props,
                                SessionStore store,
                                SessionHistoryRepository historyRepository,
                                ApplicationEventPublisher publisher,
                                VoiceBridgeMetrics metrics,
                                Clock clock) {
        this(props, store, historyRepository, new DefaultProcessFactory(), publisher, metrics, clock);
    }

    DefaultProcessBridge(BridgeProperties props,
                         SessionStore store,
                         SessionHistoryRepository historyRepository,
                         ProcessFactory processFactory,
                         ApplicationEventPublisher publisher,
                         VoiceBridgeMetrics metrics,
                         Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.store = Objects.requireNonNull(store, "store");
        this.historyRepository = Objects.requireNonNull(historyRepository, "historyRepository");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = ReplyCompletionPolicy.from(props.getCompletion());
        this.processSlots = new Semaphore(props.getMaxSessions(), true);
        metrics.registerGauge("sessions.live", "Sessions with a running assistant process", this::liveSessions);
        LOG.info("Process bridge ready: command='{}', maxSessions={}, completion={}",
                String.join(" ", props.getCommand()), props.getMaxSessions(), policy);
    }

    @Override
    public Session getOrCreate(String sessionId) {
        AtomicBoolean created = new AtomicBoolean(false);
        Session session;
        if (sessionId == null || sessionId.isBlank()) {
            session = store.createWithNewId(this::newSession);
            created.set(true);
        } else {
            String id = sessionId.strip();
            if (!SessionStore.isValidId(id)) {
                throw new IllegalArgumentException("Invalid session id: " + LogSanitizer.truncate(sessionId, 64));
            }
            session = store.getOrCreate(id, key -> {
                created.set(true);
                return newSession(key);
            });
        }
        // a held lock means a turn is running, which implies a process exists or is being replaced
        if (session.turnLock().tryLock()) {
            try {
                if (session.process() == null && !session.isClosed()) {
                    spawnForNewSession(session, created.get());
                }
            } finally {
                session.turnLock().unlock();
            }
        }
        return session;
    }

    private void spawnForNewSession(Session session, boolean created) {
        try {
            spawn(session);
        } catch (RuntimeException e) {
            // a session that never had a process is not kept around
            if (created && store.remove(session)) {
                session.markClosed();
            }
            throw e;
        }
    }

    private Session newSession(String id) {
        List<Turn> restored = historyRepository.load(id);
        LOG.info("Created session {} ({} restored history entries)", id, restored.size());
        return new Session(id, clock.instant(), restored);
    }

    @Override
    public TurnReply sendTurn(String sessionId, String text, Duration timeout) {
        Objects.requireNonNull(text, "text must not be null");
        Duration budget = timeout == null || timeout.isNegative() || timeout.isZero()
                ? props.getTurnTimeout()
                : timeout;
        long start = System.nanoTime();
        long deadline = start + budget.toNanos();

        Session session = store.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        ReentrantLock lock = session.turnLock();
        boolean acquired;
        try {
            acquired = lock.tryLock(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            metrics.incrementTurnFailure("conflict");
            throw new TurnInProgressException(sessionId, TimeUtils.elapsedMillis(start));
        }
        try {
            if (session.isClosed()) {
                throw new SessionNotFoundException(sessionId);
            }
            return runTurn(session, text, budget, start, deadline);
        } finally {
            lock.unlock();
        }
    }

    private TurnReply runTurn(Session session, String text, Duration budget, long start, long deadline) {
        boolean respawned = false;
        InteractiveProcess process = session.process();
        if (process == null) {
            process = spawn(session);
        } else if (!process.isAlive()) {
            process = respawn(session, process, false);
            respawned = true;
        }
        boolean staleDiscarded = false;
        if (session.replyOutstanding()) {
            try {
                staleDiscarded = discardOutstandingReply(session, process, start, deadline);
            } catch (IOException e) {
                LOG.warn("Assistant process for session {} died while finishing a timed-out turn ({})",
                        session.id(), e.getMessage());
                process = respawn(session, process, false);
                respawned = true;
            }
        } else {
            dropUnsolicitedOutput(session, process);
        }

        Instant sentAt = clock.instant();
        session.append(Speaker.USER, text, sentAt);
        session.touch(sentAt);
        LOG.debug("Turn on session {}: {}", session.id(), LogSanitizer.preview(text, 120));

        String reply;
        try {
            reply = exchange(session, process, budget, deadline, text);
        } catch (IOException firstFailure) {
            if (session.isClosed()) {
                throw new SessionNotFoundException(session.id());
            }
            LOG.warn("Assistant process for session {} failed during a turn ({}); retrying once",
                    session.id(), firstFailure.getMessage());
            process = respawn(session, process, true);
            respawned = true;
            try {
                reply = exchange(session, process, budget, deadline, text);
            } catch (IOException secondFailure) {
                if (session.isClosed()) {
                    throw new SessionNotFoundException(session.id());
                }
                metrics.incrementTurnFailure("process-death");
                throw processFailure("Assistant process failed again after respawn", session, process,
                        start, secondFailure);
            }
        }

        String replyText = reply.strip();
        Instant repliedAt = clock.instant();
        session.append(Speaker.ASSISTANT, replyText, repliedAt);
        session.touch(repliedAt);
        persist(session);

        long elapsedNanos = System.nanoTime() - start;
        metrics.recordTurnLatency(elapsedNanos);
        LOG.info("Session {} replied in {} ms ({} chars, respawned={}, staleOutputDiscarded={})",
                session.id(), TimeUtils.nanosToMillis(elapsedNanos), replyText.length(), respawned, staleDiscarded);
        LOG.debug("Reply on session {}: {}", session.id(), LogSanitizer.preview(replyText, 120));
        return new TurnReply(session.id(), replyText, respawned, staleDiscarded,
                TimeUtils.nanosToMillis(elapsedNanos));
    }

    private String exchange(Session session, InteractiveProcess process, Duration budget, long deadline,
                            String text) throws IOException {
        process.send(text);
        long remaining = deadline - System.nanoTime();
        Optional<String> reply = remaining > 0
                ? process.awaitReply(policy, Duration.ofNanos(remaining))
                : Optional.empty();
        if (reply.isEmpty()) {
            session.setReplyOutstanding(true);
            session.append(Speaker.SYSTEM, "Turn timed out after " + budget.toMillis() + " ms", clock.instant());
            persist(session);
            metrics.incrementTurnFailure("timeout");
            LOG.warn("Session {} did not reply within {} ms; process left running", session.id(), budget.toMillis());
            throw new TurnTimeoutException(session.id(), budget);
        }
        return reply.get();
    }

    /**
     * Waits for the reply of a timed-out turn to complete and discards it.
     *
     * @return true when late output was discarded
     * @throws TurnInProgressException if the reply does not complete before {@code deadline};
     *         nothing is written to the process in that case
     * @throws IOException if the process ended its output first
     */
    private boolean discardOutstandingReply(Session session, InteractiveProcess process, long start, long deadline)
            throws IOException {
        long remaining = TimeUtils.remainingNanos(deadline);
        Optional<String> late = remaining > 0
                ? process.awaitReply(policy, Duration.ofNanos(remaining))
                : Optional.empty();
        if (late.isEmpty()) {
            metrics.incrementTurnFailure("conflict");
            LOG.warn("Session {} is still answering a timed-out turn; new turn not sent", session.id());
            throw new TurnInProgressException(session.id(), TimeUtils.elapsedMillis(start));
        }
        session.setReplyOutstanding(false);
        String discarded = (late.get() + process.drainOutput()).strip();
        Instant now = clock.instant();
        session.append(Speaker.SYSTEM, "Discarded late output of a timed-out turn: " + discarded, now);
        LOG.warn("Discarded {} chars of late output on session {} after a timed-out turn",
                discarded.length(), session.id());
        publish(new StaleOutputDiscardedEvent(session.id(), now, discarded.length()));
        return true;
    }

    /**
     * Drops output nobody asked for, such as a startup banner or a stray prompt.
     */
    private void dropUnsolicitedOutput(Session session, InteractiveProcess process) {
        String pending = process.drainOutput();
        if (!pending.isBlank()) {
            LOG.debug("Dropped {} chars of unsolicited output on session {}", pending.length(), session.id());
        }
    }

    private InteractiveProcess spawn(Session session) {
        acquireSlot();
        List<String> command = props.getCommand();
        try {
            Process process = processFactory.start(command, workingDirectory());
            InteractiveProcess handle = new InteractiveProcess(process, session.id(),
                    props.getMaxStderrChars(), props.getShutdownGrace(), processSlots::release);
            session.replaceProcess(handle);
            LOG.info("Started assistant process for session {} ({} of {} slots in use)", session.id(),
                    props.getMaxSessions() - processSlots.availablePermits(), props.getMaxSessions());
            return handle;
        } catch (IOException e) {
            processSlots.release();
            metrics.incrementTurnFailure("spawn");
            publish(new UpstreamFailureEvent(COMPONENT, clock.instant(), "spawn failed", e,
                    Map.of("reason", "spawn", "sessionId", session.id())));
            throw UpstreamFailureExceptionBuilder.create("Failed to start assistant process")
                    .cause(e)
                    .metadata("sessionId", session.id())
                    .metadata("command", String.join(" ", command))
                    .build(ProcessFailureException::new);
        }
    }

    private InteractiveProcess respawn(Session session, InteractiveProcess dead, boolean duringTurn) {
        int exitCode = dead.exitCode();
        String stderrTail = dead.stderrTail(STDERR_SNIPPET_CHARS);
        dead.close();
        session.replaceProcess(null);
        if (session.isClosed()) {
            throw new SessionNotFoundException(session.id());
        }

        InteractiveProcess fresh = spawn(session);
        Instant now = clock.instant();
        session.append(Speaker.SYSTEM,
                "Assistant process restarted (exit=" + exitCode + "); earlier context was lost", now);
        metrics.incrementRespawn();
        publish(new ProcessRespawnedEvent(session.id(), now, exitCode, duringTurn));
        LOG.warn("Respawned assistant process for session {} (exit={}, duringTurn={}, stderr={})",
                session.id(), exitCode, duringTurn, LogSanitizer.preview(stderrTail, 200));
        return fresh;
    }

    private void acquireSlot() {
        boolean acquired;
        try {
            acquired = processSlots.tryAcquire(props.getCapacityAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessFailureException("Interrupted while waiting for a process slot", e);
        }
        if (!acquired) {
            metrics.incrementTurnFailure("capacity");
            throw new CapacityExceededException(COMPONENT, props.getMaxSessions());
        }
    }

    private ProcessFailureException processFailure(String message, Session session, InteractiveProcess process,
                                                   long startNanos, Throwable cause) {
        String stderrTail = process.stderrTail(STDERR_SNIPPET_CHARS);
        publish(new UpstreamFailureEvent(COMPONENT, clock.instant(), message, cause,
                Map.of("reason", "process-death", "sessionId", session.id())));
        return UpstreamFailureExceptionBuilder.create(message)
                .cause(cause)
                .exitCode(process.exitCode())
                .durationMs(TimeUtils.elapsedMillis(startNanos))
                .metadata("sessionId", session.id())
                .metadata("stderr", stderrTail.isEmpty() ? null : stderrTail)
                .build(ProcessFailureException::new);
    }

    @Override
    public boolean clear(String sessionId) {
        Optional<Session> found = store.get(sessionId);
        if (found.isEmpty()) {
            if (SessionStore.isValidId(sessionId)) {
                historyRepository.delete(sessionId);
            }
            LOG.debug("Clear of unknown session {} ignored", sessionId);
            return false;
        }
        Session session = found.get();
        store.remove(session);
        session.markClosed();
        InteractiveProcess process = session.process();
        if (process != null) {
            process.close();
        }
        // history is saved under the turn lock; deleting under it keeps a late save from restoring it
        session.turnLock().lock();
        try {
            historyRepository.delete(session.id());
        } finally {
            session.turnLock().unlock();
        }
        LOG.info("Cleared session {}", session.id());
        return true;
    }

    @Override
    public List<Turn> history(String sessionId) {
        return store.get(sessionId)
                .map(Session::historySnapshot)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(props.getIdleTimeout());
        int evicted = 0;
        for (Session session : store.all()) {
            if (!session.turnLock().tryLock()) {
                continue;
            }
            try {
                InteractiveProcess process = session.process();
                if (session.lastActiveAt().isBefore(cutoff)) {
                    if (store.remove(session)) {
                        session.markClosed();
                        if (process != null) {
                            process.close();
                        }
                        evicted++;
                        LOG.info("Evicted session {} idle since {}", session.id(), session.lastActiveAt());
                    }
                } else if (process != null && !process.isAlive()) {
                    // frees the slot; the next turn sees a dead handle and respawns
                    process.close();
                }
            } finally {
                session.turnLock().unlock();
            }
        }
        return evicted;
    }

    @Override
    public int liveSessions() {
        int live = 0;
        for (Session session : store.all()) {
            if (session.hasLiveProcess()) {
                live++;
            }
        }
        return live;
    }

    /**
     * Terminates every process on application shutdown. History caches are kept.
     */
    @PreDestroy
    public void shutdown() {
        List<Session> sessions = store.all();
        LOG.info("Shutting down {} session(s)", sessions.size());
        for (Session session : sessions) {
            store.remove(session);
            session.markClosed();
            InteractiveProcess process = session.process();
            if (process != null) {
                process.close();
            }
        }
    }

    private void persist(Session session) {
        if (!session.isClosed()) {
            historyRepository.save(session.id(), session.historySnapshot());
        }
    }

    private Path workingDirectory() {
        String dir = props.getWorkingDirectory();
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }

    private void publish(Object event) {
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }
}
