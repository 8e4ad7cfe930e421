package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.domain.Speaker;
import com.phillippitts.voicebridge.domain.Turn;
import com.phillippitts.voicebridge.service.bridge.InteractiveProcess;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversation state for one session id: its process handle, history and activity timestamp.
 *
 * <p>The process handle and the outstanding-reply flag are only read or replaced while holding
 * {@link #turnLock()}, which also enforces one in-flight turn per session. History and
 * timestamps may be read without it.
 */
public final class Session {

    private final String id;
    private final Instant createdAt;
    private final ReentrantLock turnLock = new ReentrantLock(true);
    private final List<Turn> history;

    private volatile InteractiveProcess process;
    private boolean replyOutstanding;
    private volatile Instant lastActiveAt;
    private volatile boolean closed;

    public Session(String id, Instant createdAt, List<Turn> restoredHistory) {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActiveAt = createdAt;
        this.history = new ArrayList<>(restoredHistory == null ? List.of() : restoredHistory);
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ReentrantLock turnLock() {
        return turnLock;
    }

    public InteractiveProcess process() {
        return process;
    }

    /**
     * Installs a new process handle and returns the one it replaces (possibly null).
     */
    public InteractiveProcess replaceProcess(InteractiveProcess next) {
        InteractiveProcess previous = this.process;
        this.process = next;
        this.replyOutstanding = false;
        return previous;
    }

    public boolean hasLiveProcess() {
        InteractiveProcess p = process;
        return p != null && p.isAlive();
    }

    /**
     * True from a turn timeout until the process has finished that turn's reply. While set,
     * no new line may be written to the process.
     */
    public boolean replyOutstanding() {
        return replyOutstanding;
    }

    public void setReplyOutstanding(boolean replyOutstanding) {
        this.replyOutstanding = replyOutstanding;
    }

    public Instant lastActiveAt() {
        return lastActiveAt;
    }

    public void touch(Instant now) {
        this.lastActiveAt = now;
    }

    public boolean isClosed() {
        return closed;
    }

    public void markClosed() {
        this.closed = true;
    }

    public Turn append(Speaker speaker, String text, Instant at) {
        Turn turn = new Turn(speaker, text, at);
        synchronized (history) {
            history.add(turn);
        }
        return turn;
    }

    public List<Turn> historySnapshot() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
}
