package com.phillippitts.voicebridge.service.bridge;

import com.phillippitts.voicebridge.domain.Turn;
import com.phillippitts.voicebridge.domain.TurnReply;
import com.phillippitts.voicebridge.service.session.Session;

import java.time.Duration;
import java.util.List;

/**
 * Keeps one conversational subprocess per session and exchanges turns with it.
 *
 * <p>Sessions run in parallel. Within a session turns never overlap and are answered in order.
 */
public interface ProcessBridge {

    /**
     * Returns the session for {@code sessionId}, creating it (and spawning its process) when
     * the id is null, blank or not yet known. A supplied unknown id is adopted as-is.
     *
     * @throws IllegalArgumentException if {@code sessionId} contains characters outside [A-Za-z0-9_-]
     * @throws com.phillippitts.voicebridge.exception.CapacityExceededException if no process slot is free
     * @throws com.phillippitts.voicebridge.exception.ProcessFailureException if the process cannot be started
     */
    Session getOrCreate(String sessionId);

    /**
     * Sends one message and waits for the complete reply.
     *
     * <p>A turn arriving while another is in flight on the same session waits at most
     * {@code timeout} for it to finish. A process found dead is replaced before the turn;
     * a process dying during the turn is replaced once and the turn retried.
     *
     * @param timeout maximum wait for the reply; null or non-positive means the configured default
     * @throws com.phillippitts.voicebridge.exception.SessionNotFoundException if the session does not exist
     * @throws com.phillippitts.voicebridge.exception.TurnInProgressException if the session stayed busy
     * @throws com.phillippitts.voicebridge.exception.TurnTimeoutException if no complete reply arrived;
     *         the process keeps running and its late output is discarded before the next turn
     * @throws com.phillippitts.voicebridge.exception.ProcessFailureException if the retried turn failed too
     */
    TurnReply sendTurn(String sessionId, String text, Duration timeout);

    /**
     * Terminates the session's process and discards its history. Unknown ids are a no-op.
     *
     * @return true when a session was removed
     */
    boolean clear(String sessionId);

    /**
     * @throws com.phillippitts.voicebridge.exception.SessionNotFoundException if the session does not exist
     */
    List<Turn> history(String sessionId);

    /**
     * Closes sessions idle for longer than the configured idle timeout and releases the slots
     * of processes that exited on their own. Sessions with a turn in flight are skipped.
     *
     * @return number of sessions closed
     */
    int evictIdle();

    int liveSessions();
}
