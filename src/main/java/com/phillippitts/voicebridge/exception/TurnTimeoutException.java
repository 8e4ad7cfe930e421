package com.phillippitts.voicebridge.exception;

import java.time.Duration;

/**
 * Thrown when the conversational subprocess produced no complete reply within the turn timeout.
 * The session and its subprocess stay alive.
 */
public class TurnTimeoutException extends VoiceBridgeException {

    private final String sessionId;
    private final Duration timeout;

    public TurnTimeoutException(String sessionId, Duration timeout) {
        super("No reply from session " + sessionId + " within " + timeout.toMillis() + " ms");
        this.sessionId = sessionId;
        this.timeout = timeout;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
