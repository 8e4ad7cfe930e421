package com.phillippitts.voicebridge.exception;

/**
 * Thrown when a turn is submitted to a session whose previous turn is still in flight
 * and does not finish within the caller's wait budget.
 */
public class TurnInProgressException extends VoiceBridgeException {

    private final String sessionId;

    public TurnInProgressException(String sessionId, long waitedMs) {
        super("Session " + sessionId + " is busy with another turn (waited " + waitedMs + " ms)");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
