package com.phillippitts.voicebridge.exception;

/**
 * Thrown when an operation addresses a session id the store does not know.
 */
public class SessionNotFoundException extends VoiceBridgeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
