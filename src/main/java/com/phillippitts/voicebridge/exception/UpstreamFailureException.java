package com.phillippitts.voicebridge.exception;

/**
 * Thrown when a collaborator outside this process fails: the transcription service,
 * the synthesis service, or the conversational subprocess.
 */
public class UpstreamFailureException extends VoiceBridgeException {

    private final String component;

    public UpstreamFailureException(String message, String component) {
        super(message + " (component: " + component + ")");
        this.component = component;
    }

    public UpstreamFailureException(String message, String component, Throwable cause) {
        super(message + " (component: " + component + ")", cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
