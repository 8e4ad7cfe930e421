package com.phillippitts.voicebridge.exception;

/**
 * Thrown when the conversational subprocess cannot be started or dies mid-turn
 * even after the bridge's transparent respawn.
 */
public class ProcessFailureException extends UpstreamFailureException {

    public ProcessFailureException(String message) {
        super(message, "assistant-process");
    }

    public ProcessFailureException(String message, Throwable cause) {
        super(message, "assistant-process", cause);
    }
}
