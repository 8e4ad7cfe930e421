package com.phillippitts.voicebridge.exception;

/**
 * Thrown when the transcription backend fails (connection, protocol, or timeout).
 */
public class TranscriptionException extends UpstreamFailureException {

    public TranscriptionException(String message) {
        super(message, "whisper");
    }

    public TranscriptionException(String message, String component) {
        super(message, component);
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, "whisper", cause);
    }

    public TranscriptionException(String message, String component, Throwable cause) {
        super(message, component, cause);
    }
}
