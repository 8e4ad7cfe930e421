package com.phillippitts.voicebridge.exception;

/**
 * Thrown when the speech synthesis backend fails or returns no audio.
 */
public class SynthesisException extends UpstreamFailureException {

    public SynthesisException(String message) {
        super(message, "piper");
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, "piper", cause);
    }
}
