package com.phillippitts.voicebridge.exception;

/**
 * Thrown by the conversation pipeline when the transcript of a spoken turn is empty,
 * so there is nothing to forward to the assistant.
 */
public class NoSpeechDetectedException extends VoiceBridgeException {

    public NoSpeechDetectedException() {
        super("No speech detected");
    }
}
