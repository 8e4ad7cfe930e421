package com.phillippitts.voicebridge.service.gateway;

/**
 * Text-to-speech backend.
 */
public interface SynthesisAdapter {

    /**
     * Synthesizes speech.
     *
     * @param text         text to speak; must not be blank
     * @param voiceProfile voice name, or null/blank for the configured default
     * @return a complete WAV file
     * @throws com.phillippitts.voicebridge.exception.SynthesisException if the backend fails
     */
    byte[] synthesize(String text, String voiceProfile);

    String endpoint();
}
