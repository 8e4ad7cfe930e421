package com.phillippitts.voicebridge.domain;

/**
 * A spoken turn: what was recognized and what the assistant replied.
 *
 * @param transcript recognized user speech
 * @param reply      assistant reply to the transcript
 * @param audio      synthesized reply as WAV, or null when speech output was not requested
 */
public record VoiceTurnResult(String transcript, TurnReply reply, byte[] audio) {

    public String sessionId() {
        return reply.sessionId();
    }

    public VoiceTurnResult withAudio(byte[] wav) {
        return new VoiceTurnResult(transcript, reply, wav);
    }
}
