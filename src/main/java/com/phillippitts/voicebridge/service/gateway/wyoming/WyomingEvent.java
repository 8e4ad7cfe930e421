package com.phillippitts.voicebridge.service.gateway.wyoming;

import org.json.JSONObject;

import java.util.Objects;

/**
 * One Wyoming protocol event: a type, a JSON data object and an optional binary payload.
 *
 * @param type    event type such as {@code transcribe}, {@code audio-chunk} or {@code transcript}
 * @param data    event data; empty object when the event carries none
 * @param payload binary payload (PCM for audio chunks); empty array when absent
 */
public record WyomingEvent(String type, JSONObject data, byte[] payload) {

    public static final String TRANSCRIBE = "transcribe";
    public static final String TRANSCRIPT = "transcript";
    public static final String SYNTHESIZE = "synthesize";
    public static final String AUDIO_START = "audio-start";
    public static final String AUDIO_CHUNK = "audio-chunk";
    public static final String AUDIO_STOP = "audio-stop";
    public static final String ERROR = "error";

    private static final byte[] NO_PAYLOAD = new byte[0];

    public WyomingEvent {
        Objects.requireNonNull(type, "type must not be null");
        data = data == null ? new JSONObject() : data;
        payload = payload == null ? NO_PAYLOAD : payload;
    }

    public static WyomingEvent of(String type, JSONObject data) {
        return new WyomingEvent(type, data, null);
    }

    public boolean is(String eventType) {
        return type.equals(eventType);
    }

    public boolean hasPayload() {
        return payload.length > 0;
    }
}
