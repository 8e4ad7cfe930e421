package com.phillippitts.voicebridge.domain;

/**
 * Author of a history entry.
 */
public enum Speaker {
    USER,
    ASSISTANT,
    /** Discontinuities recorded by the bridge itself (respawns, discarded output). */
    SYSTEM
}
