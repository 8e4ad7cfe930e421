package com.phillippitts.voicebridge.domain;

/**
 * Result of an attempt to claim a pending voice request.
 */
public enum ClaimOutcome {
    SUCCESS,
    ALREADY_CLAIMED,
    NOT_FOUND,
    EXPIRED
}
