package com.phillippitts.voicebridge.domain;

/**
 * Result of a submission against a claimed voice request. Rejections never change the request.
 */
public enum SubmitOutcome {
    SUCCESS,
    NOT_FOUND,
    /** Request is not held by the presented claim token in a state that accepts the submission. */
    WRONG_STATE
}
