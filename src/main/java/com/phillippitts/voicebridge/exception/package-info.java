/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.voicebridge.exception.VoiceBridgeException}
 * and map to HTTP responses in the presentation layer's {@code GlobalExceptionHandler}.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.exception.SessionNotFoundException} - unknown session id</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.TurnInProgressException} - a turn is already
 *       running for the session</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.TurnTimeoutException} - no reply within the
 *       turn timeout (session survives)</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.UpstreamFailureException} - transcription,
 *       synthesis, or subprocess failure, with subtypes per collaborator</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.CapacityExceededException} - too many live
 *       subprocesses or busy backend</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.InvalidAudioException} and
 *       {@link com.phillippitts.voicebridge.exception.NoSpeechDetectedException} - bad input</li>
 * </ul>
 *
 * <p>The voice request broker reports not-found and lost-claim outcomes as enum values rather than
 * exceptions; these types are used where a failure really ends the operation.
 */
package com.phillippitts.voicebridge.exception;
