package com.phillippitts.voicebridge.presentation.exception;

import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.InvalidAudioException;
import com.phillippitts.voicebridge.exception.NoSpeechDetectedException;
import com.phillippitts.voicebridge.exception.SessionNotFoundException;
import com.phillippitts.voicebridge.exception.TurnInProgressException;
import com.phillippitts.voicebridge.exception.TurnTimeoutException;
import com.phillippitts.voicebridge.exception.UpstreamFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping stderr snippets, hosts and stack traces out of
 * response bodies.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Unknown session: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found", ex.getMessage());
    }

    /**
     * Another turn of the same session is still running (HTTP 409).
     */
    @ExceptionHandler(TurnInProgressException.class)
    ResponseEntity<ApiError> handleTurnInProgress(TurnInProgressException ex) {
        LOG.info("Session {} busy: {}", ex.getSessionId(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Session is busy", "Wait for the current turn to finish");
    }

    @ExceptionHandler(TurnTimeoutException.class)
    ResponseEntity<ApiError> handleTurnTimeout(TurnTimeoutException ex) {
        LOG.warn("Turn timed out: session={}, timeout={}ms", ex.getSessionId(), ex.getTimeout().toMillis());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex, "Assistant did not reply in time", ex.getMessage());
    }

    /**
     * A backend (speech services or assistant process) failed (HTTP 502). Not retried here.
     */
    @ExceptionHandler(UpstreamFailureException.class)
    ResponseEntity<ApiError> handleUpstreamFailure(UpstreamFailureException ex) {
        LOG.error("Upstream failure: component={}", ex.getComponent(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex, "Upstream service failed",
                "Component '" + ex.getComponent() + "' failed. Please retry.");
    }

    /**
     * Transient saturation (HTTP 503 with Retry-After).
     */
    @ExceptionHandler(CapacityExceededException.class)
    ResponseEntity<ApiError> handleCapacity(CapacityExceededException ex) {
        LOG.warn("Capacity exceeded: resource={}, limit={}", ex.getResource(), ex.getLimit());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service at capacity",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid audio format", ex.getMessage());
    }

    @ExceptionHandler(NoSpeechDetectedException.class)
    ResponseEntity<ApiError> handleNoSpeech(NoSpeechDetectedException ex) {
        return error(HttpStatus.BAD_REQUEST, ex, "No speech detected", ex.getMessage());
    }

    /**
     * Client error - malformed ids, blank text, missing parts (HTTP 400).
     */
    @ExceptionHandler({
        IllegalArgumentException.class,
        MissingServletRequestPartException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Internal server error",
                "An unexpected error occurred. Check server logs.");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standard error response body.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {
    }
}
