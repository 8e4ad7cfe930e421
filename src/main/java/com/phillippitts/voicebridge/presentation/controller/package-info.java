/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.presentation.controller.VoiceRequestController}
 *       - voice request broker ({@code /api/request-voice}, {@code /api/pending-requests},
 *       {@code /api/claim-request/{id}}, {@code /api/submit-voice/{id}}, {@code /api/result/{id}},
 *       {@code /api/voice-input})</li>
 *   <li>{@link com.phillippitts.voicebridge.presentation.controller.ConversationController}
 *       - session turns ({@code /voice}, {@code /voice-text}, {@code /text}) and session management
 *       ({@code /session/new}, {@code /session/{id}/clear}, {@code /session/{id}/history})</li>
 *   <li>{@link com.phillippitts.voicebridge.presentation.controller.HealthController}
 *       - {@code GET /health}</li>
 * </ul>
 *
 * <p>Controllers delegate to services and let {@code GlobalExceptionHandler} handle exceptions.
 * Broker outcomes are not exceptions; the controller maps them to 404, 409 and 410 itself.
 *
 * @see com.phillippitts.voicebridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicebridge.presentation.controller;
