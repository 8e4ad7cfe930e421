/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters that
 * speak snake_case JSON; business rules and state transitions live in the service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for the broker, conversation and health routes</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.voicebridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicebridge.presentation;
