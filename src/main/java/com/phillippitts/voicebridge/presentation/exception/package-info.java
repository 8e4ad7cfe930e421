/**
 * Translation of domain exceptions into HTTP error responses.
 *
 * <p>Status mapping: unknown session 404, busy session 409, turn timeout 504, backend failure 502,
 * saturation 503 with {@code Retry-After}, bad input 400, anything else 500.
 */
package com.phillippitts.voicebridge.presentation.exception;
