/**
 * Leaf adapters for the speech backends.
 *
 * <p>{@link com.phillippitts.voicebridge.service.gateway.TranscriptionGateway} and
 * {@link com.phillippitts.voicebridge.service.gateway.SynthesisAdapter} are the seams the
 * rest of the application depends on; the Wyoming implementations are the production wiring.
 */
package com.phillippitts.voicebridge.service.gateway;
