/**
 * Voice request broker: exactly-once claiming of voice-input requests by recording surfaces
 * and delivery of the transcript back to the requester.
 *
 * <p>State machine:
 * <pre>
 * PENDING --claim--&gt; CLAIMED --audio--&gt; RECORDING_SUBMITTED --transcript--&gt; COMPLETED
 *                                                           --error-------&gt; FAILED
 * any non-terminal state --overall deadline--&gt; TIMED_OUT
 * CLAIMED --claim deadline--&gt; PENDING (once), then TIMED_OUT
 * </pre>
 */
package com.phillippitts.voicebridge.service.broker;
