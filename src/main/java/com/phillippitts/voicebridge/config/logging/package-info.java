/**
 * Logging infrastructure: the servlet filter that seeds Log4j2's ThreadContext with
 * request and session identifiers.
 */
package com.phillippitts.voicebridge.config.logging;
