/**
 * Minimal Wyoming protocol client used to talk to the speech-to-text and text-to-speech services.
 */
package com.phillippitts.voicebridge.service.gateway.wyoming;
