/**
 * Audio container handling for uploads and synthesized replies.
 *
 * <p>Uploads must carry 16 kHz, 16-bit signed PCM, mono, little-endian audio, either raw or
 * inside a WAV container ({@link com.phillippitts.voicebridge.service.audio.AudioValidator}).
 * Synthesized audio is wrapped with {@link com.phillippitts.voicebridge.service.audio.WavWriter}
 * using the layout the synthesis service announces.
 */
package com.phillippitts.voicebridge.service.audio;
