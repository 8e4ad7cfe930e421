/**
 * Session-scoped bridge to the interactive assistant CLI.
 *
 * <p>{@link com.phillippitts.voicebridge.service.bridge.InteractiveProcess} wraps one child
 * process; {@link com.phillippitts.voicebridge.service.bridge.DefaultProcessBridge} maps sessions
 * to processes, serializes turns, and replaces processes that die. Reply boundaries are decided by
 * a {@link com.phillippitts.voicebridge.service.bridge.ReplyCompletionPolicy}: either a quiet
 * period after output ({@code QUIESCENCE}) or a prompt marker line ({@code SENTINEL}).
 */
package com.phillippitts.voicebridge.service.bridge;
