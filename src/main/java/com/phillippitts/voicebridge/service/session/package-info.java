/**
 * Session registry and the filesystem history cache.
 */
package com.phillippitts.voicebridge.service.session;
