/**
 * Immutable domain types shared by the broker, the process bridge and the HTTP layer.
 */
package com.phillippitts.voicebridge.domain;
