/**
 * Spring configuration: typed properties under {@code properties}, request logging context
 * under {@code logging}, and shared infrastructure beans.
 */
package com.phillippitts.voicebridge.config;
