package com.phillippitts.voicebridge.service.broker;

/**
 * Counts of what one reaper sweep did.
 */
public record ReapSummary(int reverted, int timedOut, int removed) {

    public boolean isEmpty() {
        return reverted == 0 && timedOut == 0 && removed == 0;
    }
}
