package com.phillippitts.voicebridge.exception;

/**
 * Thrown when no more subprocesses or backend permits can be taken. Callers may retry after backoff.
 */
public class CapacityExceededException extends VoiceBridgeException {

    private final String resource;
    private final int limit;

    public CapacityExceededException(String resource, int limit) {
        super(resource + " capacity exhausted (limit " + limit + ")");
        this.resource = resource;
        this.limit = limit;
    }

    public String getResource() {
        return resource;
    }

    public int getLimit() {
        return limit;
    }
}
