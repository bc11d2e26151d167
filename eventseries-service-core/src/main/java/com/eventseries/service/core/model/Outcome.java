package com.eventseries.service.core.model;

/** Ingestion outcome codes as stored in the outcomes dataset. */
public enum Outcome {
    ACCEPTED(0),
    FILTERED(1),
    RATE_LIMITED(2),
    INVALID(3),
    ABUSE(4),
    CLIENT_DISCARD(5);

    private final int code;

    Outcome(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
