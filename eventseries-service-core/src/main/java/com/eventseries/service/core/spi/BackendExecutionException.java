package com.eventseries.service.core.spi;

/** Raised by a {@link TsdbQueryExecutor} when the backend rejects a request or cannot be reached. */
public class BackendExecutionException extends RuntimeException {

    private final String referrer;

    public BackendExecutionException(String referrer, String message, Throwable cause) {
        super(message, cause);
        this.referrer = referrer;
    }

    public String referrer() {
        return referrer;
    }
}
