package com.proxylens.report.narrative;

/**
 * The reasoning service could not produce a draft: not configured, unreachable,
 * too slow, or answering with an error status.
 */
public class ReasoningClientException extends RuntimeException {

    private final Integer statusCode;

    public ReasoningClientException(String message) {
        super(message);
        this.statusCode = null;
    }

    public ReasoningClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public ReasoningClientException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, null when no response was received
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
