package com.proxylens.normalization.parsers;

/**
 * Exception thrown when a line cannot be tokenized in its detected dialect.
 * Carries the dialect and the offending line to help diagnose the input.
 */
public class ParseException extends RuntimeException {

    private final String dialect;
    private final String rawData;

    public ParseException(String message, String dialect, String rawData) {
        super(message);
        this.dialect = dialect;
        this.rawData = rawData;
    }

    public ParseException(String message, Throwable cause, String dialect, String rawData) {
        super(message, cause);
        this.dialect = dialect;
        this.rawData = rawData;
    }

    public String getDialect() {
        return dialect;
    }

    public String getRawData() {
        return rawData;
    }
}
