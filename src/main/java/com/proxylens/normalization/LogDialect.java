package com.proxylens.normalization;

/**
 * Closed set of line formats the normalizer recognizes.
 */
public enum LogDialect {

    /**
     * Zscaler NSS JSON feed, fields nested under an "event" object
     */
    ZSCALER_JSON("zscaler:json"),

    /**
     * Any other single-line JSON object
     */
    JSON("json"),

    /**
     * ArcSight Common Event Format, optionally behind a syslog prefix
     */
    CEF("cef"),

    /**
     * Whitespace separated key=value tokens
     */
    KEY_VALUE("kv"),

    UNKNOWN("unknown");

    private final String value;

    LogDialect(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
