package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of the narrative text in a generated report.
 */
public enum NarrativeSource {

    /**
     * Text drafted by the external reasoning service and accepted by validation
     */
    REASONING_SERVICE("reasoning_service"),

    /**
     * Deterministic text derived from the structured report
     */
    TEMPLATE("template");

    private final String value;

    NarrativeSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
