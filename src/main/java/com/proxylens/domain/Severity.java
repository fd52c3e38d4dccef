package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a finding or incident. Ranks order presentation, higher is worse.
 */
public enum Severity {

    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String value;
    private final int rank;

    Severity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAtLeast(Severity other) {
        return rank >= other.rank;
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.rank >= b.rank ? a : b;
    }

    /**
     * Parse a string value to Severity
     */
    @JsonCreator
    public static Severity fromValue(String value) {
        for (Severity severity : Severity.values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown Severity value: " + value);
    }
}
