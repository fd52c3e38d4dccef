package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed vocabulary of security outcomes attached to findings and incidents.
 */
public enum SecurityOutcome {

    SUSPECTED_ENDPOINT_COMPROMISE_MULTI_STAGE,
    C2_BEACONING_SUSPECTED,
    PHISH_TO_PAYLOAD_CHAIN_SUSPECTED,
    DATA_EXFILTRATION_ATTEMPT_SUSPECTED,
    CREDENTIAL_HARVESTING_SUSPECTED,
    RANSOMWARE_STAGING_SUSPECTED,
    CRYPTOMINING_ACTIVITY_SUSPECTED,
    RECONNAISSANCE_SUSPECTED,
    POLICY_VIOLATION_SUSPECTED,
    INSUFFICIENT_EVIDENCE;

    @JsonValue
    public String getValue() {
        return name();
    }

    /**
     * Lenient lookup, returns null for values outside the vocabulary.
     */
    public static SecurityOutcome fromValueOrNull(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase();
        for (SecurityOutcome outcome : values()) {
            if (outcome.name().equals(normalized)) {
                return outcome;
            }
        }
        return null;
    }
}
