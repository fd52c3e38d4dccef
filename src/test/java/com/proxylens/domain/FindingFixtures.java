package com.proxylens.domain;

/**
 * Builders for findings used across tests.
 */
public final class FindingFixtures {

    private FindingFixtures() {
    }

    public static Finding.Builder finding(String pattern, Severity severity, double confidence) {
        return Finding.builder()
            .uploadId(EventFixtures.UPLOAD)
            .patternName(pattern)
            .severity(severity)
            .confidence(confidence)
            .title(pattern + " title")
            .summary(pattern + " summary");
    }
}
