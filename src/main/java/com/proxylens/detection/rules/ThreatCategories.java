package com.proxylens.detection.rules;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.proxylens.domain.SecurityOutcome;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Threat category families used by several rules. Matching is by case-insensitive prefix.
 */
public final class ThreatCategories {

    public static final Set<String> DEFAULT_HIGH_RISK = ImmutableSet.of(
        "Malware", "Ransomware", "Botnet", "Command and Control", "Phishing",
        "Cryptomining", "Data Leakage", "Data Transfer", "Spyware", "Adware/Spyware");

    private static final List<String> C2_PREFIXES = ImmutableList.of("botnet", "command", "c2", "c&c");

    private static final List<String> PAYLOAD_PREFIXES = ImmutableList.of(
        "malware", "ransomware", "botnet", "cryptomining", "data transfer", "data leakage");

    private ThreatCategories() {
    }

    public static boolean isC2(String category) {
        return startsWithAny(category, C2_PREFIXES);
    }

    public static boolean isPhishing(String category) {
        return category != null && category.toLowerCase(Locale.ROOT).contains("phish");
    }

    public static boolean isPayload(String category) {
        return startsWithAny(category, PAYLOAD_PREFIXES);
    }

    public static boolean isHighRisk(String category, Set<String> highRisk) {
        if (category == null) {
            return false;
        }
        String lower = category.toLowerCase(Locale.ROOT);
        for (String candidate : highRisk) {
            if (lower.startsWith(candidate.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Most likely outcome suggested by a single category
     */
    public static SecurityOutcome outcomeFor(String category) {
        if (category == null) {
            return SecurityOutcome.INSUFFICIENT_EVIDENCE;
        }
        String lower = category.toLowerCase(Locale.ROOT);
        if (isC2(category)) {
            return SecurityOutcome.C2_BEACONING_SUSPECTED;
        }
        if (isPhishing(category)) {
            return SecurityOutcome.CREDENTIAL_HARVESTING_SUSPECTED;
        }
        if (lower.startsWith("ransomware")) {
            return SecurityOutcome.RANSOMWARE_STAGING_SUSPECTED;
        }
        if (lower.startsWith("cryptomining")) {
            return SecurityOutcome.CRYPTOMINING_ACTIVITY_SUSPECTED;
        }
        if (lower.startsWith("data leakage") || lower.startsWith("data transfer")) {
            return SecurityOutcome.DATA_EXFILTRATION_ATTEMPT_SUSPECTED;
        }
        if (lower.startsWith("malware") || lower.startsWith("spyware") || lower.startsWith("browser exploit")) {
            return SecurityOutcome.SUSPECTED_ENDPOINT_COMPROMISE_MULTI_STAGE;
        }
        return SecurityOutcome.INSUFFICIENT_EVIDENCE;
    }

    private static boolean startsWithAny(String category, List<String> prefixes) {
        if (category == null) {
            return false;
        }
        String lower = category.toLowerCase(Locale.ROOT);
        for (String prefix : prefixes) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
