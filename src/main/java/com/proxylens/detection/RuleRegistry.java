package com.proxylens.detection;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable list of detection rules, built once at startup.
 */
public final class RuleRegistry {

    private final List<DetectionRule> rules;

    public RuleRegistry(List<DetectionRule> rules) {
        Set<String> names = new HashSet<>();
        for (DetectionRule rule : rules) {
            if (!names.add(rule.getPatternName())) {
                throw new IllegalArgumentException("Duplicate detection rule: " + rule.getPatternName());
            }
        }
        this.rules = List.copyOf(rules);
    }

    public List<DetectionRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }
}
