package com.proxylens.detection;

import com.proxylens.domain.Severity;

/**
 * Confidence of a finding.
 *
 * Starts from a severity prior, adds a small bonus per identified entity and
 * weighted terms measuring how far the observed values exceed their thresholds.
 * The result is clamped to [0.10, 0.99].
 */
public final class ConfidenceScore {

    static final double MIN = 0.10;
    static final double MAX = 0.99;
    static final double ENTITY_BONUS = 0.03;

    private double value;

    private ConfidenceScore(Severity severity) {
        this.value = prior(severity);
    }

    public static ConfidenceScore of(Severity severity) {
        return new ConfidenceScore(severity);
    }

    static double prior(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return 0.72;
            case HIGH:
                return 0.62;
            case MEDIUM:
                return 0.50;
            default:
                return 0.38;
        }
    }

    /**
     * Adds the entity bonus for every non-null entity
     */
    public ConfidenceScore entities(Object... entities) {
        for (Object entity : entities) {
            if (entity != null) {
                value += ENTITY_BONUS;
            }
        }
        return this;
    }

    /**
     * Adds {@code weight * ratio(observed, threshold, cap)}
     */
    public ConfidenceScore strength(double weight, double observed, double threshold, double cap) {
        value += weight * ratio(observed, threshold, cap);
        return this;
    }

    public ConfidenceScore plus(double amount) {
        value += amount;
        return this;
    }

    public double value() {
        double clamped = Math.max(MIN, Math.min(MAX, value));
        return Math.round(clamped * 1000.0) / 1000.0;
    }

    /**
     * 0 at the threshold, 1 at {@code cap} times the threshold, linear in between
     */
    public static double ratio(double observed, double threshold, double cap) {
        if (threshold <= 0 || cap <= 1) {
            return 0.0;
        }
        double r = (observed - threshold) / (threshold * (cap - 1));
        return Math.max(0.0, Math.min(1.0, r));
    }
}
