package com.proxylens.detection;

import com.proxylens.domain.Finding;

import java.util.List;

/**
 * A named, independently evaluable detection rule.
 *
 * Rules are stateless and receive a read-only view of exactly one upload. A rule
 * may throw; the engine isolates the failure from the other rules.
 */
public interface DetectionRule {

    /**
     * Pattern name stamped on every finding of this rule, e.g. BURST_FROM_SINGLE_IP
     */
    String getPatternName();

    /**
     * Evaluate the rule against one upload
     *
     * @param scope events and rollups of the upload
     * @return zero or more findings, in a deterministic order
     */
    List<Finding> evaluate(DetectionScope scope);
}
