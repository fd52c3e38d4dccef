package com.proxylens.detection;

import com.proxylens.domain.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every registered rule against one upload.
 * A rule that throws is logged, counted and skipped; the remaining rules still run.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final RuleRegistry ruleRegistry;
    private final DetectionMetrics metrics;

    public DetectionEngine(RuleRegistry ruleRegistry, DetectionMetrics metrics) {
        this.ruleRegistry = ruleRegistry;
        this.metrics = metrics;
    }

    /**
     * Run all rules in registry order
     *
     * @return findings grouped by rule, in registry order
     */
    public List<Finding> evaluate(DetectionScope scope) {
        List<Finding> findings = new ArrayList<>();
        int failedRules = 0;

        for (DetectionRule rule : ruleRegistry.getRules()) {
            try {
                List<Finding> produced = rule.evaluate(scope);
                if (produced == null) {
                    continue;
                }
                findings.addAll(produced);
                if (!produced.isEmpty()) {
                    metrics.recordFindings(rule.getPatternName(), produced.size());
                }
                log.debug("Rule {} produced {} findings for upload {}",
                    rule.getPatternName(), produced.size(), scope.getUploadId());
            } catch (RuntimeException e) {
                failedRules++;
                RuleEvaluationException failure =
                    new RuleEvaluationException(rule.getPatternName(), scope.getUploadId(), e);
                metrics.recordRuleError(rule.getPatternName());
                log.error("Skipping detection rule: {}", failure.getMessage(), failure);
            }
        }

        log.info("Detection for upload {} evaluated {} rules ({} failed): {} findings",
            scope.getUploadId(), ruleRegistry.size(), failedRules, findings.size());
        return findings;
    }
}
