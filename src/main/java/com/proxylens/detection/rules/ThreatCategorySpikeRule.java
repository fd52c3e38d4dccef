package com.proxylens.detection.rules;

import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Flags threat categories occurring more often than a rarity-adjusted threshold.
 *
 * High-risk categories use a low floor and a small share of the upload, other categories
 * a high floor and a larger share. The effective threshold is the larger of the two.
 */
public class ThreatCategorySpikeRule extends AbstractDetectionRule {

    public static final String PATTERN = "THREAT_CATEGORY_SPIKE";

    private final Set<String> highRiskCategories;
    private final int highRiskMin;
    private final double highRiskRatio;
    private final int normalMin;
    private final double normalRatio;

    public ThreatCategorySpikeRule(Set<String> highRiskCategories, int highRiskMin, double highRiskRatio,
                                   int normalMin, double normalRatio) {
        super(PATTERN);
        this.highRiskCategories = Set.copyOf(highRiskCategories);
        this.highRiskMin = highRiskMin;
        this.highRiskRatio = highRiskRatio;
        this.normalMin = normalMin;
        this.normalRatio = normalRatio;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        int total = scope.getEvents().size();
        Map<String, List<Event>> byCategory = new TreeMap<>();
        for (Event event : scope.getEvents()) {
            event.getThreatCategory().ifPresent(category ->
                byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(event));
        }

        List<Finding> findings = new ArrayList<>();
        byCategory.forEach((category, events) -> {
            boolean highRisk = ThreatCategories.isHighRisk(category, highRiskCategories);
            long threshold = thresholdFor(highRisk, total);
            if (events.size() > threshold) {
                findings.add(toFinding(scope, category, events, highRisk, threshold, total));
            }
        });
        return findings;
    }

    long thresholdFor(boolean highRisk, int totalEvents) {
        if (highRisk) {
            return Math.max(highRiskMin, (long) Math.ceil(highRiskRatio * totalEvents));
        }
        return Math.max(normalMin, (long) Math.ceil(normalRatio * totalEvents));
    }

    private Finding toFinding(DetectionScope scope, String category, List<Event> events, boolean highRisk,
                              long threshold, int total) {
        long count = events.size();
        Severity severity;
        if (!highRisk) {
            severity = Severity.MEDIUM;
        } else if (count >= 3 * threshold) {
            severity = Severity.CRITICAL;
        } else {
            severity = Severity.HIGH;
        }
        String user = single(events, Event::getUserEmail);
        String clientIp = single(events, Event::getClientIp);
        double confidence = ConfidenceScore.of(severity)
            .entities(category, user, clientIp)
            .strength(0.25, count, threshold, 5)
            .value();

        Finding.Builder builder = newFinding(scope, severity, confidence, ThreatCategories.outcomeFor(category))
            .title("Spike in " + category + " traffic")
            .summary(String.format("%d of %d events were categorised as %s (threshold %d%s).",
                count, total, category, threshold, highRisk ? ", high-risk category" : ""))
            .evidence(EvidenceKeys.THREAT_CATEGORY, category)
            .evidence(EvidenceKeys.COUNT, count)
            .evidence(EvidenceKeys.THRESHOLD, threshold)
            .evidence("total_events", (long) total)
            .evidence("high_risk", highRisk)
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence("users_sample", distinct(events, Event::getUserEmail).stream().limit(MAX_SAMPLE_URLS)
                .collect(Collectors.toList()))
            .evidence(EvidenceKeys.HOW_TO_VERIFY, "Filter threat_category=\"" + category + "\"");
        return withEventContext(builder, events).build();
    }
}
