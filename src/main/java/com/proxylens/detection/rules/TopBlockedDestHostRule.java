package com.proxylens.detection.rules;

import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags destination hosts receiving many blocked requests.
 */
public class TopBlockedDestHostRule extends AbstractDetectionRule {

    public static final String PATTERN = "TOP_BLOCKED_DEST_HOST";

    private final int threshold;

    public TopBlockedDestHostRule(int threshold) {
        super(PATTERN);
        this.threshold = threshold;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        List<Event> candidates = scope.getBlockedEvents().stream()
            .filter(e -> e.getDestHost().isPresent())
            .collect(Collectors.toList());

        List<Finding> findings = new ArrayList<>();
        groupBy(candidates, Event::getDestHost).forEach((key, events) -> {
            if (events.size() >= threshold) {
                findings.add(toFinding(scope, key.get(0), events));
            }
        });
        return findings;
    }

    private Finding toFinding(DetectionScope scope, String host, List<Event> events) {
        long count = events.size();
        String category = single(events, Event::getThreatCategory);
        String user = single(events, Event::getUserEmail);
        SecurityOutcome outcome = category == null
            ? SecurityOutcome.INSUFFICIENT_EVIDENCE
            : ThreatCategories.outcomeFor(category);
        double confidence = ConfidenceScore.of(Severity.MEDIUM)
            .entities(host, category, user)
            .strength(0.22, count, threshold, 6)
            .value();

        Finding.Builder builder = newFinding(scope, Severity.MEDIUM, confidence, outcome)
            .title("Frequently blocked destination " + host)
            .summary(String.format("%d blocked requests to %s from %d users (threshold %d).",
                count, host, distinct(events, Event::getUserEmail).size(), threshold))
            .evidence(EvidenceKeys.DEST_HOST, host)
            .evidence(EvidenceKeys.COUNT, count)
            .evidence(EvidenceKeys.THRESHOLD, (long) threshold)
            .evidence(EvidenceKeys.THREAT_CATEGORY, category)
            .evidence(EvidenceKeys.THREAT_CATEGORIES, distinct(events, Event::getThreatCategory))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence("users_sample", distinct(events, Event::getUserEmail).stream()
                .limit(MAX_SAMPLE_URLS).collect(Collectors.toList()))
            .evidence(EvidenceKeys.HOW_TO_VERIFY, "Filter action=Blocked, dest_host=" + host);
        return withEventContext(builder, events).build();
    }
}
