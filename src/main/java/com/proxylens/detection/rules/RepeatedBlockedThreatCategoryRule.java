package com.proxylens.detection.rules;

import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags a (user, client IP, threat category) combination that keeps getting blocked.
 */
public class RepeatedBlockedThreatCategoryRule extends AbstractDetectionRule {

    public static final String PATTERN = "REPEATED_BLOCKED_THREAT_CATEGORY";

    private final int threshold;

    public RepeatedBlockedThreatCategoryRule(int threshold) {
        super(PATTERN);
        this.threshold = threshold;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        List<Event> candidates = scope.getBlockedEvents().stream()
            .filter(e -> e.getThreatCategory().isPresent())
            .collect(Collectors.toList());

        List<Finding> findings = new ArrayList<>();
        groupBy(candidates, Event::getUserEmail, Event::getClientIp, Event::getThreatCategory)
            .forEach((key, events) -> {
                if (events.size() >= threshold) {
                    findings.add(toFinding(scope, key.get(0), key.get(1), key.get(2), events));
                }
            });
        return findings;
    }

    private Finding toFinding(DetectionScope scope, String user, String clientIp, String category,
                              List<Event> events) {
        long count = events.size();
        double confidence = ConfidenceScore.of(Severity.HIGH)
            .entities(user, clientIp, category)
            .strength(0.28, count, threshold, 6)
            .value();

        Finding.Builder builder = newFinding(scope, Severity.HIGH, confidence, ThreatCategories.outcomeFor(category))
            .title("Repeated blocked " + category + " traffic for " + nullToDash(user))
            .summary(String.format("%d blocked %s events for user %s from %s (threshold %d).",
                count, category, nullToDash(user), nullToDash(clientIp), threshold))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.THREAT_CATEGORY, category)
            .evidence(EvidenceKeys.COUNT, count)
            .evidence(EvidenceKeys.THRESHOLD, (long) threshold)
            .evidence("dest_hosts_sample", distinct(events, Event::getDestHost).stream()
                .limit(MAX_SAMPLE_URLS).collect(Collectors.toList()))
            .evidence(EvidenceKeys.HOW_TO_VERIFY, String.format(
                "Filter action=Blocked, user_email=%s, client_ip=%s, threat_category=\"%s\"",
                nullToDash(user), nullToDash(clientIp), category));
        return withEventContext(builder, events).build();
    }
}
