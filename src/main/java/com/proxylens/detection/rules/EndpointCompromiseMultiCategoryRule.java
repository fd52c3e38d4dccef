package com.proxylens.detection.rules;

import com.google.common.collect.ImmutableList;
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
 * Flags an endpoint (user, client IP) blocked across several distinct threat categories,
 * which usually means more than one stage of an intrusion is being stopped at the proxy.
 */
public class EndpointCompromiseMultiCategoryRule extends AbstractDetectionRule {

    public static final String PATTERN = "ENDPOINT_COMPROMISE_MULTI_CATEGORY";

    private static final List<String> MITRE = ImmutableList.of("TA0001", "TA0011");

    private final int minCategories;
    private final int minBlocked;
    private final int criticalBlocked;

    public EndpointCompromiseMultiCategoryRule(int minCategories, int minBlocked, int criticalBlocked) {
        super(PATTERN);
        this.minCategories = minCategories;
        this.minBlocked = minBlocked;
        this.criticalBlocked = criticalBlocked;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        List<Event> candidates = scope.getBlockedEvents().stream()
            .filter(e -> e.getThreatCategory().isPresent())
            .filter(e -> e.getUserEmail().isPresent() || e.getClientIp().isPresent())
            .collect(Collectors.toList());

        List<Finding> findings = new ArrayList<>();
        groupBy(candidates, Event::getUserEmail, Event::getClientIp).forEach((key, events) -> {
            List<String> categories = distinct(events, Event::getThreatCategory);
            if (categories.size() >= minCategories && events.size() >= minBlocked) {
                findings.add(toFinding(scope, key.get(0), key.get(1), categories, events));
            }
        });
        return findings;
    }

    private Finding toFinding(DetectionScope scope, String user, String clientIp, List<String> categories,
                              List<Event> events) {
        long blocked = events.size();
        Severity severity = blocked >= criticalBlocked ? Severity.CRITICAL : Severity.HIGH;
        double confidence = ConfidenceScore.of(severity)
            .entities(user, clientIp)
            .strength(0.20, categories.size(), minCategories, 4)
            .strength(0.22, blocked, minBlocked, 6)
            .value();

        Finding.Builder builder = newFinding(scope, severity, confidence,
                SecurityOutcome.SUSPECTED_ENDPOINT_COMPROMISE_MULTI_STAGE)
            .title("Endpoint blocked across " + categories.size() + " threat categories")
            .summary(String.format("User %s on %s had %d blocked events spanning %s.",
                nullToDash(user), nullToDash(clientIp), blocked, String.join(", ", categories)))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.THREAT_CATEGORIES, categories)
            .evidence(EvidenceKeys.COUNT, blocked)
            .evidence(EvidenceKeys.THRESHOLD, (long) minBlocked)
            .evidence("min_categories", (long) minCategories)
            .evidence(EvidenceKeys.MITRE, MITRE)
            .evidence(EvidenceKeys.HOW_TO_VERIFY, String.format(
                "Filter action=Blocked, user_email=%s, client_ip=%s and group by threat_category",
                nullToDash(user), nullToDash(clientIp)));
        return withEventContext(builder, events).build();
    }
}
