package com.proxylens.detection.rules;

import com.google.common.collect.ImmutableList;
import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags an endpoint where blocked phishing is followed shortly by blocked payload traffic
 * (malware, ransomware, botnet, cryptomining or data transfer categories).
 */
public class PhishToPayloadChainRule extends AbstractDetectionRule {

    public static final String PATTERN = "PHISH_TO_PAYLOAD_CHAIN_SUSPECTED";

    private static final List<String> MITRE = ImmutableList.of("TA0001", "TA0002", "TA0011");

    private final int minPhish;
    private final int minPayload;
    private final Duration window;

    public PhishToPayloadChainRule(int minPhish, int minPayload, Duration window) {
        super(PATTERN);
        this.minPhish = minPhish;
        this.minPayload = minPayload;
        this.window = window;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        List<Event> candidates = scope.getBlockedEvents().stream()
            .filter(e -> e.getTimestamp().isPresent())
            .filter(e -> e.getUserEmail().isPresent() || e.getClientIp().isPresent())
            .collect(Collectors.toList());

        List<Finding> findings = new ArrayList<>();
        Map<List<String>, List<Event>> endpoints = groupBy(candidates, Event::getUserEmail, Event::getClientIp);
        endpoints.forEach((key, events) -> {
            List<Event> phish = events.stream()
                .filter(e -> ThreatCategories.isPhishing(e.getThreatCategory().orElse(null)))
                .collect(Collectors.toList());
            List<Event> payload = events.stream()
                .filter(e -> ThreatCategories.isPayload(e.getThreatCategory().orElse(null)))
                .collect(Collectors.toList());
            if (phish.size() < minPhish || payload.size() < minPayload) {
                return;
            }
            Instant firstPhish = earliest(phish);
            Instant firstPayload = earliest(payload);
            if (!firstPayload.isAfter(firstPhish.plus(window))) {
                findings.add(toFinding(scope, key.get(0), key.get(1), phish, payload, firstPhish, firstPayload));
            }
        });
        return findings;
    }

    private static Instant earliest(List<Event> events) {
        return events.stream()
            .map(e -> e.getTimestamp().orElseThrow())
            .min(Instant::compareTo)
            .orElseThrow();
    }

    /**
     * 1 when the payload follows the phish immediately, 0 at the window edge
     */
    double tightness(Instant firstPhish, Instant firstPayload) {
        long deltaSeconds = Math.max(0, Duration.between(firstPhish, firstPayload).getSeconds());
        double t = 1.0 - (double) deltaSeconds / window.getSeconds();
        return Math.max(0.0, Math.min(1.0, t));
    }

    private Finding toFinding(DetectionScope scope, String user, String clientIp, List<Event> phish,
                              List<Event> payload, Instant firstPhish, Instant firstPayload) {
        double confidence = ConfidenceScore.of(Severity.HIGH)
            .entities(user, clientIp)
            .strength(0.14, phish.size(), minPhish, 8)
            .strength(0.16, payload.size(), minPayload, 10)
            .plus(0.10 * tightness(firstPhish, firstPayload))
            .value();

        List<Event> chain = new ArrayList<>(phish);
        chain.addAll(payload);
        Finding.Builder builder = newFinding(scope, Severity.HIGH, confidence,
                SecurityOutcome.PHISH_TO_PAYLOAD_CHAIN_SUSPECTED)
            .title("Phish to payload chain suspected")
            .summary(String.format("%s / %s shows blocked phishing activity followed by blocked %s traffic "
                    + "within %d minutes.", nullToDash(user), nullToDash(clientIp),
                String.join(", ", distinct(payload, Event::getThreatCategory)), window.toMinutes()))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.THREAT_CATEGORIES, distinct(chain, Event::getThreatCategory))
            .evidence("first_phish", firstPhish.toString())
            .evidence("first_payload", firstPayload.toString())
            .evidence("phish_hits", (long) phish.size())
            .evidence("payload_hits", (long) payload.size())
            .evidence(EvidenceKeys.COUNT, (long) chain.size())
            .evidence(EvidenceKeys.MITRE, MITRE)
            .evidence(EvidenceKeys.HOW_TO_VERIFY, String.format(
                "Filter action=Blocked, user_email=%s, client_ip=%s and order phishing and payload categories by time",
                nullToDash(user), nullToDash(clientIp)));
        return withEventContext(builder, chain).build();
    }
}
