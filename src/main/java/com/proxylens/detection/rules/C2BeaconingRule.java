package com.proxylens.detection.rules;

import com.google.common.collect.ImmutableList;
import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Flags repeated blocked command-and-control traffic from one endpoint to one host,
 * spread over several distinct minutes.
 */
public class C2BeaconingRule extends AbstractDetectionRule {

    public static final String PATTERN = "C2_BEACONING_SUSPECTED";

    private static final List<String> MITRE = ImmutableList.of("TA0011", "T1071");

    private final int minMinutes;
    private final int minHits;

    public C2BeaconingRule(int minMinutes, int minHits) {
        super(PATTERN);
        this.minMinutes = minMinutes;
        this.minHits = minHits;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        List<Event> candidates = scope.getBlockedEvents().stream()
            .filter(e -> e.getDestHost().isPresent())
            .filter(e -> ThreatCategories.isC2(e.getThreatCategory().orElse(null)))
            .collect(Collectors.toList());

        List<Finding> findings = new ArrayList<>();
        groupBy(candidates, Event::getUserEmail, Event::getClientIp, Event::getDestHost).forEach((key, events) -> {
            Set<Instant> minutes = new TreeSet<>();
            for (Event event : events) {
                event.getTimestamp().ifPresent(ts -> minutes.add(ts.truncatedTo(ChronoUnit.MINUTES)));
            }
            if (minutes.size() >= minMinutes && events.size() >= minHits) {
                findings.add(toFinding(scope, key.get(0), key.get(1), key.get(2), events, minutes.size()));
            }
        });
        return findings;
    }

    private Finding toFinding(DetectionScope scope, String user, String clientIp, String host, List<Event> events,
                              int distinctMinutes) {
        long hits = events.size();
        String category = single(events, Event::getThreatCategory);
        double confidence = ConfidenceScore.of(Severity.HIGH)
            .entities(user, clientIp, host)
            .strength(0.18, distinctMinutes, minMinutes, 5)
            .strength(0.18, hits, minHits, 8)
            .plus(category != null ? 0.04 : 0.0)
            .value();

        Finding.Builder builder = newFinding(scope, Severity.HIGH, confidence, SecurityOutcome.C2_BEACONING_SUSPECTED)
            .title("Possible C2 beaconing to " + host)
            .summary(String.format("%d blocked command-and-control requests from %s (%s) to %s across %d minutes.",
                hits, nullToDash(user), nullToDash(clientIp), host, distinctMinutes))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.DEST_HOST, host)
            .evidence(EvidenceKeys.THREAT_CATEGORY, category)
            .evidence(EvidenceKeys.COUNT, hits)
            .evidence(EvidenceKeys.THRESHOLD, (long) minHits)
            .evidence("distinct_minutes", (long) distinctMinutes)
            .evidence("min_minutes", (long) minMinutes)
            .evidence(EvidenceKeys.MITRE, MITRE)
            .evidence(EvidenceKeys.HOW_TO_VERIFY, String.format(
                "Filter action=Blocked, dest_host=%s, client_ip=%s and bucket by minute",
                host, nullToDash(clientIp)));
        return withEventContext(builder, events).build();
    }
}
