package com.proxylens.detection.rules;

import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.RollupBucket;
import com.proxylens.domain.RollupKey;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Flags a client IP whose request count within one minute exceeds the threshold.
 * Counts come from the rollups; severity is critical at twice the threshold.
 */
public class BurstFromSingleIpRule extends AbstractDetectionRule {

    public static final String PATTERN = "BURST_FROM_SINGLE_IP";

    private final long threshold;

    public BurstFromSingleIpRule(long threshold) {
        super(PATTERN);
        if (threshold <= 0) {
            throw new IllegalArgumentException("Burst threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        // minute -> client ip -> total
        Map<Instant, Map<String, Long>> totals = new TreeMap<>();
        for (RollupBucket bucket : scope.getRollups()) {
            RollupKey key = bucket.getKey();
            if (RollupKey.isUnset(key.getClientIp()) || !key.hasBucket()) {
                continue;
            }
            totals.computeIfAbsent(key.getBucket(), k -> new TreeMap<>())
                .merge(key.getClientIp(), bucket.getTotal(), Long::sum);
        }

        List<Finding> findings = new ArrayList<>();
        totals.forEach((minute, perIp) -> perIp.forEach((clientIp, count) -> {
            if (count > threshold) {
                findings.add(toFinding(scope, minute, clientIp, count));
            }
        }));
        return findings;
    }

    private Finding toFinding(DetectionScope scope, Instant minute, String clientIp, long count) {
        List<Event> events = scope.getEvents().stream()
            .filter(e -> e.getClientIp().map(clientIp::equals).orElse(false))
            .filter(e -> e.getTimestamp().map(ts -> ts.truncatedTo(ChronoUnit.MINUTES).equals(minute)).orElse(false))
            .collect(Collectors.toList());

        Severity severity = count >= 2 * threshold ? Severity.CRITICAL : Severity.HIGH;
        String user = single(events, Event::getUserEmail);
        double confidence = ConfidenceScore.of(severity)
            .entities(clientIp, user)
            .strength(0.30, count, threshold, 5)
            .value();

        Finding.Builder builder = newFinding(scope, severity, confidence, SecurityOutcome.RECONNAISSANCE_SUSPECTED)
            .title("Request burst from " + clientIp)
            .summary(String.format("%d requests from %s within the minute starting %s (threshold %d).",
                count, clientIp, minute, threshold))
            .evidence(EvidenceKeys.BUCKET, minute.toString())
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.COUNT, count)
            .evidence(EvidenceKeys.THRESHOLD, threshold)
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.HOW_TO_VERIFY,
                "Filter client_ip=" + clientIp + " between " + minute + " and " + minute.plus(1, ChronoUnit.MINUTES));
        return withEventContext(builder, events).build();
    }
}
