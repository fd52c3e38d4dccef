package com.proxylens.detection.rules;

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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Flags a user contacting more distinct destination hosts within a sliding window
 * than the threshold allows, a sign of scanning or exfiltration staging.
 * The densest window per user is reported.
 */
public class SingleUserManyDestinationsRule extends AbstractDetectionRule {

    public static final String PATTERN = "SINGLE_USER_MANY_DESTINATIONS";

    private static final Comparator<Event> BY_TIME =
        Comparator.comparing((Event e) -> e.getTimestamp().orElseThrow());

    private final Duration window;
    private final int threshold;

    public SingleUserManyDestinationsRule(Duration window, int threshold) {
        super(PATTERN);
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        Map<String, List<Event>> byUser = new TreeMap<>();
        for (Event event : scope.getTimedEvents()) {
            if (event.getUserEmail().isPresent() && event.getDestHost().isPresent()) {
                byUser.computeIfAbsent(event.getUserEmail().get(), k -> new ArrayList<>()).add(event);
            }
        }

        List<Finding> findings = new ArrayList<>();
        byUser.forEach((user, events) -> {
            events.sort(BY_TIME);
            DensestWindow densest = densestWindow(events);
            if (densest.distinctHosts > threshold) {
                findings.add(toFinding(scope, user, events.subList(densest.from, densest.to), densest.distinctHosts));
            }
        });
        return findings;
    }

    /**
     * Two-pointer scan over time-sorted events, tracking distinct hosts inside the window
     */
    DensestWindow densestWindow(List<Event> sorted) {
        Map<String, Integer> hostCounts = new HashMap<>();
        DensestWindow best = new DensestWindow(0, 0, 0);
        int left = 0;
        for (int right = 0; right < sorted.size(); right++) {
            Instant rightTs = sorted.get(right).getTimestamp().orElseThrow();
            hostCounts.merge(sorted.get(right).getDestHost().orElseThrow(), 1, Integer::sum);

            while (Duration.between(sorted.get(left).getTimestamp().orElseThrow(), rightTs).compareTo(window) > 0) {
                String host = sorted.get(left).getDestHost().orElseThrow();
                if (hostCounts.merge(host, -1, Integer::sum) == 0) {
                    hostCounts.remove(host);
                }
                left++;
            }

            if (hostCounts.size() > best.distinctHosts) {
                best = new DensestWindow(left, right + 1, hostCounts.size());
            }
        }
        return best;
    }

    private Finding toFinding(DetectionScope scope, String user, List<Event> windowEvents, int distinctHosts) {
        Severity severity = distinctHosts >= 2 * threshold ? Severity.HIGH : Severity.MEDIUM;
        String clientIp = single(windowEvents, Event::getClientIp);
        double confidence = ConfidenceScore.of(severity)
            .entities(user, clientIp)
            .strength(0.25, distinctHosts, threshold, 4)
            .value();
        Instant start = windowEvents.get(0).getTimestamp().orElseThrow();
        Instant end = windowEvents.get(windowEvents.size() - 1).getTimestamp().orElseThrow();

        Finding.Builder builder = newFinding(scope, severity, confidence, SecurityOutcome.RECONNAISSANCE_SUSPECTED)
            .title(user + " contacted " + distinctHosts + " destinations in " + window.toMinutes() + " minutes")
            .summary(String.format("%s reached %d distinct hosts between %s and %s (threshold %d per %d minutes).",
                user, distinctHosts, start, end, threshold, window.toMinutes()))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.COUNT, (long) distinctHosts)
            .evidence(EvidenceKeys.THRESHOLD, (long) threshold)
            .evidence("window_minutes", window.toMinutes())
            .evidence("window_start", start.toString())
            .evidence("window_end", end.toString())
            .evidence("dest_hosts_sample", distinct(windowEvents, Event::getDestHost).stream()
                .limit(MAX_SAMPLE_EVENTS).collect(Collectors.toList()))
            .evidence(EvidenceKeys.HOW_TO_VERIFY,
                "Filter user_email=" + user + " between " + start + " and " + end + " and count distinct dest_host");
        return withEventContext(builder, windowEvents).build();
    }

    static final class DensestWindow {
        final int from;
        final int to;
        final int distinctHosts;

        DensestWindow(int from, int to, int distinctHosts) {
            this.from = from;
            this.to = to;
            this.distinctHosts = distinctHosts;
        }
    }
}
