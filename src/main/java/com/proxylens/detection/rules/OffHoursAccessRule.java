package com.proxylens.detection.rules;

import com.proxylens.detection.ConfidenceScore;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Flags users who mostly work inside normal hours but show a block of activity outside them.
 *
 * Only users with at least {@code minSample} timestamped events are considered, and
 * the share of their on-hours activity must reach {@code minOnHoursRatio}, so sparse
 * or always-on accounts do not trigger. The normal window is [startHour, endHour)
 * in the configured zone and may wrap midnight.
 */
public class OffHoursAccessRule extends AbstractDetectionRule {

    public static final String PATTERN = "OFF_HOURS_ACCESS";

    private final int startHour;
    private final int endHour;
    private final ZoneId zone;
    private final int minSample;
    private final int minOffHoursEvents;
    private final double minOnHoursRatio;

    public OffHoursAccessRule(int startHour, int endHour, ZoneId zone, int minSample,
                              int minOffHoursEvents, double minOnHoursRatio) {
        super(PATTERN);
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 24 || startHour == endHour) {
            throw new IllegalArgumentException("Invalid normal hours: " + startHour + "-" + endHour);
        }
        this.startHour = startHour;
        this.endHour = endHour;
        this.zone = zone;
        this.minSample = minSample;
        this.minOffHoursEvents = Math.max(1, minOffHoursEvents);
        this.minOnHoursRatio = minOnHoursRatio;
    }

    @Override
    public List<Finding> evaluate(DetectionScope scope) {
        Map<String, List<Event>> byUser = new TreeMap<>();
        for (Event event : scope.getTimedEvents()) {
            event.getUserEmail().ifPresent(user -> byUser.computeIfAbsent(user, k -> new ArrayList<>()).add(event));
        }

        List<Finding> findings = new ArrayList<>();
        byUser.forEach((user, events) -> {
            if (events.size() < minSample) {
                return;
            }
            List<Event> offHours = new ArrayList<>();
            for (Event event : events) {
                if (!isNormalHour(event.getTimestamp().orElseThrow())) {
                    offHours.add(event);
                }
            }
            double onHoursRatio = (events.size() - offHours.size()) / (double) events.size();
            if (offHours.size() >= minOffHoursEvents && onHoursRatio >= minOnHoursRatio) {
                findings.add(toFinding(scope, user, events.size(), offHours, onHoursRatio));
            }
        });
        return findings;
    }

    boolean isNormalHour(Instant ts) {
        int hour = ts.atZone(zone).getHour();
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }

    private Finding toFinding(DetectionScope scope, String user, int total, List<Event> offHours, double onHoursRatio) {
        Severity severity = offHours.size() >= 3 * minOffHoursEvents ? Severity.MEDIUM : Severity.LOW;
        String clientIp = single(offHours, Event::getClientIp);
        double confidence = ConfidenceScore.of(severity)
            .entities(user, clientIp)
            .strength(0.20, offHours.size(), minOffHoursEvents, 6)
            .value();
        String window = String.format("%02d:00-%02d:00 %s", startHour, endHour, zone.getId());

        Finding.Builder builder = newFinding(scope, severity, confidence, SecurityOutcome.POLICY_VIOLATION_SUSPECTED)
            .title("Off-hours activity by " + user)
            .summary(String.format("%s made %d of %d requests outside normal hours (%s).",
                user, offHours.size(), total, window))
            .evidence(EvidenceKeys.USER_EMAIL, user)
            .evidence(EvidenceKeys.CLIENT_IP, clientIp)
            .evidence(EvidenceKeys.COUNT, (long) offHours.size())
            .evidence(EvidenceKeys.THRESHOLD, (long) minOffHoursEvents)
            .evidence("total_events", (long) total)
            .evidence("on_hours_ratio", Math.round(onHoursRatio * 1000.0) / 1000.0)
            .evidence("normal_hours", window)
            .evidence("dest_hosts_sample", distinct(offHours, Event::getDestHost).stream()
                .limit(MAX_SAMPLE_URLS).collect(Collectors.toList()))
            .evidence(EvidenceKeys.HOW_TO_VERIFY,
                "Filter user_email=" + user + " and compare request hours against " + window);
        return withEventContext(builder, offHours).build();
    }
}
