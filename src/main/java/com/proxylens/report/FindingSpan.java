package com.proxylens.report;

import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Time range covered by a finding.
 *
 * The widest range over the timestamps of its linked events and the {@code first_seen} and
 * {@code last_seen} evidence, or the {@code bucket} evidence when neither is present.
 */
final class FindingSpan {

    private final Instant start;
    private final Instant end;

    private FindingSpan(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    Instant getStart() {
        return start;
    }

    Instant getEnd() {
        return end;
    }

    static Optional<FindingSpan> of(Finding finding, Map<String, Event> eventsById) {
        Instant first = null;
        Instant last = null;
        for (String eventId : finding.getEventIds()) {
            Event event = eventsById.get(eventId);
            if (event == null || event.getTimestamp().isEmpty()) {
                continue;
            }
            Instant ts = event.getTimestamp().get();
            first = earlier(first, ts);
            last = later(last, ts);
        }

        // event_ids is a sample; first_seen/last_seen cover every supporting event
        Optional<Instant> firstSeen = instant(finding, EvidenceKeys.FIRST_SEEN);
        Optional<Instant> lastSeen = instant(finding, EvidenceKeys.LAST_SEEN);
        if (firstSeen.isPresent()) {
            first = earlier(first, firstSeen.get());
            last = later(last, lastSeen.orElse(firstSeen.get()));
        } else if (lastSeen.isPresent() && first != null) {
            last = later(last, lastSeen.get());
        }
        if (first != null) {
            return Optional.of(new FindingSpan(first, last));
        }

        return instant(finding, EvidenceKeys.BUCKET).map(bucket -> new FindingSpan(bucket, bucket));
    }

    private static Instant earlier(Instant current, Instant candidate) {
        return current == null || candidate.isBefore(current) ? candidate : current;
    }

    private static Instant later(Instant current, Instant candidate) {
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    private static Optional<Instant> instant(Finding finding, String key) {
        Optional<String> text = finding.evidenceString(key);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(text.get()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
