package com.proxylens.detection.rules;

import com.proxylens.detection.DetectionRule;
import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Shared plumbing for rules: finding construction and event-derived evidence.
 */
public abstract class AbstractDetectionRule implements DetectionRule {

    /**
     * Maximum number of event ids kept as evidence per finding
     */
    public static final int MAX_SAMPLE_EVENTS = 25;

    static final int MAX_SAMPLE_URLS = 10;

    private final String patternName;

    protected AbstractDetectionRule(String patternName) {
        this.patternName = patternName;
    }

    @Override
    public String getPatternName() {
        return patternName;
    }

    protected Finding.Builder newFinding(DetectionScope scope, Severity severity, double confidence,
                                         SecurityOutcome outcome) {
        return Finding.builder()
            .uploadId(scope.getUploadId())
            .patternName(patternName)
            .severity(severity)
            .confidence(confidence)
            .evidence(EvidenceKeys.SECURITY_OUTCOME, outcome.getValue());
    }

    /**
     * Adds sampled event ids, first/last seen and sampled URLs of the supporting events
     */
    protected static Finding.Builder withEventContext(Finding.Builder builder, List<Event> events) {
        List<String> ids = new ArrayList<>();
        Set<String> urls = new LinkedHashSet<>();
        Instant first = null;
        Instant last = null;
        for (Event event : events) {
            if (ids.size() < MAX_SAMPLE_EVENTS) {
                ids.add(event.getId());
            }
            if (urls.size() < MAX_SAMPLE_URLS) {
                event.getUrl().ifPresent(urls::add);
            }
            Optional<Instant> ts = event.getTimestamp();
            if (ts.isPresent()) {
                Instant t = ts.get();
                first = first == null || t.isBefore(first) ? t : first;
                last = last == null || t.isAfter(last) ? t : last;
            }
        }
        builder.evidence(EvidenceKeys.EVENT_IDS, ids);
        if (!urls.isEmpty()) {
            builder.evidence(EvidenceKeys.URLS, new ArrayList<>(urls));
        }
        if (first != null) {
            builder.evidence(EvidenceKeys.FIRST_SEEN, first.toString());
            builder.evidence(EvidenceKeys.LAST_SEEN, last.toString());
        }
        return builder;
    }

    /**
     * The value shared by all events, or null when absent or ambiguous
     */
    protected static String single(Collection<Event> events, Function<Event, Optional<String>> field) {
        String found = null;
        for (Event event : events) {
            Optional<String> value = field.apply(event);
            if (value.isEmpty()) {
                continue;
            }
            if (found == null) {
                found = value.get();
            } else if (!found.equals(value.get())) {
                return null;
            }
        }
        return found;
    }

    /**
     * Sorted distinct values of a field
     */
    protected static List<String> distinct(Collection<Event> events, Function<Event, Optional<String>> field) {
        Set<String> values = new TreeSet<>();
        for (Event event : events) {
            field.apply(event).ifPresent(values::add);
        }
        return new ArrayList<>(values);
    }

    /**
     * Groups events by a composite key in first-seen order. Absent key parts are null.
     */
    @SafeVarargs
    protected static Map<List<String>, List<Event>> groupBy(Collection<Event> events,
                                                            Function<Event, Optional<String>>... parts) {
        Map<List<String>, List<Event>> groups = new LinkedHashMap<>();
        for (Event event : events) {
            String[] key = new String[parts.length];
            for (int i = 0; i < parts.length; i++) {
                key[i] = parts[i].apply(event).orElse(null);
            }
            groups.computeIfAbsent(Arrays.asList(key), k -> new ArrayList<>()).add(event);
        }
        return groups;
    }

    protected static String nullToDash(String value) {
        return value == null ? "-" : value;
    }
}
