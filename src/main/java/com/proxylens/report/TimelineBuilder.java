package com.proxylens.report;

import com.proxylens.domain.Event;
import com.proxylens.domain.Finding;
import com.proxylens.domain.TimelineItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the chronological report timeline, one item per finding with a time reference.
 */
@Component
public class TimelineBuilder {

    private static final Comparator<TimelineItem> CHRONOLOGICAL =
        Comparator.comparing(TimelineItem::getTsStart).thenComparing(TimelineItem::getTsEnd);

    public List<TimelineItem> build(List<Finding> findings, Map<String, Event> eventsById) {
        List<TimelineItem> items = new ArrayList<>();
        for (Finding finding : findings) {
            Optional<FindingSpan> span = FindingSpan.of(finding, eventsById);
            if (span.isEmpty()) {
                continue;
            }
            items.add(new TimelineItem(
                span.get().getStart(),
                span.get().getEnd(),
                label(finding),
                Collections.singletonList(finding.getId()),
                finding.getEventIds()));
        }
        items.sort(CHRONOLOGICAL);
        return items;
    }

    private static String label(Finding finding) {
        return "[" + finding.getSeverity().getValue() + "] " + finding.getTitle();
    }
}
