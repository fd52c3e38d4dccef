package com.proxylens.detection;

import com.proxylens.domain.Event;
import com.proxylens.domain.RollupBucket;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of one upload handed to detection rules.
 */
public final class DetectionScope {

    private final String uploadId;
    private final List<Event> events;
    private final List<RollupBucket> rollups;

    public DetectionScope(String uploadId, List<Event> events, List<RollupBucket> rollups) {
        this.uploadId = uploadId;
        this.events = List.copyOf(events);
        this.rollups = List.copyOf(rollups);
    }

    public String getUploadId() {
        return uploadId;
    }

    public List<Event> getEvents() {
        return events;
    }

    public List<RollupBucket> getRollups() {
        return rollups;
    }

    /**
     * Events carrying a timestamp, in stored order
     */
    public List<Event> getTimedEvents() {
        return events.stream()
            .filter(event -> event.getTimestamp().isPresent())
            .collect(Collectors.toList());
    }

    /**
     * Blocked events, in stored order
     */
    public List<Event> getBlockedEvents() {
        return events.stream()
            .filter(Event::isBlocked)
            .collect(Collectors.toList());
    }
}
