package com.proxylens.storage.memory;

import com.proxylens.domain.Event;
import com.proxylens.storage.EventStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Event store kept in process memory, one list per upload.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEventStore implements EventStore {

    private final ConcurrentMap<String, List<Event>> eventsByUpload = new ConcurrentHashMap<>();

    @Override
    public void appendAll(List<Event> events) {
        Map<String, List<Event>> byUpload = events.stream()
            .collect(Collectors.groupingBy(Event::getUploadId, LinkedHashMap::new, Collectors.toList()));
        byUpload.forEach((uploadId, batch) -> {
            List<Event> list = eventsByUpload.computeIfAbsent(uploadId, k -> new ArrayList<>());
            synchronized (list) {
                list.addAll(batch);
            }
        });
    }

    @Override
    public List<Event> findByUpload(String uploadId) {
        List<Event> list = eventsByUpload.get(uploadId);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return List.copyOf(list);
        }
    }

    @Override
    public List<Event> findByIds(String uploadId, Collection<String> eventIds) {
        Set<String> wanted = new HashSet<>(eventIds);
        return findByUpload(uploadId).stream()
            .filter(event -> wanted.contains(event.getId()))
            .collect(Collectors.toList());
    }

    @Override
    public long countByUpload(String uploadId) {
        List<Event> list = eventsByUpload.get(uploadId);
        if (list == null) {
            return 0;
        }
        synchronized (list) {
            return list.size();
        }
    }

    @Override
    public long deleteByUpload(String uploadId) {
        List<Event> removed = eventsByUpload.remove(uploadId);
        if (removed == null) {
            return 0;
        }
        synchronized (removed) {
            return removed.size();
        }
    }
}
