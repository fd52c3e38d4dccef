package com.proxylens.storage;

import com.proxylens.domain.Event;

import java.util.Collection;
import java.util.List;

/**
 * Append-only, per-upload collection of normalized events.
 */
public interface EventStore {

    /**
     * Append a batch; all events of one call are visible together or not at all
     */
    void appendAll(List<Event> events);

    /**
     * Events of an upload in insertion order
     */
    List<Event> findByUpload(String uploadId);

    /**
     * Events of an upload with the given ids, in insertion order. Unknown ids are ignored.
     */
    List<Event> findByIds(String uploadId, Collection<String> eventIds);

    long countByUpload(String uploadId);

    /**
     * Remove every event of an upload
     *
     * @return number of removed events
     */
    long deleteByUpload(String uploadId);
}
