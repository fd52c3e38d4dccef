package com.proxylens.rollup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.proxylens.domain.Event;
import com.proxylens.domain.UploadFeatures;
import com.proxylens.storage.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Statistical profile of an upload, cached per upload id.
 * The ingest worker invalidates the entry whenever the upload is re-ingested.
 */
@Service
public class UploadFeatureService {

    private static final Logger log = LoggerFactory.getLogger(UploadFeatureService.class);

    private final EventStore eventStore;
    private final int topN;
    private final Cache<String, UploadFeatures> cache;

    public UploadFeatureService(
            EventStore eventStore,
            @Value("${proxylens.features.top-n:20}") int topN,
            @Value("${proxylens.features.cache-ttl-minutes:30}") long cacheTtlMinutes) {
        this.eventStore = eventStore;
        this.topN = topN;
        // Small cache: one entry per recently analyzed upload
        this.cache = Caffeine.newBuilder()
            .maximumSize(256)
            .expireAfterWrite(Duration.ofMinutes(cacheTtlMinutes))
            .recordStats()
            .build();
    }

    /**
     * Features of an upload, computed on first access
     */
    public UploadFeatures features(String uploadId) {
        return cache.get(uploadId, id -> compute(id, eventStore.findByUpload(id)));
    }

    public void invalidate(String uploadId) {
        cache.invalidate(uploadId);
        log.debug("Invalidated cached features for upload {}", uploadId);
    }

    UploadFeatures compute(String uploadId, List<Event> events) {
        UploadFeatures features = new UploadFeatures();
        features.setUploadId(uploadId);
        features.setTotalEvents(events.size());

        Instant start = null;
        Instant end = null;
        long blocked = 0;
        long allowed = 0;
        long untimed = 0;
        long withServerIp = 0;
        long dns = 0;
        for (Event event : events) {
            Optional<Instant> ts = event.getTimestamp();
            if (ts.isPresent()) {
                Instant t = ts.get();
                start = start == null || t.isBefore(start) ? t : start;
                end = end == null || t.isAfter(end) ? t : end;
            } else {
                untimed++;
            }
            if (event.isBlocked()) {
                blocked++;
            } else if (event.getAction().map("Allowed"::equals).orElse(false)) {
                allowed++;
            }
            if (event.getServerIp().isPresent()) {
                withServerIp++;
            }
            if (isDns(event.getUrlCategory()) || isDns(event.getThreatCategory())) {
                dns++;
            }
        }
        features.setTimeStart(start);
        features.setTimeEnd(end);
        features.setBlocked(blocked);
        features.setAllowed(allowed);
        features.setUntimedEvents(untimed);
        features.setEventsWithServerIp(withServerIp);
        features.setDnsEvents(dns);

        features.setTopUsers(top(events, e -> e.getUserEmail()));
        features.setTopClientIps(top(events, e -> e.getClientIp()));
        features.setTopDestHosts(top(events, e -> e.getDestHost()));
        features.setTopThreatCategories(top(events, e -> e.getThreatCategory()));
        return features;
    }

    private static boolean isDns(Optional<String> category) {
        return category.map(c -> c.toLowerCase(Locale.ROOT).contains("dns")).orElse(false);
    }

    /**
     * Most frequent values, ties broken alphabetically
     */
    private Map<String, Long> top(List<Event> events, Function<Event, Optional<String>> field) {
        Map<String, Long> counts = new HashMap<>();
        for (Event event : events) {
            field.apply(event).ifPresent(value -> counts.merge(value, 1L, Long::sum));
        }
        Map<String, Long> top = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(topN)
            .forEach(entry -> top.put(entry.getKey(), entry.getValue()));
        return top;
    }
}
