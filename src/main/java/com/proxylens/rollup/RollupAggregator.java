package com.proxylens.rollup;

import com.proxylens.domain.Event;
import com.proxylens.domain.RollupBucket;
import com.proxylens.domain.RollupKey;
import com.proxylens.storage.EventStore;
import com.proxylens.storage.RollupRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds per-minute rollups for an upload.
 *
 * Events are grouped by minute bucket and the (user, client IP, destination host,
 * action, threat category) tuple. The result replaces the upload's stored
 * rollups, so recomputing over unchanged events yields identical totals.
 */
@Service
public class RollupAggregator {

    private static final Logger log = LoggerFactory.getLogger(RollupAggregator.class);

    private final EventStore eventStore;
    private final RollupRepository rollupRepository;
    private final Timer recomputeTimer;

    public RollupAggregator(EventStore eventStore, RollupRepository rollupRepository, MeterRegistry meterRegistry) {
        this.eventStore = eventStore;
        this.rollupRepository = rollupRepository;
        this.recomputeTimer = Timer.builder("proxylens.rollup.recompute")
            .description("Time to rebuild the rollups of one upload")
            .register(meterRegistry);
    }

    /**
     * Rebuild and store the rollups of an upload
     *
     * @return the stored buckets, ordered by key
     */
    public List<RollupBucket> recompute(String uploadId) {
        return recomputeTimer.record(() -> {
            List<RollupBucket> buckets = aggregate(eventStore.findByUpload(uploadId));
            rollupRepository.replaceAll(uploadId, buckets);
            log.info("Recomputed {} rollup buckets for upload {}", buckets.size(), uploadId);
            return buckets;
        });
    }

    /**
     * Group events into buckets without touching storage
     */
    public static List<RollupBucket> aggregate(Collection<Event> events) {
        Map<RollupKey, Long> totals = new TreeMap<>();
        for (Event event : events) {
            totals.merge(RollupKey.of(event), 1L, Long::sum);
        }
        List<RollupBucket> buckets = new ArrayList<>(totals.size());
        totals.forEach((key, total) -> buckets.add(new RollupBucket(key, total)));
        return buckets;
    }
}
