package com.proxylens.storage.memory;

import com.proxylens.domain.RollupBucket;
import com.proxylens.storage.RollupRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Rollup store kept in process memory. A recompute replaces the upload's snapshot in one put.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRollupRepository implements RollupRepository {

    private final ConcurrentMap<String, List<RollupBucket>> bucketsByUpload = new ConcurrentHashMap<>();

    @Override
    public void replaceAll(String uploadId, Collection<RollupBucket> buckets) {
        List<RollupBucket> snapshot = new ArrayList<>(buckets);
        snapshot.sort(Comparator.comparing(RollupBucket::getKey));
        bucketsByUpload.put(uploadId, List.copyOf(snapshot));
    }

    @Override
    public List<RollupBucket> findByUpload(String uploadId) {
        return bucketsByUpload.getOrDefault(uploadId, List.of());
    }

    @Override
    public long deleteByUpload(String uploadId) {
        List<RollupBucket> removed = bucketsByUpload.remove(uploadId);
        return removed == null ? 0 : removed.size();
    }
}
