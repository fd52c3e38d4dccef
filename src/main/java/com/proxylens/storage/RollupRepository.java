package com.proxylens.storage;

import com.proxylens.domain.RollupBucket;

import java.util.Collection;
import java.util.List;

/**
 * Store of per-minute rollup buckets.
 */
public interface RollupRepository {

    /**
     * Upsert every bucket by composite key and drop keys of the upload not present
     * in {@code buckets}, in one transaction
     */
    void replaceAll(String uploadId, Collection<RollupBucket> buckets);

    /**
     * Buckets of an upload ordered by key
     */
    List<RollupBucket> findByUpload(String uploadId);

    long deleteByUpload(String uploadId);
}
