package com.proxylens.storage;

import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;

import java.util.Optional;

/**
 * Record store for ingest jobs.
 *
 * Status changes and counter updates are single atomic operations against the
 * stored record, never read-modify-write from a caller's snapshot.
 */
public interface IngestJobRepository {

    /**
     * Store a newly created job
     */
    IngestJob insert(IngestJob job);

    Optional<IngestJob> findById(String jobId);

    /**
     * Most recently created job of an upload
     */
    Optional<IngestJob> findLatestByUpload(String uploadId);

    /**
     * Whether the upload has a queued or running job
     */
    boolean hasActiveJob(String uploadId);

    /**
     * Atomically move a job to {@code next}.
     *
     * @param error failure description, only kept for {@link IngestJobStatus#FAILED}
     * @return the updated job
     * @throws IllegalStateException if the stored status cannot move to {@code next}
     * @throws java.util.NoSuchElementException if the job does not exist
     */
    IngestJob transition(String jobId, IngestJobStatus next, String error);

    /**
     * Atomically add to both counters of a running job
     *
     * @return the updated job
     * @throws IllegalStateException if the job is not running
     */
    IngestJob addProgress(String jobId, long insertedEvents, long badLines);
}
