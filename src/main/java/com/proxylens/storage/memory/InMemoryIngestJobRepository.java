package com.proxylens.storage.memory;

import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;
import com.proxylens.storage.IngestJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ingest job store kept in process memory.
 * Every mutation goes through {@link ConcurrentMap#compute}, so snapshots are swapped atomically.
 */
@Repository
@ConditionalOnProperty(name = "proxylens.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryIngestJobRepository implements IngestJobRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIngestJobRepository.class);

    private final ConcurrentMap<String, IngestJob> jobs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> jobsByUpload = new ConcurrentHashMap<>();

    @Override
    public IngestJob insert(IngestJob job) {
        if (jobs.putIfAbsent(job.getId(), job) != null) {
            throw new IllegalArgumentException("Job already exists: " + job.getId());
        }
        jobsByUpload.computeIfAbsent(job.getUploadId(), k -> new CopyOnWriteArrayList<>()).add(job.getId());
        log.debug("Stored job {} for upload {}", job.getId(), job.getUploadId());
        return job;
    }

    @Override
    public Optional<IngestJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public Optional<IngestJob> findLatestByUpload(String uploadId) {
        List<String> ids = jobsByUpload.get(uploadId);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        return findById(ids.get(ids.size() - 1));
    }

    @Override
    public boolean hasActiveJob(String uploadId) {
        List<String> ids = jobsByUpload.getOrDefault(uploadId, List.of());
        return ids.stream()
            .map(jobs::get)
            .anyMatch(job -> job != null && !job.isTerminal());
    }

    @Override
    public IngestJob transition(String jobId, IngestJobStatus next, String error) {
        IngestJob updated = jobs.computeIfPresent(jobId, (id, current) -> {
            if (!current.getStatus().canTransitionTo(next)) {
                throw new IllegalStateException(
                    "Job " + id + " cannot move from " + current.getStatus().getValue() + " to " + next.getValue());
            }
            return current.toBuilder()
                .status(next)
                .error(next == IngestJobStatus.FAILED ? error : null)
                .updatedAt(Instant.now())
                .build();
        });
        if (updated == null) {
            throw new NoSuchElementException("Unknown job: " + jobId);
        }
        return updated;
    }

    @Override
    public IngestJob addProgress(String jobId, long insertedEvents, long badLines) {
        IngestJob updated = jobs.computeIfPresent(jobId, (id, current) -> {
            if (current.getStatus() != IngestJobStatus.RUNNING) {
                throw new IllegalStateException("Job " + id + " is not running: " + current.getStatus().getValue());
            }
            return current.toBuilder()
                .insertedEvents(current.getInsertedEvents() + insertedEvents)
                .badLines(current.getBadLines() + badLines)
                .updatedAt(Instant.now())
                .build();
        });
        if (updated == null) {
            throw new NoSuchElementException("Unknown job: " + jobId);
        }
        return updated;
    }
}
