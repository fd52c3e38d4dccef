package com.proxylens.ingestion;

import com.proxylens.common.OperationRejectedException;
import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;
import com.proxylens.storage.IngestJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for batch ingestion of uploads.
 *
 * {@link #submit} creates a queued job, hands it to the ingest executor and
 * returns the job id without waiting for parsing. At most one queued or running
 * job may exist per upload; a second submission is rejected, not queued.
 */
@Service
public class IngestJobController {

    private static final Logger log = LoggerFactory.getLogger(IngestJobController.class);

    private final IngestJobRepository jobRepository;
    private final IngestJobRunner runner;
    private final UploadBlobStore blobStore;
    private final ExecutorService ingestExecutor;
    private final IngestMetrics metrics;

    /**
     * Uploads claimed by a job of this process, upload id to job id
     */
    private final ConcurrentMap<String, String> activeJobs = new ConcurrentHashMap<>();

    public IngestJobController(
            IngestJobRepository jobRepository,
            IngestJobRunner runner,
            UploadBlobStore blobStore,
            @Qualifier("ingestExecutor") ExecutorService ingestExecutor,
            IngestMetrics metrics) {
        this.jobRepository = jobRepository;
        this.runner = runner;
        this.blobStore = blobStore;
        this.ingestExecutor = ingestExecutor;
        this.metrics = metrics;
    }

    /**
     * Submit an upload whose bytes live in the blob store
     */
    public String submit(String uploadId) {
        return submit(uploadId, () -> blobStore.open(uploadId));
    }

    /**
     * Submit an upload for ingestion
     *
     * @param uploadId upload identity
     * @param source opened by the worker, not by the caller's thread
     * @return the new job id
     * @throws OperationRejectedException if the upload already has a non-terminal job
     */
    public String submit(String uploadId, UploadSource source) {
        if (uploadId == null || uploadId.isBlank()) {
            throw new IllegalArgumentException("Upload ID must not be null or empty");
        }
        if (source == null) {
            throw new IllegalArgumentException("Upload source must not be null");
        }

        String jobId = UUID.randomUUID().toString();
        String claimedBy = activeJobs.putIfAbsent(uploadId, jobId);
        if (claimedBy != null && !takeOverFinishedClaim(uploadId, claimedBy, jobId)) {
            reject(uploadId, claimedBy);
        }
        if (jobRepository.hasActiveJob(uploadId)) {
            activeJobs.remove(uploadId, jobId);
            reject(uploadId, null);
        }

        try {
            jobRepository.insert(IngestJob.builder()
                .id(jobId)
                .uploadId(uploadId)
                .status(IngestJobStatus.QUEUED)
                .build());
        } catch (RuntimeException e) {
            activeJobs.remove(uploadId, jobId);
            throw e;
        }

        try {
            ingestExecutor.execute(() -> {
                try {
                    runner.run(jobId, uploadId, source);
                } finally {
                    activeJobs.remove(uploadId, jobId);
                }
            });
        } catch (RejectedExecutionException e) {
            activeJobs.remove(uploadId, jobId);
            log.warn("Ingest executor rejected job {} for upload {}", jobId, uploadId);
            jobRepository.transition(jobId, IngestJobStatus.FAILED, "Ingest queue is full, resubmit later");
            metrics.recordFailed();
            return jobId;
        }

        metrics.recordSubmitted();
        log.info("Queued ingest job {} for upload {}", jobId, uploadId);
        return jobId;
    }

    /**
     * Current status of a job
     *
     * @throws OperationRejectedException if the job does not exist
     */
    public IngestStatus getStatus(String jobId) {
        return jobRepository.findById(jobId)
            .map(IngestStatus::from)
            .orElseThrow(() -> new OperationRejectedException(
                OperationRejectedException.Reason.JOB_NOT_FOUND, jobId, "Unknown ingest job"));
    }

    /**
     * The worker stores the terminal status before it releases its claim, so a claim
     * held by a finished job is stale and may be taken over.
     */
    private boolean takeOverFinishedClaim(String uploadId, String claimedBy, String jobId) {
        boolean finished = jobRepository.findById(claimedBy)
            .map(job -> job.getStatus().isTerminal())
            .orElse(false);
        return finished && activeJobs.replace(uploadId, claimedBy, jobId);
    }

    private void reject(String uploadId, String activeJobId) {
        metrics.recordRejected();
        log.info("Rejected ingest submission for upload {}: job {} still active",
            uploadId, activeJobId != null ? activeJobId : "(stored)");
        throw new OperationRejectedException(
            OperationRejectedException.Reason.INGEST_IN_PROGRESS, uploadId,
            "Upload already has a queued or running ingest job");
    }
}
