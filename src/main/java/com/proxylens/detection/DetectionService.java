package com.proxylens.detection;

import com.proxylens.common.OperationRejectedException;
import com.proxylens.domain.Finding;
import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;
import com.proxylens.storage.EventStore;
import com.proxylens.storage.FindingRepository;
import com.proxylens.storage.IngestJobRepository;
import com.proxylens.storage.RollupRepository;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * On-demand detection for uploads whose ingest finished.
 *
 * Runs are append-only: findings of earlier runs are kept and a new run adds its
 * own, without deduplication.
 */
@Service
public class DetectionService {

    private static final Logger log = LoggerFactory.getLogger(DetectionService.class);

    private final IngestJobRepository jobRepository;
    private final EventStore eventStore;
    private final RollupRepository rollupRepository;
    private final FindingRepository findingRepository;
    private final DetectionEngine engine;
    private final ExecutorService detectionExecutor;
    private final DetectionMetrics metrics;

    public DetectionService(
            IngestJobRepository jobRepository,
            EventStore eventStore,
            RollupRepository rollupRepository,
            FindingRepository findingRepository,
            DetectionEngine engine,
            @Qualifier("detectionExecutor") ExecutorService detectionExecutor,
            DetectionMetrics metrics) {
        this.jobRepository = jobRepository;
        this.eventStore = eventStore;
        this.rollupRepository = rollupRepository;
        this.findingRepository = findingRepository;
        this.engine = engine;
        this.detectionExecutor = detectionExecutor;
        this.metrics = metrics;
    }

    /**
     * Start detection for an upload
     *
     * @return handle of the accepted run
     * @throws OperationRejectedException if the upload's latest ingest job is not done
     */
    public DetectionRun runDetection(String uploadId) {
        Optional<IngestJob> latest = jobRepository.findLatestByUpload(uploadId);
        if (latest.isEmpty() || latest.get().getStatus() != IngestJobStatus.DONE) {
            metrics.recordRejected();
            String state = latest.map(job -> job.getStatus().getValue()).orElse("none");
            log.info("Rejected detection for upload {}: latest ingest job is {}", uploadId, state);
            throw new OperationRejectedException(OperationRejectedException.Reason.INGEST_NOT_DONE, uploadId,
                "Detection requires a done ingest job, latest is " + state);
        }

        CompletableFuture<List<Finding>> completion;
        try {
            completion = CompletableFuture.supplyAsync(() -> detect(uploadId), detectionExecutor);
        } catch (RejectedExecutionException e) {
            metrics.recordRejected();
            log.warn("Detection executor rejected run for upload {}", uploadId);
            throw e;
        }

        metrics.recordAccepted();
        log.info("Accepted detection run for upload {}", uploadId);
        return new DetectionRun(uploadId, latest.get().getId(), completion);
    }

    /**
     * Findings of an upload, most severe first, then most confident; ties keep creation order
     */
    public List<Finding> listFindings(String uploadId) {
        List<Finding> findings = new ArrayList<>(findingRepository.findByUpload(uploadId));
        findings.sort(FindingOrder.PRESENTATION);
        return findings;
    }

    List<Finding> detect(String uploadId) {
        Timer.Sample sample = metrics.startTimer();
        try {
            DetectionScope scope = new DetectionScope(
                uploadId,
                eventStore.findByUpload(uploadId),
                rollupRepository.findByUpload(uploadId));

            List<Finding> findings = engine.evaluate(scope);
            findingRepository.appendAll(findings);
            return findings;
        } catch (RuntimeException e) {
            log.error("Detection run for upload {} failed", uploadId, e);
            throw e;
        } finally {
            metrics.recordDuration(sample);
        }
    }
}
