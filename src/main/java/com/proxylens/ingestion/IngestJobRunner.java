package com.proxylens.ingestion;

import com.proxylens.domain.Event;
import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;
import com.proxylens.normalization.EventNormalizer;
import com.proxylens.normalization.parsers.ParseException;
import com.proxylens.rollup.RollupAggregator;
import com.proxylens.rollup.UploadFeatureService;
import com.proxylens.storage.EventStore;
import com.proxylens.storage.IngestJobRepository;
import com.proxylens.storage.RollupRepository;
import com.proxylens.storage.StorageException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker body of an ingest job.
 *
 * Steps:
 * 1. Mark the job running and purge events and rollups left by earlier ingests of the upload
 * 2. Stream the upload line by line through the normalizer, skipping blank lines
 * 3. Append events in batches; after each batch add both counters in one atomic update
 * 4. Rebuild rollups, then mark the job done
 *
 * A bad line only increments bad_lines. An unreadable stream, a storage failure or
 * resource exhaustion marks the job failed with a readable error.
 */
@Component
public class IngestJobRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestJobRunner.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final EventNormalizer normalizer;
    private final EventStore eventStore;
    private final RollupRepository rollupRepository;
    private final RollupAggregator rollupAggregator;
    private final UploadFeatureService featureService;
    private final IngestJobRepository jobRepository;
    private final IngestMetrics metrics;
    private final int batchSize;

    public IngestJobRunner(
            EventNormalizer normalizer,
            EventStore eventStore,
            RollupRepository rollupRepository,
            RollupAggregator rollupAggregator,
            UploadFeatureService featureService,
            IngestJobRepository jobRepository,
            IngestMetrics metrics,
            @Value("${proxylens.ingest.batch-size:1000}") int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.normalizer = normalizer;
        this.eventStore = eventStore;
        this.rollupRepository = rollupRepository;
        this.rollupAggregator = rollupAggregator;
        this.featureService = featureService;
        this.jobRepository = jobRepository;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Run a queued job to a terminal status
     *
     * @return the terminal job snapshot
     */
    public IngestJob run(String jobId, String uploadId, UploadSource source) {
        Timer.Sample sample = metrics.startTimer();
        try {
            jobRepository.transition(jobId, IngestJobStatus.RUNNING, null);
            log.info("Ingest job {} started for upload {}", jobId, uploadId);

            purge(jobId, uploadId);
            ingest(jobId, uploadId, source);

            try {
                rollupAggregator.recompute(uploadId);
            } catch (StorageException e) {
                throw new IngestFatalException("Rollup recomputation failed", jobId, e);
            }
            featureService.invalidate(uploadId);

            IngestJob done = jobRepository.transition(jobId, IngestJobStatus.DONE, null);
            metrics.recordDone();
            log.info("Ingest job {} done: inserted_events={}, bad_lines={}",
                jobId, done.getInsertedEvents(), done.getBadLines());
            return done;

        } catch (IngestFatalException e) {
            return fail(jobId, e.describe(), e);
        } catch (OutOfMemoryError e) {
            return fail(jobId, "Resource exhaustion: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            return fail(jobId, new IngestFatalException("Ingest aborted", jobId, e).describe(), e);
        } finally {
            metrics.recordDuration(sample);
        }
    }

    private void purge(String jobId, String uploadId) {
        try {
            long events = eventStore.deleteByUpload(uploadId);
            long buckets = rollupRepository.deleteByUpload(uploadId);
            featureService.invalidate(uploadId);
            if (events > 0 || buckets > 0) {
                log.info("Re-ingest of upload {}: removed {} events and {} rollup buckets", uploadId, events, buckets);
            }
        } catch (StorageException e) {
            throw new IngestFatalException("Could not clear previous ingest", jobId, e);
        }
    }

    private void ingest(String jobId, String uploadId, UploadSource source) {
        InputStream in;
        try {
            in = source.open();
        } catch (IOException e) {
            throw new IngestFatalException("Unreadable upload stream", jobId, e);
        }

        List<Event> batch = new ArrayList<>(batchSize);
        long pendingBad = 0;

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            boolean firstLine = true;
            while ((line = reader.readLine()) != null) {
                if (firstLine) {
                    line = stripByteOrderMark(line);
                    firstLine = false;
                }
                if (line.isBlank()) {
                    continue;
                }

                try {
                    batch.add(normalizer.normalize(uploadId, line));
                } catch (ParseException e) {
                    pendingBad++;
                } catch (RuntimeException e) {
                    log.warn("Unexpected normalizer error in job {}, counting line as bad: {}", jobId, e.toString());
                    pendingBad++;
                }

                if (batch.size() + pendingBad >= batchSize) {
                    flush(jobId, batch, pendingBad);
                    batch = new ArrayList<>(batchSize);
                    pendingBad = 0;
                }
            }
        } catch (IOException e) {
            throw new IngestFatalException("Unreadable upload stream", jobId, e);
        }

        if (!batch.isEmpty() || pendingBad > 0) {
            flush(jobId, batch, pendingBad);
        }
    }

    private static String stripByteOrderMark(String line) {
        return !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK ? line.substring(1) : line;
    }

    private void flush(String jobId, List<Event> batch, long bad) {
        try {
            eventStore.appendAll(batch);
        } catch (StorageException e) {
            throw new IngestFatalException("Event store write failed", jobId, e);
        }
        IngestJob progress = jobRepository.addProgress(jobId, batch.size(), bad);
        metrics.recordBatch(batch.size(), bad);
        log.debug("Ingest job {} progress: inserted_events={}, bad_lines={}",
            jobId, progress.getInsertedEvents(), progress.getBadLines());
    }

    private IngestJob fail(String jobId, String message, Throwable cause) {
        log.error("Ingest job {} failed: {}", jobId, message, cause);
        metrics.recordFailed();
        try {
            return jobRepository.transition(jobId, IngestJobStatus.FAILED, message);
        } catch (RuntimeException e) {
            e.addSuppressed(cause);
            log.error("Could not mark ingest job {} as failed", jobId, e);
            throw e;
        }
    }
}
