package com.proxylens.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.MoreExecutors;
import com.proxylens.common.OperationRejectedException;
import com.proxylens.domain.IngestJobStatus;
import com.proxylens.normalization.DialectDetector;
import com.proxylens.normalization.EventNormalizer;
import com.proxylens.normalization.FieldExtractor;
import com.proxylens.normalization.parsers.ParserRegistry;
import com.proxylens.rollup.RollupAggregator;
import com.proxylens.rollup.UploadFeatureService;
import com.proxylens.storage.memory.InMemoryEventStore;
import com.proxylens.storage.memory.InMemoryIngestJobRepository;
import com.proxylens.storage.memory.InMemoryRollupRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * End-to-end tests of job submission and the ingest worker, wired with in-memory stores.
 */
@DisplayName("IngestJobController Tests")
class IngestJobControllerTest {

    @TempDir
    Path uploadsDir;

    private SimpleMeterRegistry meterRegistry;
    private InMemoryIngestJobRepository jobRepository;
    private InMemoryEventStore eventStore;
    private InMemoryRollupRepository rollupRepository;
    private IngestJobRunner runner;
    private IngestMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        jobRepository = new InMemoryIngestJobRepository();
        eventStore = new InMemoryEventStore();
        rollupRepository = new InMemoryRollupRepository();
        metrics = new IngestMetrics(meterRegistry);

        ParserRegistry parserRegistry = new ParserRegistry(new ObjectMapper());
        parserRegistry.registerParsers();
        EventNormalizer normalizer =
            new EventNormalizer(new DialectDetector(), parserRegistry, new FieldExtractor(), meterRegistry);

        runner = new IngestJobRunner(
            normalizer,
            eventStore,
            rollupRepository,
            new RollupAggregator(eventStore, rollupRepository, meterRegistry),
            new UploadFeatureService(eventStore, 20, 30),
            jobRepository,
            metrics,
            10);
    }

    private IngestJobController controller(ExecutorService executor) {
        return new IngestJobController(jobRepository, runner, new FileSystemUploadBlobStore(uploadsDir.toString()),
            executor, metrics);
    }

    private static String upload(int validLines, int corruptLines) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < validLines; i++) {
            sb.append(String.format("ts=2024-05-01T10:%02d:00Z user=user%d@corp.com src=10.0.0.%d action=allowed "
                + "host=site%d.example.com%n", i % 60, i % 7, i % 5, i % 11));
            if (i < corruptLines) {
                sb.append("%%% not a log line %%%\n");
            }
        }
        return sb.toString();
    }

    @Test
    @DisplayName("Should ingest valid lines and count corrupt ones as bad lines")
    void shouldCountBadLines() {
        // Given
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());
        byte[] bytes = upload(95, 5).getBytes(StandardCharsets.UTF_8);

        // When
        String jobId = controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));

        // Then
        IngestStatus status = controller.getStatus(jobId);
        assertThat(status.getStatus()).isEqualTo(IngestJobStatus.DONE);
        assertThat(status.getInsertedEvents()).isEqualTo(95);
        assertThat(status.getBadLines()).isEqualTo(5);
        assertThat(eventStore.countByUpload("upload-1")).isEqualTo(95);
        assertThat(rollupRepository.findByUpload("upload-1")).isNotEmpty();
    }

    @Test
    @DisplayName("Should skip blank lines without counting them")
    void shouldSkipBlankLines() {
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());
        byte[] bytes = ("\n   \n" + upload(3, 0) + "\n\n").getBytes(StandardCharsets.UTF_8);

        String jobId = controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));

        IngestStatus status = controller.getStatus(jobId);
        assertThat(status.getInsertedEvents()).isEqualTo(3);
        assertThat(status.getBadLines()).isZero();
    }

    @Test
    @DisplayName("Should read uploads from the blob store")
    void shouldReadFromBlobStore() throws IOException {
        Files.write(uploadsDir.resolve("upload-7"), upload(12, 0).getBytes(StandardCharsets.UTF_8));
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());

        String jobId = controller.submit("upload-7");

        assertThat(controller.getStatus(jobId).getInsertedEvents()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should replace previous events when an upload is ingested again")
    void shouldPurgeOnReingest() {
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());
        byte[] bytes = upload(20, 0).getBytes(StandardCharsets.UTF_8);

        controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));
        controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));

        assertThat(eventStore.countByUpload("upload-1")).isEqualTo(20);
    }

    @Test
    @DisplayName("Should reject a second submission while a job is queued")
    void shouldRejectConcurrentSubmission() {
        // Given: an executor that never runs the job
        ExecutorService parked = mock(ExecutorService.class);
        IngestJobController controller = controller(parked);
        String first = controller.submit("upload-1", () -> new ByteArrayInputStream(new byte[0]));

        // When / Then
        assertThatThrownBy(() -> controller.submit("upload-1", () -> new ByteArrayInputStream(new byte[0])))
            .isInstanceOf(OperationRejectedException.class)
            .extracting("reason")
            .isEqualTo(OperationRejectedException.Reason.INGEST_IN_PROGRESS);
        assertThat(controller.getStatus(first).getStatus()).isEqualTo(IngestJobStatus.QUEUED);
    }

    @Test
    @DisplayName("Should accept a resubmission once the previous job is stored as done")
    void shouldAcceptResubmissionAfterTerminalStatus() {
        // Given: the worker has stored DONE but has not released its claim yet
        List<Runnable> pending = new ArrayList<>();
        ExecutorService deferred = mock(ExecutorService.class);
        doAnswer(invocation -> pending.add(invocation.getArgument(0))).when(deferred).execute(any(Runnable.class));
        IngestJobController controller = controller(deferred);
        byte[] bytes = upload(4, 0).getBytes(StandardCharsets.UTF_8);

        String first = controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));
        runner.run(first, "upload-1", () -> new ByteArrayInputStream(bytes));
        assertThat(controller.getStatus(first).getStatus()).isEqualTo(IngestJobStatus.DONE);

        // When
        String second = controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));

        // Then
        assertThat(second).isNotEqualTo(first);
        assertThat(controller.getStatus(second).getStatus()).isEqualTo(IngestJobStatus.QUEUED);
        assertThat(pending).hasSize(2);
    }

    @Test
    @DisplayName("Should ingest a first line that starts with a byte order mark")
    void shouldStripByteOrderMark() {
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());
        byte[] bytes = ("\uFEFF{\"user\":\"alice@corp.com\",\"client_ip\":\"10.0.0.5\",\"action\":\"allowed\"}\n"
            + upload(2, 0)).getBytes(StandardCharsets.UTF_8);

        String jobId = controller.submit("upload-1", () -> new ByteArrayInputStream(bytes));

        IngestStatus status = controller.getStatus(jobId);
        assertThat(status.getInsertedEvents()).isEqualTo(3);
        assertThat(status.getBadLines()).isZero();
    }

    @Test
    @DisplayName("Should fail the job when the stream cannot be opened")
    void shouldFailOnUnreadableStream() {
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());

        String jobId = controller.submit("upload-1", () -> {
            throw new IOException("disk gone");
        });

        IngestStatus status = controller.getStatus(jobId);
        assertThat(status.getStatus()).isEqualTo(IngestJobStatus.FAILED);
        assertThat(status.getError()).contains("Unreadable upload stream").contains("disk gone");
    }

    @Test
    @DisplayName("Should fail the job when the ingest queue is full")
    void shouldFailWhenQueueFull() {
        ExecutorService full = mock(ExecutorService.class);
        doThrow(new RejectedExecutionException("full")).when(full).execute(any(Runnable.class));
        IngestJobController controller = controller(full);

        String jobId = controller.submit("upload-1", () -> new ByteArrayInputStream(new byte[0]));

        IngestStatus status = controller.getStatus(jobId);
        assertThat(status.getStatus()).isEqualTo(IngestJobStatus.FAILED);
        assertThat(status.getError()).contains("queue is full");
    }

    @Test
    @DisplayName("Should reject status lookups of unknown jobs")
    void shouldRejectUnknownJob() {
        IngestJobController controller = controller(MoreExecutors.newDirectExecutorService());

        assertThatThrownBy(() -> controller.getStatus("missing"))
            .isInstanceOf(OperationRejectedException.class)
            .extracting("reason")
            .isEqualTo(OperationRejectedException.Reason.JOB_NOT_FOUND);
    }
}
