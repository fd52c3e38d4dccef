package com.proxylens.ingestion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for ingest jobs.
 *
 * Tracks:
 * - Submitted, rejected, completed and failed jobs
 * - Inserted events and bad lines
 * - End-to-end job duration
 */
@Component
public class IngestMetrics {

    private final MeterRegistry registry;
    private final Counter jobsSubmitted;
    private final Counter jobsRejected;
    private final Counter jobsDone;
    private final Counter jobsFailed;
    private final Counter insertedEvents;
    private final Counter badLines;
    private final Timer jobDuration;

    public IngestMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.jobsSubmitted = Counter.builder("proxylens.ingest.jobs")
            .description("Ingest jobs by outcome")
            .tag("outcome", "submitted")
            .register(registry);

        this.jobsRejected = Counter.builder("proxylens.ingest.jobs")
            .description("Ingest jobs by outcome")
            .tag("outcome", "rejected")
            .register(registry);

        this.jobsDone = Counter.builder("proxylens.ingest.jobs")
            .description("Ingest jobs by outcome")
            .tag("outcome", "done")
            .register(registry);

        this.jobsFailed = Counter.builder("proxylens.ingest.jobs")
            .description("Ingest jobs by outcome")
            .tag("outcome", "failed")
            .register(registry);

        this.insertedEvents = Counter.builder("proxylens.ingest.lines")
            .description("Processed lines by result")
            .tag("result", "inserted")
            .register(registry);

        this.badLines = Counter.builder("proxylens.ingest.lines")
            .description("Processed lines by result")
            .tag("result", "bad")
            .register(registry);

        this.jobDuration = Timer.builder("proxylens.ingest.duration")
            .description("Time from worker start to terminal status")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordSubmitted() {
        jobsSubmitted.increment();
    }

    public void recordRejected() {
        jobsRejected.increment();
    }

    public void recordDone() {
        jobsDone.increment();
    }

    public void recordFailed() {
        jobsFailed.increment();
    }

    public void recordBatch(long inserted, long bad) {
        insertedEvents.increment(inserted);
        badLines.increment(bad);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordDuration(Timer.Sample sample) {
        sample.stop(jobDuration);
    }
}
