package com.proxylens.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proxylens.domain.IngestJob;
import com.proxylens.domain.IngestJobStatus;

import java.time.Instant;

/**
 * Point-in-time view of an ingest job returned to status pollers.
 * Both counters come from the same stored snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestStatus {

    @JsonProperty("job_id")
    private final String jobId;

    @JsonProperty("upload_id")
    private final String uploadId;

    @JsonProperty("status")
    private final IngestJobStatus status;

    @JsonProperty("inserted_events")
    private final long insertedEvents;

    @JsonProperty("bad_lines")
    private final long badLines;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("updated_at")
    private final Instant updatedAt;

    private IngestStatus(IngestJob job) {
        this.jobId = job.getId();
        this.uploadId = job.getUploadId();
        this.status = job.getStatus();
        this.insertedEvents = job.getInsertedEvents();
        this.badLines = job.getBadLines();
        this.error = job.getError();
        this.createdAt = job.getCreatedAt();
        this.updatedAt = job.getUpdatedAt();
    }

    public static IngestStatus from(IngestJob job) {
        return new IngestStatus(job);
    }

    public String getJobId() {
        return jobId;
    }

    public String getUploadId() {
        return uploadId;
    }

    public IngestJobStatus getStatus() {
        return status;
    }

    public long getInsertedEvents() {
        return insertedEvents;
    }

    public long getBadLines() {
        return badLines;
    }

    public String getError() {
        return error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
