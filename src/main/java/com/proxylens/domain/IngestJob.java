package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Tracked unit of work that converts one uploaded file into stored events.
 *
 * Instances are immutable snapshots. Every state change produces a new snapshot
 * through {@link #toBuilder()}, and the repository swaps snapshots atomically so
 * a reader never sees {@code insertedEvents} and {@code badLines} from different
 * moments. Jobs are never deleted.
 */
public final class IngestJob {

    @JsonProperty("job_id")
    private final String id;

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

    private IngestJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.uploadId = Objects.requireNonNull(builder.uploadId, "uploadId");
        this.status = Objects.requireNonNull(builder.status, "status");
        this.insertedEvents = builder.insertedEvents;
        this.badLines = builder.badLines;
        this.error = builder.error;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String getId() {
        return id;
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

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public long getProcessedLines() {
        return insertedEvents + badLines;
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .uploadId(uploadId)
            .status(status)
            .insertedEvents(insertedEvents)
            .badLines(badLines)
            .error(error)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "IngestJob{" +
            "id='" + id + '\'' +
            ", uploadId='" + uploadId + '\'' +
            ", status=" + status +
            ", insertedEvents=" + insertedEvents +
            ", badLines=" + badLines +
            ", error='" + error + '\'' +
            '}';
    }

    public static class Builder {
        private String id;
        private String uploadId;
        private IngestJobStatus status = IngestJobStatus.QUEUED;
        private long insertedEvents;
        private long badLines;
        private String error;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder uploadId(String uploadId) {
            this.uploadId = uploadId;
            return this;
        }

        public Builder status(IngestJobStatus status) {
            this.status = status;
            return this;
        }

        public Builder insertedEvents(long insertedEvents) {
            this.insertedEvents = insertedEvents;
            return this;
        }

        public Builder badLines(long badLines) {
            this.badLines = badLines;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public IngestJob build() {
            Instant now = Instant.now();
            if (createdAt == null) {
                createdAt = now;
            }
            if (updatedAt == null) {
                updatedAt = createdAt;
            }
            return new IngestJob(this);
        }
    }
}
