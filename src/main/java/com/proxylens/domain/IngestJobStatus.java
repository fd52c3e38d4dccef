package com.proxylens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an ingest job.
 * Jobs move forward only: queued, running, then done or failed.
 */
public enum IngestJobStatus {

    /**
     * Job has been accepted but the worker has not started yet
     */
    QUEUED("queued"),

    /**
     * Worker is streaming lines through the normalizer
     */
    RUNNING("running"),

    /**
     * All lines were processed and rollups were rebuilt
     */
    DONE("done"),

    /**
     * A fatal condition stopped the job
     */
    FAILED("failed");

    private final String value;

    IngestJobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Whether a job in this status may move to {@code next}.
     * A queued job may fail directly when its worker cannot be scheduled.
     */
    public boolean canTransitionTo(IngestJobStatus next) {
        switch (this) {
            case QUEUED:
                return next == RUNNING || next == FAILED;
            case RUNNING:
                return next == DONE || next == FAILED;
            default:
                return false;
        }
    }

    /**
     * Parse a string value to IngestJobStatus
     */
    public static IngestJobStatus fromValue(String value) {
        for (IngestJobStatus status : IngestJobStatus.values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown IngestJobStatus value: " + value);
    }
}
