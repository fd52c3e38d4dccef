package com.proxylens.detection;

import com.proxylens.domain.Finding;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle of an accepted detection run; rejected runs throw instead. The run itself executes on the detection executor.
 */
public final class DetectionRun {

    private final String uploadId;
    private final String ingestJobId;
    private final CompletableFuture<List<Finding>> completion;

    DetectionRun(String uploadId, String ingestJobId, CompletableFuture<List<Finding>> completion) {
        this.uploadId = uploadId;
        this.ingestJobId = ingestJobId;
        this.completion = completion;
    }

    public String getUploadId() {
        return uploadId;
    }

    /**
     * The done ingest job the run was accepted against
     */
    public String getIngestJobId() {
        return ingestJobId;
    }

    /**
     * Completes with the findings appended by this run
     */
    public CompletableFuture<List<Finding>> getCompletion() {
        return completion;
    }
}
