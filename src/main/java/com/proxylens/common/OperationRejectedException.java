package com.proxylens.common;

/**
 * Thrown when a caller asks for an operation the current pipeline state does not allow.
 * Rejections are expected outcomes, not failures of this service.
 */
public class OperationRejectedException extends RuntimeException {

    public enum Reason {
        /**
         * The upload already has a queued or running ingest job
         */
        INGEST_IN_PROGRESS,

        /**
         * No ingest job exists with the requested id
         */
        JOB_NOT_FOUND,

        /**
         * Detection was requested before the upload's latest ingest job finished successfully
         */
        INGEST_NOT_DONE,

        /**
         * A report was requested for an upload without findings
         */
        NO_FINDINGS
    }

    private final Reason reason;
    private final String subject;

    public OperationRejectedException(Reason reason, String subject, String message) {
        super(message);
        this.reason = reason;
        this.subject = subject;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Upload or job id the rejected request referred to
     */
    public String getSubject() {
        return subject;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [" + reason + ": " + subject + "]";
    }
}
