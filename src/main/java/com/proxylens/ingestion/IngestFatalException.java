package com.proxylens.ingestion;

/**
 * Whole-job failure: the input stream could not be read or the stores rejected a write.
 * The job moves to failed carrying {@link #getMessage()}.
 */
public class IngestFatalException extends RuntimeException {

    private final String jobId;

    public IngestFatalException(String message, String jobId, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * Human-readable description stored on the failed job.
     */
    public String describe() {
        Throwable cause = getCause();
        if (cause == null) {
            return super.getMessage();
        }
        return super.getMessage() + ": " + cause.getClass().getSimpleName()
            + (cause.getMessage() != null ? " (" + cause.getMessage() + ")" : "");
    }
}
