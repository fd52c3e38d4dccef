package com.proxylens.detection;

/**
 * Failure of a single detection rule. Never escalates beyond the engine.
 */
public class RuleEvaluationException extends RuntimeException {

    private final String patternName;
    private final String uploadId;

    public RuleEvaluationException(String patternName, String uploadId, Throwable cause) {
        super("Rule " + patternName + " failed", cause);
        this.patternName = patternName;
        this.uploadId = uploadId;
    }

    public String getPatternName() {
        return patternName;
    }

    public String getUploadId() {
        return uploadId;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" [Upload: ").append(uploadId).append("]");
        if (getCause() != null) {
            sb.append(" [Cause: ").append(getCause()).append("]");
        }
        return sb.toString();
    }
}
