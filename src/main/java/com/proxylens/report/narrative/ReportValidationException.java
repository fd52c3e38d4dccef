package com.proxylens.report.narrative;

import java.util.List;

/**
 * A reasoning draft failed validation. Carries every violation found, not only the first.
 */
public class ReportValidationException extends RuntimeException {

    private final List<String> violations;

    public ReportValidationException(List<String> violations) {
        super("Reasoning draft rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ReportValidationException(String violation, Throwable cause) {
        super("Reasoning draft rejected: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
