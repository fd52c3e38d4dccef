package com.proxylens.report;

import com.proxylens.domain.NarrativeSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for report generation and the reasoning service.
 */
@Component
public class ReportMetrics {

    private final MeterRegistry registry;
    private final Counter reasoningNarratives;
    private final Counter templateNarratives;
    private final Counter rejectedReports;
    private final Counter reasoningCalls;
    private final Counter reasoningErrors;
    private final Counter draftsRejected;
    private final Timer reportDuration;

    public ReportMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.reasoningNarratives = Counter.builder("proxylens.report.generated")
            .description("Reports generated by narrative source")
            .tag("source", NarrativeSource.REASONING_SERVICE.getValue())
            .register(registry);

        this.templateNarratives = Counter.builder("proxylens.report.generated")
            .description("Reports generated by narrative source")
            .tag("source", NarrativeSource.TEMPLATE.getValue())
            .register(registry);

        this.rejectedReports = Counter.builder("proxylens.report.rejected")
            .description("Report requests rejected for uploads without findings")
            .register(registry);

        this.reasoningCalls = Counter.builder("proxylens.report.reasoning.calls")
            .description("Calls made to the reasoning service")
            .register(registry);

        this.reasoningErrors = Counter.builder("proxylens.report.reasoning.errors")
            .description("Reasoning service calls that failed or timed out")
            .register(registry);

        this.draftsRejected = Counter.builder("proxylens.report.reasoning.invalid")
            .description("Reasoning drafts rejected by validation")
            .register(registry);

        this.reportDuration = Timer.builder("proxylens.report.duration")
            .description("Time to assemble one report")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordGenerated(NarrativeSource source) {
        if (source == NarrativeSource.REASONING_SERVICE) {
            reasoningNarratives.increment();
        } else {
            templateNarratives.increment();
        }
    }

    public void recordRejected() {
        rejectedReports.increment();
    }

    public void recordReasoningCall() {
        reasoningCalls.increment();
    }

    public void recordReasoningError() {
        reasoningErrors.increment();
    }

    public void recordDraftRejected() {
        draftsRejected.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordDuration(Timer.Sample sample) {
        sample.stop(reportDuration);
    }
}
