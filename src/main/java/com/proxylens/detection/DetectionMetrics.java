package com.proxylens.detection;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collector for detection runs.
 *
 * Tracks:
 * - Accepted and rejected runs
 * - Findings per pattern
 * - Rule failures per pattern
 * - Run duration
 */
@Component
public class DetectionMetrics {

    private final MeterRegistry registry;
    private final Counter runsAccepted;
    private final Counter runsRejected;
    private final Timer runDuration;
    private final Map<String, Counter> findingCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> ruleErrorCounters = new ConcurrentHashMap<>();

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.runsAccepted = Counter.builder("proxylens.detection.runs")
            .description("Detection runs by outcome")
            .tag("outcome", "accepted")
            .register(registry);

        this.runsRejected = Counter.builder("proxylens.detection.runs")
            .description("Detection runs by outcome")
            .tag("outcome", "rejected")
            .register(registry);

        this.runDuration = Timer.builder("proxylens.detection.duration")
            .description("Time to evaluate every rule against one upload")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    public void recordAccepted() {
        runsAccepted.increment();
    }

    public void recordRejected() {
        runsRejected.increment();
    }

    public void recordFindings(String patternName, int count) {
        findingCounters.computeIfAbsent(patternName, name ->
            Counter.builder("proxylens.detection.findings")
                .tag("pattern", name)
                .description("Findings produced by pattern")
                .register(registry)
        ).increment(count);
    }

    public void recordRuleError(String patternName) {
        ruleErrorCounters.computeIfAbsent(patternName, name ->
            Counter.builder("proxylens.detection.rule.errors")
                .tag("pattern", name)
                .description("Rule evaluations that threw")
                .register(registry)
        ).increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordDuration(Timer.Sample sample) {
        sample.stop(runDuration);
    }
}
