package com.proxylens.normalization;

import com.proxylens.domain.Event;
import com.proxylens.normalization.parsers.EventParser;
import com.proxylens.normalization.parsers.ParseException;
import com.proxylens.normalization.parsers.ParserRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns one raw log line into a typed {@link Event}.
 *
 * Lines degrade gracefully: unparseable timestamps, invalid IPs and unknown
 * vocabulary only leave fields empty. A {@link ParseException} is raised only when
 * the line cannot be tokenized in its detected dialect.
 */
@Service
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    private final DialectDetector dialectDetector;
    private final ParserRegistry parserRegistry;
    private final FieldExtractor fieldExtractor;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Map<LogDialect, Counter> parsedCounters = new ConcurrentHashMap<>();
    private final Map<LogDialect, Counter> failedCounters = new ConcurrentHashMap<>();

    public EventNormalizer(
            DialectDetector dialectDetector,
            ParserRegistry parserRegistry,
            FieldExtractor fieldExtractor,
            MeterRegistry meterRegistry) {
        this.dialectDetector = dialectDetector;
        this.parserRegistry = parserRegistry;
        this.fieldExtractor = fieldExtractor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Normalize a single line of an upload
     *
     * @param uploadId owning upload
     * @param line raw line, kept verbatim on the event
     * @return the normalized event
     * @throws ParseException if the line cannot be tokenized
     */
    public Event normalize(String uploadId, String line) throws ParseException {
        LogDialect dialect = dialectDetector.detect(line);

        try {
            EventParser parser = parserRegistry.getParser(dialect, line);
            Map<String, String> fields = parser.tokenize(line.trim());
            Event event = fieldExtractor.extract(uploadId, dialect, fields, line);

            incrementCounter(parsedCounters, "proxylens.normalization.parsed", dialect);
            return event;

        } catch (ParseException e) {
            incrementCounter(failedCounters, "proxylens.normalization.failed", dialect);
            log.debug("Rejected {} line for upload {}: {}", dialect.getValue(), uploadId, e.getMessage());
            throw e;
        }
    }

    private void incrementCounter(Map<LogDialect, Counter> counters, String name, LogDialect dialect) {
        Counter counter = counters.computeIfAbsent(dialect, d ->
            Counter.builder(name)
                .tag("dialect", d.getValue())
                .description("Normalized lines by dialect and outcome")
                .register(meterRegistry)
        );
        counter.increment();
    }
}
