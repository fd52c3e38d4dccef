package com.proxylens.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.proxylens.common.OperationRejectedException;
import com.proxylens.detection.DetectionService;
import com.proxylens.domain.Event;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Incident;
import com.proxylens.domain.IngestJob;
import com.proxylens.domain.NarrativeSource;
import com.proxylens.domain.SocReport;
import com.proxylens.domain.UploadFeatures;
import com.proxylens.report.narrative.ReasoningClient;
import com.proxylens.report.narrative.ReasoningClientException;
import com.proxylens.report.narrative.ReasoningRequest;
import com.proxylens.report.narrative.ReportNarrative;
import com.proxylens.report.narrative.ReportValidationException;
import com.proxylens.report.narrative.ReportValidator;
import com.proxylens.rollup.UploadFeatureService;
import com.proxylens.storage.EventStore;
import com.proxylens.storage.IngestJobRepository;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assembles the SOC report of an upload.
 *
 * The structured part (incidents, timeline, IOCs, gaps) is always computed locally.
 * The narrative is drafted by the reasoning service when it answers in time with a
 * valid draft; otherwise the template generator writes it and a gap records the
 * degraded narrative. The report is structurally complete either way.
 */
@Service
public class ReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

    private final DetectionService detectionService;
    private final EventStore eventStore;
    private final IngestJobRepository jobRepository;
    private final UploadFeatureService featureService;
    private final IncidentSynthesizer incidentSynthesizer;
    private final TimelineBuilder timelineBuilder;
    private final IocExtractor iocExtractor;
    private final GapAnalyzer gapAnalyzer;
    private final FallbackNarrativeGenerator fallbackGenerator;
    private final ReportValidator validator;
    private final ReasoningClient reasoningClient;
    private final ReportMetrics metrics;
    private final Duration reasoningTimeout;
    private final int sampleEvents;
    private final Clock clock;

    public ReportAssembler(
            DetectionService detectionService,
            EventStore eventStore,
            IngestJobRepository jobRepository,
            UploadFeatureService featureService,
            IncidentSynthesizer incidentSynthesizer,
            TimelineBuilder timelineBuilder,
            IocExtractor iocExtractor,
            GapAnalyzer gapAnalyzer,
            FallbackNarrativeGenerator fallbackGenerator,
            ReportValidator validator,
            ReasoningClient reasoningClient,
            ReportMetrics metrics,
            @Value("${proxylens.reasoning.timeout-ms:20000}") long reasoningTimeoutMs,
            @Value("${proxylens.report.sample-events:25}") int sampleEvents) {
        this(detectionService, eventStore, jobRepository, featureService, incidentSynthesizer, timelineBuilder,
            iocExtractor, gapAnalyzer, fallbackGenerator, validator, reasoningClient, metrics,
            Duration.ofMillis(reasoningTimeoutMs), sampleEvents, Clock.systemUTC());
    }

    ReportAssembler(
            DetectionService detectionService,
            EventStore eventStore,
            IngestJobRepository jobRepository,
            UploadFeatureService featureService,
            IncidentSynthesizer incidentSynthesizer,
            TimelineBuilder timelineBuilder,
            IocExtractor iocExtractor,
            GapAnalyzer gapAnalyzer,
            FallbackNarrativeGenerator fallbackGenerator,
            ReportValidator validator,
            ReasoningClient reasoningClient,
            ReportMetrics metrics,
            Duration reasoningTimeout,
            int sampleEvents,
            Clock clock) {
        this.detectionService = detectionService;
        this.eventStore = eventStore;
        this.jobRepository = jobRepository;
        this.featureService = featureService;
        this.incidentSynthesizer = incidentSynthesizer;
        this.timelineBuilder = timelineBuilder;
        this.iocExtractor = iocExtractor;
        this.gapAnalyzer = gapAnalyzer;
        this.fallbackGenerator = fallbackGenerator;
        this.validator = validator;
        this.reasoningClient = reasoningClient;
        this.metrics = metrics;
        this.reasoningTimeout = reasoningTimeout;
        this.sampleEvents = sampleEvents;
        this.clock = clock;
    }

    /**
     * Generate the report of an upload
     *
     * @throws OperationRejectedException with {@code NO_FINDINGS} when detection produced nothing to report
     */
    public SocReport generateReport(String uploadId) {
        List<Finding> findings = detectionService.listFindings(uploadId);
        if (findings.isEmpty()) {
            metrics.recordRejected();
            throw new OperationRejectedException(OperationRejectedException.Reason.NO_FINDINGS, uploadId,
                "Upload has no findings, run detection first");
        }

        Timer.Sample sample = metrics.startTimer();
        try {
            return assemble(uploadId, findings);
        } finally {
            metrics.recordDuration(sample);
        }
    }

    private SocReport assemble(String uploadId, List<Finding> findings) {
        Set<String> linkedIds = new LinkedHashSet<>();
        for (Finding finding : findings) {
            linkedIds.addAll(finding.getEventIds());
        }
        Map<String, Event> eventsById = eventStore.findByIds(uploadId, linkedIds).stream()
            .collect(Collectors.toMap(Event::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        Map<String, Finding> findingsById = new HashMap<>();
        for (Finding finding : findings) {
            findingsById.put(finding.getId(), finding);
        }

        UploadFeatures features = featureService.features(uploadId);
        Optional<IngestJob> ingestJob = jobRepository.findLatestByUpload(uploadId);
        List<Incident> incidents = incidentSynthesizer.synthesize(findings, eventsById);

        SocReport report = new SocReport();
        report.setUploadId(uploadId);
        report.setIncidents(incidents);
        report.setTimeline(timelineBuilder.build(findings, eventsById));
        report.setIocs(iocExtractor.extract(findings, eventsById.values()));
        report.setGaps(new ArrayList<>(gapAnalyzer.analyze(features, ingestJob)));
        report.setGeneratedAt(clock.instant());

        ReasoningRequest request = new ReasoningRequest(uploadId, uploadContext(features, ingestJob), findings,
            incidents, sampleEvents(incidents, eventsById));
        try {
            ReportNarrative narrative = validator.validate(requestDraft(request), incidents, findingsById.keySet());
            applyNarrative(report, narrative);
            report.setNarrativeSource(NarrativeSource.REASONING_SERVICE);
        } catch (ReasoningClientException e) {
            log.warn("Reasoning service unavailable for upload {}, using template narrative: {}",
                uploadId, e.getMessage());
            applyFallback(report, features, findings.size(), findingsById);
        } catch (ReportValidationException e) {
            metrics.recordDraftRejected();
            log.warn("Reasoning draft for upload {} rejected ({} violations), using template narrative: {}",
                uploadId, e.getViolations().size(), e.getMessage());
            applyFallback(report, features, findings.size(), findingsById);
        }

        metrics.recordGenerated(report.getNarrativeSource());
        log.info("Report for upload {}: {} incidents, {} timeline items, {} IOCs, narrative from {}",
            uploadId, incidents.size(), report.getTimeline().size(), report.getIocs().size(),
            report.getNarrativeSource().getValue());
        return report;
    }

    private JsonNode requestDraft(ReasoningRequest request) {
        JsonNode draft = reasoningClient.draftReport(request)
            .timeout(reasoningTimeout)
            .onErrorMap(e -> !(e instanceof ReasoningClientException), e -> e instanceof TimeoutException
                ? new ReasoningClientException("No draft within " + reasoningTimeout.toMillis() + "ms", e)
                : new ReasoningClientException("Reasoning call failed: " + e.getMessage(), e))
            .block();
        if (draft == null) {
            throw new ReasoningClientException("Reasoning service returned no draft");
        }
        return draft;
    }

    private static void applyNarrative(SocReport report, ReportNarrative narrative) {
        report.setSummary(narrative.getSummary());
        List<Incident> incidents = report.getIncidents();
        for (int i = 0; i < incidents.size(); i++) {
            Incident incident = incidents.get(i);
            ReportNarrative.IncidentNarrative text = narrative.getIncidents().get(i);
            incident.setTitle(text.getTitle());
            incident.setWhy(new ArrayList<>(text.getWhy()));
            incident.setRecommendedActions(new ArrayList<>(text.getRecommendedActions()));
            if (!text.getSecurityOutcomes().isEmpty()) {
                incident.setSecurityOutcomes(new ArrayList<>(text.getSecurityOutcomes()));
            }
        }
        for (String gap : narrative.getGaps()) {
            if (!report.getGaps().contains(gap)) {
                report.getGaps().add(gap);
            }
        }
    }

    private void applyFallback(SocReport report, UploadFeatures features, int findingCount,
                               Map<String, Finding> findingsById) {
        fallbackGenerator.applyTo(report.getIncidents(), findingsById);
        report.setSummary(fallbackGenerator.summarize(features, report.getIncidents(), findingCount));
        report.getGaps().add(GapAnalyzer.DEGRADED_NARRATIVE);
        report.setNarrativeSource(NarrativeSource.TEMPLATE);
    }

    private static Map<String, Object> uploadContext(UploadFeatures features, Optional<IngestJob> ingestJob) {
        Map<String, Object> upload = new LinkedHashMap<>();
        upload.put("features", features);
        ingestJob.ifPresent(job -> {
            Map<String, Object> ingest = new LinkedHashMap<>();
            ingest.put("job_id", job.getId());
            ingest.put("status", job.getStatus().getValue());
            ingest.put("inserted_events", job.getInsertedEvents());
            ingest.put("bad_lines", job.getBadLines());
            upload.put("ingest", ingest);
        });
        return upload;
    }

    /**
     * Events cited by the incidents, most severe incident first, capped at the sample size
     */
    private List<Map<String, Object>> sampleEvents(List<Incident> incidents, Map<String, Event> eventsById) {
        Set<String> sampled = new LinkedHashSet<>();
        for (Incident incident : incidents) {
            for (String eventId : incident.getEvidenceEventIds()) {
                if (sampled.size() >= sampleEvents) {
                    break;
                }
                if (eventsById.containsKey(eventId)) {
                    sampled.add(eventId);
                }
            }
        }
        List<Map<String, Object>> events = new ArrayList<>();
        for (String eventId : sampled) {
            events.add(eventsById.get(eventId).toSummaryMap());
        }
        return events;
    }
}
