package com.proxylens.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxylens.common.OperationRejectedException;
import com.proxylens.detection.DetectionService;
import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.NarrativeSource;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;
import com.proxylens.domain.SocReport;
import com.proxylens.domain.UploadFeatures;
import com.proxylens.report.narrative.ReasoningClient;
import com.proxylens.report.narrative.ReasoningClientException;
import com.proxylens.report.narrative.ReasoningRequest;
import com.proxylens.report.narrative.ReportValidator;
import com.proxylens.rollup.UploadFeatureService;
import com.proxylens.storage.EventStore;
import com.proxylens.storage.IngestJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.proxylens.domain.EventFixtures.UPLOAD;
import static com.proxylens.domain.FindingFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ReportAssembler
 * Covers the reasoning path, the template fallback and rejection without findings
 */
@ExtendWith(MockitoExtension.class)
class ReportAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-05-02T08:00:00Z");

    @Mock
    private DetectionService detectionService;

    @Mock
    private EventStore eventStore;

    @Mock
    private IngestJobRepository jobRepository;

    @Mock
    private UploadFeatureService featureService;

    @Mock
    private ReasoningClient reasoningClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private ReportAssembler assembler;
    private Event event;
    private Finding c2;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        assembler = new ReportAssembler(detectionService, eventStore, jobRepository, featureService,
            new IncidentSynthesizer(), new TimelineBuilder(), new IocExtractor(), new GapAnalyzer(),
            new FallbackNarrativeGenerator(), new ReportValidator(objectMapper), reasoningClient,
            new ReportMetrics(meterRegistry), Duration.ofMillis(200), 25, Clock.fixed(NOW, ZoneOffset.UTC));

        event = EventFixtures.blocked("alice@corp.com", "10.0.0.5", "cnc.example.net", "Botnet").build();
        c2 = finding("C2_BEACONING_SUSPECTED", Severity.HIGH, 0.8)
            .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
            .evidence(EvidenceKeys.DEST_HOST, "cnc.example.net")
            .evidence(EvidenceKeys.SECURITY_OUTCOME, SecurityOutcome.C2_BEACONING_SUSPECTED.getValue())
            .evidence(EvidenceKeys.EVENT_IDS, List.of(event.getId()))
            .build();
    }

    private void givenUploadWithFindings() {
        UploadFeatures features = new UploadFeatures();
        features.setUploadId(UPLOAD);
        features.setTotalEvents(1);
        features.setBlocked(1);
        when(detectionService.listFindings(UPLOAD)).thenReturn(List.of(c2));
        when(eventStore.findByIds(eq(UPLOAD), anyCollection())).thenReturn(List.of(event));
        when(featureService.features(UPLOAD)).thenReturn(features);
        when(jobRepository.findLatestByUpload(UPLOAD)).thenReturn(Optional.empty());
    }

    private ObjectNode validDraft() {
        ObjectNode draft = objectMapper.createObjectNode();
        draft.put("summary", "Host 10.0.0.5 is beaconing to cnc.example.net.");
        ObjectNode incident = draft.putArray("incidents").addObject();
        incident.put("title", "Beaconing from 10.0.0.5");
        incident.putArray("evidence_finding_ids").add(c2.getId());
        incident.putArray("why").add("Blocked C2 requests every minute.");
        incident.putArray("recommended_actions").add("Isolate 10.0.0.5.");
        ArrayNode gaps = draft.putArray("gaps");
        gaps.add("No EDR telemetry attached.");
        return draft;
    }

    @Test
    @DisplayName("Should reject uploads without findings")
    void shouldRejectWithoutFindings() {
        when(detectionService.listFindings(UPLOAD)).thenReturn(List.of());

        assertThatThrownBy(() -> assembler.generateReport(UPLOAD))
            .isInstanceOf(OperationRejectedException.class)
            .extracting("reason")
            .isEqualTo(OperationRejectedException.Reason.NO_FINDINGS);
        verifyNoInteractions(reasoningClient);
        assertThat(meterRegistry.get("proxylens.report.rejected").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should use an accepted reasoning draft")
    void shouldUseReasoningDraft() {
        // Given
        givenUploadWithFindings();
        when(reasoningClient.draftReport(any())).thenReturn(Mono.just(validDraft()));

        // When
        SocReport report = assembler.generateReport(UPLOAD);

        // Then
        assertThat(report.getNarrativeSource()).isEqualTo(NarrativeSource.REASONING_SERVICE);
        assertThat(report.getSummary()).isEqualTo("Host 10.0.0.5 is beaconing to cnc.example.net.");
        assertThat(report.getGeneratedAt()).isEqualTo(NOW);
        assertThat(report.getIncidents()).singleElement().satisfies(incident -> {
            assertThat(incident.getTitle()).isEqualTo("Beaconing from 10.0.0.5");
            assertThat(incident.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(incident.getRecommendedActions()).containsExactly("Isolate 10.0.0.5.");
            assertThat(incident.getSecurityOutcomes())
                .containsExactly(SecurityOutcome.C2_BEACONING_SUSPECTED.getValue());
        });
        assertThat(report.getGaps()).contains("No EDR telemetry attached.").doesNotContain(GapAnalyzer.DEGRADED_NARRATIVE);
        assertThat(report.getIocs().getDomains()).containsExactly("cnc.example.net");
        assertThat(report.getTimeline()).hasSize(1);

        ArgumentCaptor<ReasoningRequest> request = ArgumentCaptor.forClass(ReasoningRequest.class);
        verify(reasoningClient).draftReport(request.capture());
        assertThat(request.getValue().getFindings()).containsExactly(c2);
        assertThat(request.getValue().getEvents()).hasSize(1);
    }

    @Test
    @DisplayName("Should fall back to templates when the reasoning service times out")
    void shouldFallBackOnTimeout() {
        // Given
        givenUploadWithFindings();
        when(reasoningClient.draftReport(any())).thenReturn(Mono.never());

        // When
        SocReport report = assembler.generateReport(UPLOAD);

        // Then
        assertThat(report.getNarrativeSource()).isEqualTo(NarrativeSource.TEMPLATE);
        assertThat(report.getSummary()).isNotBlank().startsWith("Analysed 1 proxy events");
        assertThat(report.getGaps()).contains(GapAnalyzer.DEGRADED_NARRATIVE);
        assertThat(report.getIncidents()).singleElement().satisfies(incident -> {
            assertThat(incident.getTitle()).startsWith("C2 beaconing suspected involving");
            assertThat(incident.getWhy()).isNotEmpty();
            assertThat(incident.getRecommendedActions()).isNotEmpty();
        });
        assertThat(meterRegistry.get("proxylens.report.generated").tag("source", "template").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fall back to templates when the reasoning service fails")
    void shouldFallBackOnClientError() {
        givenUploadWithFindings();
        when(reasoningClient.draftReport(any()))
            .thenReturn(Mono.error(new ReasoningClientException("Reasoning service answered 503", 503, null)));

        SocReport report = assembler.generateReport(UPLOAD);

        assertThat(report.getNarrativeSource()).isEqualTo(NarrativeSource.TEMPLATE);
        assertThat(report.getGaps()).containsOnlyOnce(GapAnalyzer.DEGRADED_NARRATIVE);
    }

    @Test
    @DisplayName("Should fall back to templates when the draft is invalid")
    void shouldFallBackOnInvalidDraft() {
        // Given
        givenUploadWithFindings();
        ObjectNode draft = validDraft();
        draft.remove("summary");
        when(reasoningClient.draftReport(any())).thenReturn(Mono.just(draft));

        // When
        SocReport report = assembler.generateReport(UPLOAD);

        // Then
        assertThat(report.getNarrativeSource()).isEqualTo(NarrativeSource.TEMPLATE);
        assertThat(report.getSummary()).isNotBlank();
        assertThat(report.getGaps()).doesNotContain("No EDR telemetry attached.");
        assertThat(meterRegistry.get("proxylens.report.reasoning.invalid").counter().count()).isEqualTo(1.0);
    }
}
