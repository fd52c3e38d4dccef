package com.proxylens.report;

import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Incident;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;
import com.proxylens.domain.UploadFeatures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.proxylens.domain.FindingFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FallbackNarrativeGenerator Tests")
class FallbackNarrativeGeneratorTest {

    private final FallbackNarrativeGenerator generator = new FallbackNarrativeGenerator();
    private final IncidentSynthesizer synthesizer = new IncidentSynthesizer();

    private final Finding c2 = finding("C2_BEACONING_SUSPECTED", Severity.HIGH, 0.9)
        .summary("12 blocked command-and-control requests to cnc.example.net.")
        .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
        .evidence(EvidenceKeys.SECURITY_OUTCOME, SecurityOutcome.C2_BEACONING_SUSPECTED.getValue())
        .build();
    private final Finding burst = finding("BURST_FROM_SINGLE_IP", Severity.HIGH, 0.8)
        .summary("10.0.0.5 made 120 requests in one minute.")
        .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
        .evidence(EvidenceKeys.SECURITY_OUTCOME, SecurityOutcome.INSUFFICIENT_EVIDENCE.getValue())
        .build();

    @Test
    @DisplayName("Should derive incident text from findings")
    void shouldFillIncidentText() {
        // Given
        List<Incident> incidents = synthesizer.synthesize(List.of(c2, burst), Map.of());

        // When
        generator.applyTo(incidents, Map.of(c2.getId(), c2, burst.getId(), burst));

        // Then
        Incident incident = incidents.get(0);
        assertThat(incident.getTitle()).isEqualTo("C2 beaconing suspected involving ip 10.0.0.5");
        assertThat(incident.getWhy()).containsExactly(
            "12 blocked command-and-control requests to cnc.example.net.",
            "10.0.0.5 made 120 requests in one minute.",
            "Corroborated by 2 independent detection patterns.");
        assertThat(incident.getRecommendedActions())
            .startsWith("Block the command-and-control destinations at DNS and firewall level.")
            .contains("Confirm the activity against the raw proxy records listed as evidence.")
            .hasSizeLessThanOrEqualTo(FallbackNarrativeGenerator.MAX_ACTIONS);
    }

    @Test
    @DisplayName("Should summarise the upload deterministically")
    void shouldSummarise() {
        UploadFeatures features = new UploadFeatures();
        features.setTotalEvents(200);
        features.setBlocked(40);
        features.setAllowed(160);
        features.setTimeStart(Instant.parse("2024-05-01T10:00:00Z"));
        features.setTimeEnd(Instant.parse("2024-05-01T12:00:00Z"));
        List<Incident> incidents = synthesizer.synthesize(List.of(c2, burst), Map.of());
        generator.applyTo(incidents, Map.of());

        String summary = generator.summarize(features, incidents, 2);

        assertThat(summary)
            .startsWith("Analysed 200 proxy events (40 blocked, 160 allowed) between 2024-05-01T10:00:00Z")
            .contains("2 findings were grouped into 1 incidents, 1 of them corroborated by multiple detections")
            .contains("affecting ip 10.0.0.5");
        assertThat(generator.summarize(features, incidents, 2)).isEqualTo(summary);
    }

    @Test
    @DisplayName("Should humanize outcome constants")
    void shouldHumanize() {
        assertThat(FallbackNarrativeGenerator.humanize("PHISH_TO_PAYLOAD_CHAIN_SUSPECTED"))
            .isEqualTo("Phish to payload chain suspected");
    }
}
