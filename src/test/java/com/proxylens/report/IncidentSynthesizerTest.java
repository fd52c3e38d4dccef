package com.proxylens.report;

import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Incident;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.proxylens.domain.FindingFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncidentSynthesizer Tests")
class IncidentSynthesizerTest {

    private final IncidentSynthesizer synthesizer = new IncidentSynthesizer();

    @Test
    @DisplayName("Should group findings sharing an entity")
    void shouldGroupBySharedEntity() {
        // Given
        Finding burst = finding("BURST", Severity.HIGH, 0.9)
            .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
            .evidence(EvidenceKeys.SECURITY_OUTCOME, SecurityOutcome.RECONNAISSANCE_SUSPECTED.getValue())
            .build();
        Finding c2 = finding("C2", Severity.MEDIUM, 0.6)
            .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
            .evidence(EvidenceKeys.DEST_HOST, "cnc.example.net")
            .evidence(EvidenceKeys.SECURITY_OUTCOME, SecurityOutcome.C2_BEACONING_SUSPECTED.getValue())
            .build();
        Finding unrelated = finding("OFF_HOURS", Severity.LOW, 0.4)
            .evidence(EvidenceKeys.USER_EMAIL, "bob@corp.com")
            .build();

        // When
        List<Incident> incidents = synthesizer.synthesize(List.of(burst, c2, unrelated), Map.of());

        // Then
        assertThat(incidents).hasSize(2);
        Incident grouped = incidents.get(0);
        assertThat(grouped.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(grouped.getEvidenceFindingIds()).containsExactly(burst.getId(), c2.getId());
        assertThat(grouped.getPatternNames()).containsExactly("BURST", "C2");
        assertThat(grouped.getTitle()).isEqualTo("BURST title and 1 related findings");
        assertThat(grouped.getConfidence()).isEqualTo(0.8);
        assertThat(grouped.isConfirmed()).isTrue();
        assertThat(grouped.getAffectedEntities().getDestHosts()).containsExactly("cnc.example.net");
        assertThat(grouped.getSecurityOutcomes()).containsExactly(
            SecurityOutcome.RECONNAISSANCE_SUSPECTED.getValue(), SecurityOutcome.C2_BEACONING_SUSPECTED.getValue());

        Incident single = incidents.get(1);
        assertThat(single.getTitle()).isEqualTo("OFF_HOURS title");
        assertThat(single.isConfirmed()).isFalse();
        assertThat(single.getSecurityOutcomes()).containsExactly(SecurityOutcome.INSUFFICIENT_EVIDENCE.getValue());
    }

    @Test
    @DisplayName("Should merge findings linked through a third finding")
    void shouldMergeTransitively() {
        Finding a = finding("A", Severity.MEDIUM, 0.5).evidence(EvidenceKeys.USER_EMAIL, "alice@corp.com").build();
        Finding b = finding("B", Severity.MEDIUM, 0.5).evidence(EvidenceKeys.DEST_HOST, "x.example.com").build();
        Finding bridge = finding("C", Severity.LOW, 0.5)
            .evidence(EvidenceKeys.USER_EMAIL, "alice@corp.com")
            .evidence(EvidenceKeys.DEST_HOST, "x.example.com")
            .build();

        List<Incident> incidents = synthesizer.synthesize(List.of(a, b, bridge), Map.of());

        assertThat(incidents).singleElement()
            .satisfies(incident -> assertThat(incident.getEvidenceFindingIds()).hasSize(3));
    }

    @Test
    @DisplayName("Should link findings through shared threat categories")
    void shouldLinkThroughCategoryList() {
        Finding spike = finding("SPIKE", Severity.HIGH, 0.7).evidence(EvidenceKeys.THREAT_CATEGORY, "Phishing").build();
        Finding chain = finding("CHAIN", Severity.HIGH, 0.7)
            .evidence(EvidenceKeys.THREAT_CATEGORIES, List.of("Malware", "Phishing"))
            .build();

        assertThat(synthesizer.synthesize(List.of(spike, chain), Map.of())).hasSize(1);
    }

    @Test
    @DisplayName("Should cap evidence event ids")
    void shouldCapEventIds() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            ids.add("e" + i);
        }
        Finding big = finding("BIG", Severity.HIGH, 0.7).evidence(EvidenceKeys.EVENT_IDS, ids).build();

        Incident incident = synthesizer.synthesize(List.of(big), Map.of()).get(0);

        assertThat(incident.getEvidenceEventIds()).hasSize(IncidentSynthesizer.MAX_EVENT_IDS).startsWith("e0", "e1");
    }

    @Test
    @DisplayName("Should take the time range from first and last seen evidence")
    void shouldComputeTimeRange() {
        Finding early = finding("A", Severity.LOW, 0.5)
            .evidence(EvidenceKeys.USER_EMAIL, "alice@corp.com")
            .evidence(EvidenceKeys.FIRST_SEEN, "2024-05-01T09:00:00Z")
            .evidence(EvidenceKeys.LAST_SEEN, "2024-05-01T09:30:00Z")
            .build();
        Finding late = finding("B", Severity.LOW, 0.5)
            .evidence(EvidenceKeys.USER_EMAIL, "alice@corp.com")
            .evidence(EvidenceKeys.BUCKET, "2024-05-01T11:00:00Z")
            .build();

        Incident incident = synthesizer.synthesize(List.of(early, late), Map.of()).get(0);

        assertThat(incident.getFirstSeen()).isEqualTo(Instant.parse("2024-05-01T09:00:00Z"));
        assertThat(incident.getLastSeen()).isEqualTo(Instant.parse("2024-05-01T11:00:00Z"));
    }

    @Test
    @DisplayName("Should keep aggregate confidence near the strongest finding")
    void shouldAggregateConfidence() {
        List<Finding> group = List.of(
            finding("A", Severity.CRITICAL, 0.95).build(),
            finding("B", Severity.LOW, 0.2).build(),
            finding("C", Severity.LOW, 0.2).build());

        assertThat(IncidentSynthesizer.aggregateConfidence(group)).isEqualTo(0.85);
    }
}
