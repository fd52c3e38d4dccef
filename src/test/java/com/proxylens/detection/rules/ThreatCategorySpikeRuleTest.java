package com.proxylens.detection.rules;

import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.SecurityOutcome;
import com.proxylens.domain.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.proxylens.domain.EventFixtures.UPLOAD;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ThreatCategorySpikeRule Tests")
class ThreatCategorySpikeRuleTest {

    private final ThreatCategorySpikeRule rule =
        new ThreatCategorySpikeRule(ThreatCategories.DEFAULT_HIGH_RISK, 3, 0.01, 20, 0.05);

    private static List<Event> upload(String category, int hits, int background) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < hits; i++) {
            events.add(EventFixtures.event().userEmail("alice@corp.com").threatCategory(category).build());
        }
        for (int i = 0; i < background; i++) {
            events.add(EventFixtures.event().userEmail("bob@corp.com").build());
        }
        return events;
    }

    @Nested
    @DisplayName("Threshold")
    class Threshold {

        @Test
        @DisplayName("Should use the floor for small uploads")
        void shouldUseFloor() {
            assertThat(rule.thresholdFor(true, 100)).isEqualTo(3);
            assertThat(rule.thresholdFor(false, 100)).isEqualTo(20);
        }

        @Test
        @DisplayName("Should scale with upload size")
        void shouldScaleWithSize() {
            assertThat(rule.thresholdFor(true, 1001)).isEqualTo(11);
            assertThat(rule.thresholdFor(false, 1000)).isEqualTo(50);
        }
    }

    @Test
    @DisplayName("Should flag a high-risk category above its threshold")
    void shouldFlagHighRiskSpike() {
        // Given
        List<Event> events = upload("Phishing", 5, 95);

        // When
        List<Finding> findings = rule.evaluate(new DetectionScope(UPLOAD, events, List.of()));

        // Then
        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(finding.getEvidence())
                .containsEntry(EvidenceKeys.THREAT_CATEGORY, "Phishing")
                .containsEntry(EvidenceKeys.COUNT, 5L)
                .containsEntry(EvidenceKeys.THRESHOLD, 3L)
                .containsEntry("high_risk", true)
                .containsEntry(EvidenceKeys.USER_EMAIL, "alice@corp.com")
                .containsEntry(EvidenceKeys.SECURITY_OUTCOME,
                    SecurityOutcome.CREDENTIAL_HARVESTING_SUSPECTED.getValue());
        });
    }

    @Test
    @DisplayName("Should rate three times the threshold as critical")
    void shouldEscalateToCritical() {
        List<Finding> findings = rule.evaluate(new DetectionScope(UPLOAD, upload("Malware", 9, 91), List.of()));

        assertThat(findings).singleElement().extracting(Finding::getSeverity).isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should hold ordinary categories to the higher floor")
    void shouldUseNormalFloorForOrdinaryCategories() {
        assertThat(rule.evaluate(new DetectionScope(UPLOAD, upload("Gambling", 15, 85), List.of()))).isEmpty();

        List<Finding> findings = rule.evaluate(new DetectionScope(UPLOAD, upload("Gambling", 25, 75), List.of()));
        assertThat(findings).singleElement().extracting(Finding::getSeverity).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should not fire at exactly the threshold")
    void shouldRequireStrictlyMoreThanThreshold() {
        assertThat(rule.evaluate(new DetectionScope(UPLOAD, upload("Phishing", 3, 97), List.of()))).isEmpty();
    }
}
