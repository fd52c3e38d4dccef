package com.proxylens.detection.rules;

import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.proxylens.domain.EventFixtures.T0;
import static com.proxylens.domain.EventFixtures.UPLOAD;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("C2BeaconingRule Tests")
class C2BeaconingRuleTest {

    private final C2BeaconingRule rule = new C2BeaconingRule(3, 6);

    private static List<Event> beacons(String category, int hits, long secondsApart) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < hits; i++) {
            events.add(EventFixtures.blocked("alice@corp.com", "10.0.0.5", "cnc.example.net", category)
                .timestamp(T0.plusSeconds(i * secondsApart))
                .build());
        }
        return events;
    }

    @Test
    @DisplayName("Should flag periodic blocked C2 traffic")
    void shouldFlagBeaconing() {
        // Given: one request every 30 seconds for 4 minutes
        List<Event> events = beacons("Command and Control", 8, 30);

        // When
        List<Finding> findings = rule.evaluate(new DetectionScope(UPLOAD, events, List.of()));

        // Then
        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(finding.getPatternName()).isEqualTo(C2BeaconingRule.PATTERN);
            assertThat(finding.getEvidence())
                .containsEntry(EvidenceKeys.DEST_HOST, "cnc.example.net")
                .containsEntry(EvidenceKeys.COUNT, 8L)
                .containsEntry("distinct_minutes", 4L);
            assertThat(finding.evidenceList(EvidenceKeys.MITRE)).containsExactly("TA0011", "T1071");
            assertThat(finding.getConfidence()).isBetween(0.6, 0.99);
        });
    }

    @Test
    @DisplayName("Should not flag a burst inside a single minute")
    void shouldRequireSpreadOverMinutes() {
        assertThat(rule.evaluate(new DetectionScope(UPLOAD, beacons("Botnet", 10, 1), List.of()))).isEmpty();
    }

    @Test
    @DisplayName("Should ignore non C2 categories")
    void shouldIgnoreOtherCategories() {
        assertThat(rule.evaluate(new DetectionScope(UPLOAD, beacons("Malware", 8, 30), List.of()))).isEmpty();
    }
}
