package com.proxylens.detection.rules;

import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;
import com.proxylens.rollup.RollupAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.proxylens.domain.EventFixtures.T0;
import static com.proxylens.domain.EventFixtures.UPLOAD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BurstFromSingleIpRule Tests")
class BurstFromSingleIpRuleTest {

    private static DetectionScope scopeOf(List<Event> events) {
        return new DetectionScope(UPLOAD, events, RollupAggregator.aggregate(events));
    }

    private static List<Event> burst(String clientIp, int count) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(EventFixtures.event()
                .clientIp(clientIp)
                .userEmail("alice@corp.com")
                .destHost("host" + (i % 3) + ".example.com")
                .timestamp(T0.plusMillis(i * 500L))
                .build());
        }
        return events;
    }

    @Test
    @DisplayName("Should flag one minute above the threshold")
    void shouldFlagBurst() {
        // Given: 60 requests within one minute from one IP
        DetectionScope scope = scopeOf(burst("10.0.0.5", 60));

        // When
        List<Finding> findings = new BurstFromSingleIpRule(50).evaluate(scope);

        // Then
        assertThat(findings).hasSize(1);
        Finding finding = findings.get(0);
        assertThat(finding.getPatternName()).isEqualTo(BurstFromSingleIpRule.PATTERN);
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getEvidence())
            .containsEntry(EvidenceKeys.CLIENT_IP, "10.0.0.5")
            .containsEntry(EvidenceKeys.COUNT, 60L)
            .containsEntry(EvidenceKeys.THRESHOLD, 50L)
            .containsEntry(EvidenceKeys.BUCKET, T0.toString())
            .containsEntry(EvidenceKeys.USER_EMAIL, "alice@corp.com");
        assertThat(finding.getEventIds()).hasSize(AbstractDetectionRule.MAX_SAMPLE_EVENTS);
        assertThat(finding.getConfidence()).isBetween(0.10, 0.99);
    }

    @Test
    @DisplayName("Should escalate to critical at twice the threshold")
    void shouldEscalateToCritical() {
        List<Finding> findings = new BurstFromSingleIpRule(25).evaluate(scopeOf(burst("10.0.0.5", 60)));

        assertThat(findings).singleElement()
            .extracting(Finding::getSeverity)
            .isEqualTo(Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should not flag a count equal to the threshold")
    void shouldNotFlagAtThreshold() {
        assertThat(new BurstFromSingleIpRule(60).evaluate(scopeOf(burst("10.0.0.5", 60)))).isEmpty();
    }

    @Test
    @DisplayName("Should ignore events without client IP or timestamp")
    void shouldIgnoreUnsetDimensions() {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(EventFixtures.event().build());
            events.add(EventFixtures.event().clientIp("10.0.0.6").timestamp(null).build());
        }

        assertThat(new BurstFromSingleIpRule(5).evaluate(scopeOf(events))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new BurstFromSingleIpRule(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
