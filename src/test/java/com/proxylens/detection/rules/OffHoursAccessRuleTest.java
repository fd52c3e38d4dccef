package com.proxylens.detection.rules;

import com.proxylens.detection.DetectionScope;
import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static com.proxylens.domain.EventFixtures.UPLOAD;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OffHoursAccessRule Tests")
class OffHoursAccessRuleTest {

    private static final Instant DAY = Instant.parse("2024-05-01T00:00:00Z");

    private OffHoursAccessRule rule;

    @BeforeEach
    void setUp() {
        rule = new OffHoursAccessRule(7, 20, ZoneId.of("UTC"), 20, 5, 0.6);
    }

    private static List<Event> activity(String user, int onHours, int offHours) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < onHours; i++) {
            events.add(EventFixtures.event().userEmail(user).timestamp(DAY.plusSeconds(10 * 3600 + i * 60L)).build());
        }
        for (int i = 0; i < offHours; i++) {
            events.add(EventFixtures.event().userEmail(user).timestamp(DAY.plusSeconds(2 * 3600 + i * 60L))
                .destHost("night.example.com").build());
        }
        return events;
    }

    @Test
    @DisplayName("Should flag a mostly daytime user with a block of night activity")
    void shouldFlagOffHoursBlock() {
        // Given
        List<Event> events = activity("alice@corp.com", 20, 6);

        // When
        List<Finding> findings = rule.evaluate(new DetectionScope(UPLOAD, events, List.of()));

        // Then
        assertThat(findings).singleElement().satisfies(finding -> {
            assertThat(finding.getSeverity()).isEqualTo(Severity.LOW);
            assertThat(finding.getEvidence())
                .containsEntry(EvidenceKeys.USER_EMAIL, "alice@corp.com")
                .containsEntry(EvidenceKeys.COUNT, 6L)
                .containsEntry("total_events", 26L);
            assertThat(finding.evidenceList("dest_hosts_sample")).containsExactly("night.example.com");
        });
    }

    @Test
    @DisplayName("Should rate many off-hours events as medium")
    void shouldEscalateToMedium() {
        List<Finding> findings = rule.evaluate(new DetectionScope(UPLOAD, activity("alice@corp.com", 30, 15), List.of()));

        assertThat(findings).singleElement().extracting(Finding::getSeverity).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should ignore users below the minimum sample")
    void shouldIgnoreSparseUsers() {
        assertThat(rule.evaluate(new DetectionScope(UPLOAD, activity("bob@corp.com", 8, 6), List.of()))).isEmpty();
    }

    @Test
    @DisplayName("Should ignore always-on accounts")
    void shouldIgnoreAlwaysOnAccounts() {
        assertThat(rule.evaluate(new DetectionScope(UPLOAD, activity("svc@corp.com", 10, 20), List.of()))).isEmpty();
    }

    @Test
    @DisplayName("Should support normal hours wrapping midnight")
    void shouldHandleWrappingWindow() {
        OffHoursAccessRule nightShift = new OffHoursAccessRule(22, 6, ZoneId.of("UTC"), 1, 1, 0.0);

        assertThat(nightShift.isNormalHour(DAY.plusSeconds(23 * 3600))).isTrue();
        assertThat(nightShift.isNormalHour(DAY.plusSeconds(3 * 3600))).isTrue();
        assertThat(nightShift.isNormalHour(DAY.plusSeconds(12 * 3600))).isFalse();
    }
}
