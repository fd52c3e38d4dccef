package com.proxylens.report;

import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.EvidenceKeys;
import com.proxylens.domain.Finding;
import com.proxylens.domain.IocSet;
import com.proxylens.domain.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.proxylens.domain.FindingFixtures.finding;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IocExtractor Tests")
class IocExtractorTest {

    private final IocExtractor extractor = new IocExtractor();

    @Test
    @DisplayName("Should collect indicators from findings and linked events")
    void shouldExtractIndicators() {
        // Given
        Finding finding = finding("C2", Severity.HIGH, 0.8)
            .evidence(EvidenceKeys.USER_EMAIL, "alice@corp.com")
            .evidence(EvidenceKeys.CLIENT_IP, "10.0.0.5")
            .evidence(EvidenceKeys.DEST_HOST, "CNC.Example.net")
            .evidence("dest_hosts_sample", List.of("intranet", "203.0.113.7"))
            .evidence(EvidenceKeys.URLS, List.of("https://cdn.bad.example.org/payload.bin"))
            .build();
        Event event = EventFixtures.blocked("bob@corp.com", "10.0.0.9", "drop.example.com", "Malware")
            .serverIp("198.51.100.4")
            .build();

        // When
        IocSet iocs = extractor.extract(List.of(finding), List.of(event));

        // Then
        assertThat(iocs.getUsers()).containsExactly("alice@corp.com", "bob@corp.com");
        assertThat(iocs.getIps()).containsExactlyInAnyOrder("10.0.0.5", "10.0.0.9", "198.51.100.4", "203.0.113.7");
        assertThat(iocs.getDomains())
            .containsExactlyInAnyOrder("cnc.example.net", "cdn.bad.example.org", "drop.example.com");
        assertThat(iocs.getUrls())
            .containsExactlyInAnyOrder("https://cdn.bad.example.org/payload.bin", "https://drop.example.com/path");
    }

    @Test
    @DisplayName("Should ignore malformed addresses")
    void shouldIgnoreMalformedIps() {
        Finding finding = finding("A", Severity.LOW, 0.3).evidence(EvidenceKeys.CLIENT_IP, "not-an-ip").build();

        assertThat(extractor.extract(List.of(finding), List.of()).getIps()).isEmpty();
    }

    @Test
    @DisplayName("Should accept only registrable public domains")
    void shouldRecognisePublicDomains() {
        assertThat(IocExtractor.isPublicDomain("evil.example.com")).isTrue();
        assertThat(IocExtractor.isPublicDomain("com")).isFalse();
        assertThat(IocExtractor.isPublicDomain("fileserver")).isFalse();
        assertThat(IocExtractor.isPublicDomain("bad host")).isFalse();
    }
}
