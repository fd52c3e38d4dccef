package com.proxylens.detection;

import com.proxylens.detection.rules.ThreatCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DetectionConfig Tests")
class DetectionConfigTest {

    @Test
    @DisplayName("Should split and trim configured categories")
    void shouldParseCategories() {
        assertThat(DetectionConfig.parseCategories(" Malware, Phishing ,,Botnet"))
            .containsExactlyInAnyOrder("Malware", "Phishing", "Botnet");
    }

    @Test
    @DisplayName("Should fall back to the built-in set when blank")
    void shouldFallBackToDefaults() {
        assertThat(DetectionConfig.parseCategories("  ")).isEqualTo(ThreatCategories.DEFAULT_HIGH_RISK);
        assertThat(DetectionConfig.parseCategories(null)).isEqualTo(ThreatCategories.DEFAULT_HIGH_RISK);
    }
}
