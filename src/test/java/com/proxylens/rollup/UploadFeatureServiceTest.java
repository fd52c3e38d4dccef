package com.proxylens.rollup;

import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.UploadFeatures;
import com.proxylens.storage.memory.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.proxylens.domain.EventFixtures.T0;
import static com.proxylens.domain.EventFixtures.UPLOAD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("UploadFeatureService Tests")
class UploadFeatureServiceTest {

    private InMemoryEventStore eventStore;
    private UploadFeatureService service;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        service = new UploadFeatureService(eventStore, 2, 30);
    }

    @Test
    @DisplayName("Should profile an upload")
    void shouldComputeFeatures() {
        // Given
        List<Event> events = List.of(
            EventFixtures.blocked("alice@corp.com", "10.0.0.5", "cnc.example.net", "Botnet").build(),
            EventFixtures.blocked("alice@corp.com", "10.0.0.5", "cnc.example.net", "Botnet")
                .timestamp(T0.plusSeconds(600)).build(),
            EventFixtures.event().userEmail("bob@corp.com").urlCategory("DNS over HTTPS").serverIp("1.1.1.1").build(),
            EventFixtures.event().userEmail("carol@corp.com").timestamp(null).build());

        // When
        UploadFeatures features = service.compute(UPLOAD, events);

        // Then
        assertThat(features.getTotalEvents()).isEqualTo(4);
        assertThat(features.getBlocked()).isEqualTo(2);
        assertThat(features.getAllowed()).isEqualTo(2);
        assertThat(features.getUntimedEvents()).isEqualTo(1);
        assertThat(features.getEventsWithServerIp()).isEqualTo(1);
        assertThat(features.getDnsEvents()).isEqualTo(1);
        assertThat(features.getTimeStart()).isEqualTo(T0);
        assertThat(features.getTimeEnd()).isEqualTo(T0.plusSeconds(600));
        assertThat(features.getTopUsers()).containsExactly(
            entry("alice@corp.com", 2L),
            entry("bob@corp.com", 1L));
        assertThat(features.getTopThreatCategories()).containsOnlyKeys("Botnet");
    }

    @Test
    @DisplayName("Should serve cached features until invalidated")
    void shouldCacheUntilInvalidated() {
        eventStore.appendAll(List.of(EventFixtures.event().build()));
        assertThat(service.features(UPLOAD).getTotalEvents()).isEqualTo(1);

        eventStore.appendAll(List.of(EventFixtures.event().build()));
        assertThat(service.features(UPLOAD).getTotalEvents()).isEqualTo(1);

        service.invalidate(UPLOAD);
        assertThat(service.features(UPLOAD).getTotalEvents()).isEqualTo(2);
    }
}
