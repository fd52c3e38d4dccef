package com.proxylens.rollup;

import com.proxylens.domain.Event;
import com.proxylens.domain.EventFixtures;
import com.proxylens.domain.RollupBucket;
import com.proxylens.domain.RollupKey;
import com.proxylens.storage.memory.InMemoryEventStore;
import com.proxylens.storage.memory.InMemoryRollupRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.proxylens.domain.EventFixtures.T0;
import static com.proxylens.domain.EventFixtures.UPLOAD;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RollupAggregator Tests")
class RollupAggregatorTest {

    private InMemoryEventStore eventStore;
    private InMemoryRollupRepository rollupRepository;
    private SimpleMeterRegistry meterRegistry;
    private RollupAggregator aggregator;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        rollupRepository = new InMemoryRollupRepository();
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new RollupAggregator(eventStore, rollupRepository, meterRegistry);
    }

    @Test
    @DisplayName("Should bucket events by minute and dimensions")
    void shouldBucketByMinute() {
        // Given: two events in the same minute, one in the next minute
        eventStore.appendAll(List.of(
            EventFixtures.event().clientIp("10.0.0.5").timestamp(T0.plusSeconds(5)).build(),
            EventFixtures.event().clientIp("10.0.0.5").timestamp(T0.plusSeconds(59)).build(),
            EventFixtures.event().clientIp("10.0.0.5").timestamp(T0.plusSeconds(60)).build()));

        // When
        List<RollupBucket> buckets = aggregator.recompute(UPLOAD);

        // Then
        assertThat(buckets).hasSize(2);
        assertThat(buckets.get(0).getKey().getBucket()).isEqualTo(T0);
        assertThat(buckets.get(0).getTotal()).isEqualTo(2);
        assertThat(buckets.get(1).getKey().getBucket()).isEqualTo(T0.plusSeconds(60));
        assertThat(buckets.get(1).getTotal()).isEqualTo(1);
        assertThat(buckets.get(0).getKey().getUserEmail()).isEqualTo(RollupKey.UNSET);
    }

    @Test
    @DisplayName("Should put untimed events in the sentinel bucket")
    void shouldUseSentinelBucketForUntimedEvents() {
        Event untimed = EventFixtures.event().timestamp(null).build();

        List<RollupBucket> buckets = RollupAggregator.aggregate(List.of(untimed));

        assertThat(buckets).singleElement()
            .satisfies(bucket -> assertThat(bucket.getKey().hasBucket()).isFalse());
    }

    @Test
    @DisplayName("Should produce identical rollups when recomputed")
    void shouldBeIdempotent() {
        eventStore.appendAll(List.of(
            EventFixtures.event().userEmail("a@corp.com").build(),
            EventFixtures.event().userEmail("b@corp.com").build(),
            EventFixtures.event().userEmail("a@corp.com").build()));

        List<RollupBucket> first = aggregator.recompute(UPLOAD);
        List<RollupBucket> second = aggregator.recompute(UPLOAD);

        assertThat(second).isEqualTo(first);
        assertThat(rollupRepository.findByUpload(UPLOAD)).isEqualTo(first);
        assertThat(meterRegistry.timer("proxylens.rollup.recompute").count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should drop stale buckets when events are removed")
    void shouldDropStaleBuckets() {
        eventStore.appendAll(List.of(EventFixtures.event().destHost("old.example.com").build()));
        aggregator.recompute(UPLOAD);

        eventStore.deleteByUpload(UPLOAD);
        eventStore.appendAll(List.of(EventFixtures.event().destHost("new.example.com").build()));
        List<RollupBucket> buckets = aggregator.recompute(UPLOAD);

        assertThat(rollupRepository.findByUpload(UPLOAD)).isEqualTo(buckets);
        assertThat(buckets).extracting(b -> b.getKey().getDestHost()).containsExactly("new.example.com");
    }
}
