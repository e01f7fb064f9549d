package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryBuilderTest {

    private static final Instant T0 = Instant.parse("2026-04-01T00:00:00Z");

    private FakeMemoryStore store;
    private SummaryBuilder summaryBuilder;

    @BeforeEach
    void setUp() {
        store = new FakeMemoryStore();
        summaryBuilder = new SummaryBuilder(new MemoryReader(store), new MemoryProperties());
    }

    @Test
    void summarize_partitionsActiveRecordsByLayer() {
        seed(MemoryLayer.STABLE, "struggles_fractions", MemoryStatus.ACTIVE, 1);
        seed(MemoryLayer.HYPOTHESIS, "rushes_reading", MemoryStatus.ACTIVE, 2);
        seed(MemoryLayer.HYPOTHESIS, "fear_of_tests", MemoryStatus.SUSPECTED, 3);
        seed(MemoryLayer.EPHEMERAL, "likes_dinosaurs", MemoryStatus.ACTIVE, 4);

        MemorySummary summary = summaryBuilder.summarize("c1");

        assertThat(summary.getStablePatterns()).extracting(MemoryRecord::getKey).containsExactly("struggles_fractions");
        assertThat(summary.getActiveHypotheses()).extracting(MemoryRecord::getKey).containsExactly("rushes_reading");
        assertThat(summary.getRecentObservations()).extracting(MemoryRecord::getKey).containsExactly("likes_dinosaurs");
        assertThat(summary.getStats().getTotalMemories()).isEqualTo(3);
        assertThat(summary.getStats().getStableCount()).isEqualTo(1);
        assertThat(summary.getStats().getHypothesisCount()).isEqualTo(1);
        assertThat(summary.getStats().getEphemeralCount()).isEqualTo(1);
    }

    @Test
    void summarize_keepsFiveNewestObservationsButCountsAll() {
        for (int i = 0; i < 8; i++) {
            seed(MemoryLayer.EPHEMERAL, "obs_" + i, MemoryStatus.ACTIVE, i);
        }

        MemorySummary summary = summaryBuilder.summarize("c1");

        assertThat(summary.getRecentObservations()).extracting(MemoryRecord::getKey)
                .containsExactly("obs_7", "obs_6", "obs_5", "obs_4", "obs_3");
        assertThat(summary.getStats().getEphemeralCount()).isEqualTo(8);
        assertThat(summary.getStats().getTotalMemories()).isEqualTo(8);
    }

    @Test
    void summarize_excludesResolvedAndExpired() {
        seed(MemoryLayer.EPHEMERAL, "gone", MemoryStatus.EXPIRED, 1);
        seed(MemoryLayer.STABLE, "dropped", MemoryStatus.RESOLVED, 2);

        MemorySummary summary = summaryBuilder.summarize("c1");

        assertThat(summary.getStats().getTotalMemories()).isZero();
        assertThat(summary.getStablePatterns()).isEmpty();
        assertThat(summary.getRecentObservations()).isEmpty();
    }

    @Test
    void summarize_unknownSubject_isEmptyProfile() {
        MemorySummary summary = summaryBuilder.summarize("nobody");

        assertThat(summary.getSubjectId()).isEqualTo("nobody");
        assertThat(summary.getActiveHypotheses()).isEmpty();
        assertThat(summary.getStats().getTotalMemories()).isZero();
    }

    private void seed(MemoryLayer layer, String key, MemoryStatus status, int minutes) {
        store.put(MemoryRecord.builder()
                .subjectId("c1").layer(layer).key(key).status(status)
                .confidence(ConfidenceLevel.LOW).evidenceCount(1).content(Map.of())
                .lastUpdated(T0.plus(Duration.ofMinutes(minutes)))
                .build());
    }
}
