package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.config.MemoryProperties;
import com.deepansh.learnermemory.exception.IllegalTransitionException;
import com.deepansh.learnermemory.exception.MemoryNotFoundException;
import com.deepansh.learnermemory.exception.PromotionConflictException;
import com.deepansh.learnermemory.memory.ConfidenceLevel;
import com.deepansh.learnermemory.memory.FakeMemoryStore;
import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryState;
import com.deepansh.learnermemory.memory.MemoryStatus;
import com.deepansh.learnermemory.memory.MemoryWriter;
import com.deepansh.learnermemory.memory.MutableClock;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PromotionEngineTest {

    private static final Instant DAY_0 = Instant.parse("2026-05-10T12:00:00Z");

    private FakeMemoryStore store;
    private MutableClock clock;
    private MemoryWriter writer;
    private PromotionEngine promotionEngine;

    @BeforeEach
    void setUp() {
        store = new FakeMemoryStore();
        clock = new MutableClock(DAY_0);
        writer = new MemoryWriter(store, new MemoryProperties(), clock);
        promotionEngine = new PromotionEngine(store, clock);
    }

    @Test
    void promote_ephemeral_landsInHypothesisNotStable() {
        MemoryRecord observation = writer.write("c1", MemoryLayer.EPHEMERAL, "likes_dinosaurs",
                Map.of(), ConfidenceLevel.MEDIUM, 10);
        writer.write("c1", MemoryLayer.EPHEMERAL, "likes_dinosaurs", Map.of());
        clock.advanceDays(3);

        MemoryRecord promoted = promotionEngine.promote(observation.getId());

        assertThat(promoted.getId()).isEqualTo(observation.getId());
        assertThat(promoted.getLayer()).isEqualTo(MemoryLayer.HYPOTHESIS);
        assertThat(promoted.getStatus()).isEqualTo(MemoryStatus.SUSPECTED);
        assertThat(promoted.getExpiresAt()).isNull();
        assertThat(promoted.getEvidenceCount()).isEqualTo(2);
        assertThat(promoted.getLastConfirmed()).isEqualTo(LocalDate.of(2026, 5, 13));
        assertThat(promoted.getFirstObserved()).isEqualTo(LocalDate.of(2026, 5, 10));
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void promote_twice_reachesStable() {
        MemoryRecord observation = writer.write("c1", MemoryLayer.EPHEMERAL, "likes_dinosaurs", Map.of());

        promotionEngine.promote(observation.getId());
        MemoryRecord stable = promotionEngine.promote(observation.getId());

        assertThat(stable.getLayer()).isEqualTo(MemoryLayer.STABLE);
        assertThat(stable.getStatus()).isEqualTo(MemoryStatus.ACTIVE);
        assertThat(stable.getExpiresAt()).isNull();
    }

    @Test
    void promote_stableActive_returnsRecordUnchanged() {
        MemoryRecord stable = writer.write("c1", MemoryLayer.STABLE, "prefers_visuals", Map.of("a", 1));
        clock.advanceDays(5);

        MemoryRecord again = promotionEngine.promote(stable.getId());

        assertThat(again).isEqualTo(stable);
    }

    @Test
    void promote_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> promotionEngine.promote("nope"))
                .isInstanceOf(MemoryNotFoundException.class);
    }

    @Test
    void promote_expiredEphemeral_isIllegalAndLeavesRecordAlone() {
        MemoryRecord expired = store.put(MemoryRecord.builder()
                .subjectId("c1").layer(MemoryLayer.EPHEMERAL).key("gone")
                .status(MemoryStatus.EXPIRED).confidence(ConfidenceLevel.LOW)
                .evidenceCount(1).lastUpdated(DAY_0).expiresAt(DAY_0).build());

        assertThatThrownBy(() -> promotionEngine.promote(expired.getId()))
                .isInstanceOf(IllegalTransitionException.class)
                .hasMessageContaining("ephemeral")
                .hasMessageContaining("expired");
        assertThat(store.findById(expired.getId())).contains(expired);
    }

    @Test
    void promote_resolvedHypothesis_isIllegal() {
        MemoryRecord resolved = store.put(MemoryRecord.builder()
                .subjectId("c1").layer(MemoryLayer.HYPOTHESIS).key("rejected")
                .status(MemoryStatus.RESOLVED).confidence(ConfidenceLevel.LOW)
                .evidenceCount(1).lastUpdated(DAY_0).build());

        assertThatThrownBy(() -> promotionEngine.promote(resolved.getId()))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void promote_intoOccupiedTier_throwsConflictAndKeepsSource() {
        MemoryRecord observation = writer.write("c1", MemoryLayer.EPHEMERAL, "tired", Map.of());
        writer.write("c1", MemoryLayer.HYPOTHESIS, "tired", Map.of());

        assertThatThrownBy(() -> promotionEngine.promote(observation.getId()))
                .isInstanceOf(PromotionConflictException.class);

        MemoryRecord source = store.findById(observation.getId()).orElseThrow();
        assertThat(source.getLayer()).isEqualTo(MemoryLayer.EPHEMERAL);
        assertThat(source.getExpiresAt()).isNotNull();
    }

    @Test
    void promote_lostRace_returnsWinnersState() {
        MemoryRecord before = MemoryRecord.builder()
                .id("m1").subjectId("c1").layer(MemoryLayer.EPHEMERAL).key("k")
                .status(MemoryStatus.ACTIVE).confidence(ConfidenceLevel.LOW).evidenceCount(1).build();
        MemoryRecord after = before.toBuilder()
                .layer(MemoryLayer.HYPOTHESIS).status(MemoryStatus.SUSPECTED).build();

        MemoryStore racing = mock(MemoryStore.class);
        when(racing.findById("m1")).thenReturn(Optional.of(before), Optional.of(after));
        when(racing.transition(eq("m1"), eq(new MemoryState(MemoryLayer.EPHEMERAL, MemoryStatus.ACTIVE)), any()))
                .thenReturn(Optional.empty());

        MemoryRecord result = new PromotionEngine(racing, clock).promote("m1");

        assertThat(result.getLayer()).isEqualTo(MemoryLayer.HYPOTHESIS);
    }
}
