package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.config.MemoryProperties;
import com.deepansh.learnermemory.exception.ConcurrentUpdateException;
import com.deepansh.learnermemory.exception.IllegalTransitionException;
import com.deepansh.learnermemory.exception.MemoryNotFoundException;
import com.deepansh.learnermemory.memory.ConfidenceLevel;
import com.deepansh.learnermemory.memory.FakeMemoryStore;
import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryReader;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryStatus;
import com.deepansh.learnermemory.memory.MemorySummary;
import com.deepansh.learnermemory.memory.MemoryWriter;
import com.deepansh.learnermemory.memory.MutableClock;
import com.deepansh.learnermemory.memory.SummaryBuilder;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValidationGateTest {

    private static final Instant T0 = Instant.parse("2026-06-01T09:30:00Z");

    private FakeMemoryStore store;
    private MutableClock clock;
    private MemoryWriter writer;
    private ValidationGate gate;

    @BeforeEach
    void setUp() {
        store = new FakeMemoryStore();
        clock = new MutableClock(T0);
        writer = new MemoryWriter(store, new MemoryProperties(), clock);
        gate = new ValidationGate(store, new PromotionEngine(store, clock), clock);
    }

    @Test
    void rejected_hypothesis_isResolvedInPlaceAndDropsOutOfSummary() {
        MemoryRecord hypothesis = writer.write("c1", MemoryLayer.HYPOTHESIS, "struggles_fractions",
                Map.of(), ConfidenceLevel.LOW, null);
        assertThat(hypothesis.getEvidenceCount()).isEqualTo(1);
        assertThat(hypothesis.getStatus()).isEqualTo(MemoryStatus.SUSPECTED);
        assertThat(hypothesis.getExpiresAt()).isNull();

        MemoryRecord rejected = gate.validateHypothesis(hypothesis.getId(), ValidationOutcome.REJECTED);

        assertThat(rejected.getStatus()).isEqualTo(MemoryStatus.RESOLVED);
        assertThat(rejected.getLayer()).isEqualTo(MemoryLayer.HYPOTHESIS);
        assertThat(rejected.getLastConfirmed()).isNull();

        MemorySummary summary = new SummaryBuilder(new MemoryReader(store), new MemoryProperties()).summarize("c1");
        assertThat(summary.getActiveHypotheses()).isEmpty();
        assertThat(summary.getStats().getHypothesisCount()).isZero();
    }

    @Test
    void validated_hypothesis_isPromotedToStable() {
        MemoryRecord hypothesis = writer.write("c1", MemoryLayer.HYPOTHESIS, "rushes_reading", Map.of());

        MemoryRecord validated = gate.validateHypothesis(hypothesis.getId(), ValidationOutcome.VALIDATED);

        assertThat(validated.getLayer()).isEqualTo(MemoryLayer.STABLE);
        assertThat(validated.getStatus()).isEqualTo(MemoryStatus.ACTIVE);
        assertThat(validated.getLastConfirmed()).isNotNull();
    }

    @Test
    void rejected_twice_isIdempotent() {
        MemoryRecord hypothesis = writer.write("c1", MemoryLayer.HYPOTHESIS, "rushes_reading", Map.of());
        MemoryRecord first = gate.validateHypothesis(hypothesis.getId(), ValidationOutcome.REJECTED);
        clock.advanceDays(1);

        MemoryRecord second = gate.validateHypothesis(hypothesis.getId(), ValidationOutcome.REJECTED);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void rejected_expiredRecord_isRefused() {
        MemoryRecord expired = store.put(MemoryRecord.builder()
                .subjectId("c1").layer(MemoryLayer.EPHEMERAL).key("gone")
                .status(MemoryStatus.EXPIRED).confidence(ConfidenceLevel.LOW)
                .evidenceCount(1).lastUpdated(T0).expiresAt(T0).build());

        assertThatThrownBy(() -> gate.validateHypothesis(expired.getId(), ValidationOutcome.REJECTED))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(store.findById(expired.getId())).contains(expired);
    }

    @Test
    void validated_resolvedRecord_isRefusedByPromotionTable() {
        MemoryRecord hypothesis = writer.write("c1", MemoryLayer.HYPOTHESIS, "rushes_reading", Map.of());
        gate.validateHypothesis(hypothesis.getId(), ValidationOutcome.REJECTED);

        assertThatThrownBy(() -> gate.validateHypothesis(hypothesis.getId(), ValidationOutcome.VALIDATED))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    void rejected_recordThatKeepsChanging_givesUpWithConcurrentUpdate() {
        MemoryRecord suspected = MemoryRecord.builder()
                .id("m1").subjectId("c1").layer(MemoryLayer.HYPOTHESIS).key("k")
                .status(MemoryStatus.SUSPECTED).confidence(ConfidenceLevel.LOW).evidenceCount(1).build();
        MemoryStore racing = mock(MemoryStore.class);
        when(racing.findById("m1")).thenReturn(Optional.of(suspected));
        when(racing.transition(eq("m1"), any(), any())).thenReturn(Optional.empty());
        ValidationGate contended = new ValidationGate(racing, new PromotionEngine(racing, clock), clock);

        assertThatThrownBy(() -> contended.validateHypothesis("m1", ValidationOutcome.REJECTED))
                .isInstanceOf(ConcurrentUpdateException.class)
                .hasMessageContaining("m1");
        verify(racing, times(3)).transition(eq("m1"), any(), any());
    }

    @Test
    void unknownId_throwsNotFoundForBothOutcomes() {
        assertThatThrownBy(() -> gate.validateHypothesis("missing", ValidationOutcome.REJECTED))
                .isInstanceOf(MemoryNotFoundException.class);
        assertThatThrownBy(() -> gate.validateHypothesis("missing", ValidationOutcome.VALIDATED))
                .isInstanceOf(MemoryNotFoundException.class);
    }
}
