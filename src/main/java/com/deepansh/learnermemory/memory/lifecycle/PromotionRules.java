package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.memory.MemoryState;

import java.util.Map;
import java.util.Optional;

import static com.deepansh.learnermemory.memory.MemoryLayer.EPHEMERAL;
import static com.deepansh.learnermemory.memory.MemoryLayer.HYPOTHESIS;
import static com.deepansh.learnermemory.memory.MemoryLayer.STABLE;
import static com.deepansh.learnermemory.memory.MemoryStatus.ACTIVE;
import static com.deepansh.learnermemory.memory.MemoryStatus.SUSPECTED;

/**
 * The promotion transition table. States absent from it cannot be promoted.
 *
 * <pre>
 * (ephemeral, active)    → (hypothesis, suspected)
 * (hypothesis, suspected) → (stable, active)
 * (stable, active)        → (stable, active)   no-op
 * </pre>
 */
final class PromotionRules {

    private static final Map<MemoryState, MemoryState> NEXT = Map.of(
            new MemoryState(EPHEMERAL, ACTIVE), new MemoryState(HYPOTHESIS, SUSPECTED),
            new MemoryState(HYPOTHESIS, SUSPECTED), new MemoryState(STABLE, ACTIVE),
            new MemoryState(STABLE, ACTIVE), new MemoryState(STABLE, ACTIVE)
    );

    private PromotionRules() {}

    static Optional<MemoryState> next(MemoryState from) {
        return Optional.ofNullable(NEXT.get(from));
    }
}
