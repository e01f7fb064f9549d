package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.exception.ConcurrentUpdateException;
import com.deepansh.learnermemory.exception.IllegalTransitionException;
import com.deepansh.learnermemory.exception.MemoryNotFoundException;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryState;
import com.deepansh.learnermemory.memory.MemoryStatus;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import com.deepansh.learnermemory.memory.store.StateChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

import static com.deepansh.learnermemory.memory.MemoryInputs.require;
import static com.deepansh.learnermemory.memory.MemoryInputs.requireText;

/**
 * External verdict on a hypothesis.
 *
 * VALIDATED goes through the promotion table like any other promote().
 * REJECTED marks the record RESOLVED in its current layer and keeps it for audit.
 * Rejecting an already resolved record returns it unchanged; rejecting an expired
 * one is refused.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ValidationGate {

    private static final int MAX_REJECT_ATTEMPTS = 3;

    private final MemoryStore store;
    private final PromotionEngine promotionEngine;
    private final Clock clock;

    public MemoryRecord validateHypothesis(String id, ValidationOutcome outcome) {
        requireText(id, "id");
        require(outcome, "outcome");

        if (outcome == ValidationOutcome.VALIDATED) {
            return promotionEngine.promote(id);
        }
        return reject(id);
    }

    private MemoryRecord reject(String id) {
        for (int attempt = 1; attempt <= MAX_REJECT_ATTEMPTS; attempt++) {
            MemoryRecord current = store.findById(id).orElseThrow(() -> new MemoryNotFoundException(id));
            MemoryState from = MemoryState.of(current);

            if (from.status() == MemoryStatus.RESOLVED) {
                log.debug("Memory {} already resolved, rejection is a no-op", id);
                return current;
            }
            if (from.status() == MemoryStatus.EXPIRED) {
                throw new IllegalTransitionException(id, from.layer(), from.status(), "reject");
            }

            MemoryState to = new MemoryState(from.layer(), MemoryStatus.RESOLVED);
            Optional<MemoryRecord> rejected = store.transition(id, from,
                    new StateChange(to, clock.instant(), null, false));
            if (rejected.isPresent()) {
                log.info("Rejected memory [id={}, key={}]: {} → {}", id, current.getKey(), from, to);
                return rejected.get();
            }
            log.warn("Memory {} changed while rejecting (attempt {}), re-reading", id, attempt);
        }
        throw new ConcurrentUpdateException(id, "reject", MAX_REJECT_ATTEMPTS);
    }
}
