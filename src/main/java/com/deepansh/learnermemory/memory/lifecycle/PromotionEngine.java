package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.exception.IllegalTransitionException;
import com.deepansh.learnermemory.exception.MemoryNotFoundException;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryState;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import com.deepansh.learnermemory.memory.store.StateChange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static com.deepansh.learnermemory.memory.MemoryInputs.requireText;

/**
 * Moves a record one tier up the confidence ladder, in place.
 *
 * The record keeps its id, evidenceCount and firstObserved. Leaving the
 * ephemeral tier drops expiresAt for good; lastConfirmed is stamped with today.
 *
 * The update is conditional on the (layer, status) read beforehand. If another
 * transition lands first the update misses, and the record as that transition
 * left it is returned: two racing promotions advance one tier, not two.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromotionEngine {

    private final MemoryStore store;
    private final Clock clock;

    public MemoryRecord promote(String id) {
        requireText(id, "id");
        MemoryRecord current = store.findById(id).orElseThrow(() -> new MemoryNotFoundException(id));
        MemoryState from = MemoryState.of(current);

        MemoryState to = PromotionRules.next(from)
                .orElseThrow(() -> new IllegalTransitionException(id, from.layer(), from.status(), "promote"));

        if (to.equals(from)) {
            log.debug("Memory {} is already {}, nothing to promote", id, from);
            return current;
        }

        Instant now = clock.instant();
        StateChange change = new StateChange(to, now, LocalDate.ofInstant(now, clock.getZone()), true);

        Optional<MemoryRecord> promoted = store.transition(id, from, change);
        if (promoted.isPresent()) {
            log.info("Promoted memory [id={}, key={}]: {} → {}", id, current.getKey(), from, to);
            return promoted.get();
        }

        MemoryRecord latest = store.findById(id).orElseThrow(() -> new MemoryNotFoundException(id));
        log.warn("Memory {} changed from {} to {} before promotion applied, leaving it as is",
                id, from, MemoryState.of(latest));
        return latest;
    }
}
