package com.deepansh.learnermemory.memory.lifecycle;

import com.deepansh.learnermemory.config.MemoryProperties;
import com.deepansh.learnermemory.memory.ConfidenceLevel;
import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryQuery;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryStatus;
import com.deepansh.learnermemory.memory.store.DecayStep;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.deepansh.learnermemory.memory.MemoryInputs.requireText;

/**
 * Weakens suspected hypotheses that have gone without reinforcement.
 *
 * A hypothesis untouched for the staleness window steps down once per call:
 * high → medium → low, and a low one is abandoned (RESOLVED, confidence kept).
 * Each step refreshes lastUpdated, so the next step needs another full window.
 *
 * Ephemeral records are left to expiration and stable ones are never weakened.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DecayEngine {

    private final MemoryStore store;
    private final MemoryProperties properties;
    private final Clock clock;

    /** @return number of records that changed */
    public int decay(String subjectId) {
        requireText(subjectId, "subjectId");

        Instant now = clock.instant();
        // Inclusive: a record exactly one staleness window old counts as stale
        Instant cutoff = now.minus(Duration.ofDays(properties.getStalenessDays()));

        List<MemoryRecord> stale = store.find(MemoryQuery.builder()
                .subjectId(subjectId)
                .layer(MemoryLayer.HYPOTHESIS)
                .status(MemoryStatus.SUSPECTED)
                .updatedAtOrBefore(cutoff)
                .build());

        int decayed = 0;
        for (MemoryRecord memory : stale) {
            ConfidenceLevel current = memory.getConfidence();
            Optional<ConfidenceLevel> weaker = current.weaker();

            DecayStep step = new DecayStep(
                    memory.getId(),
                    current,
                    cutoff,
                    weaker.orElse(current),
                    weaker.isPresent() ? MemoryStatus.SUSPECTED : MemoryStatus.RESOLVED,
                    now);

            if (store.applyDecayStep(step)) {
                decayed++;
                log.debug("Decayed memory [id={}, key={}]: {} → {} ({})", memory.getId(), memory.getKey(),
                        current.wireName(), step.newConfidence().wireName(), step.newStatus().wireName());
            } else {
                log.debug("Memory {} was refreshed during decay, skipped", memory.getId());
            }
        }

        log.info("Decayed {} memories for subject {}", decayed, subjectId);
        return decayed;
    }

    /** Subjects a scheduled sweep should call {@link #decay(String)} for. */
    public List<String> subjectsWithOpenHypotheses() {
        return store.subjectsWithOpenHypotheses();
    }
}
