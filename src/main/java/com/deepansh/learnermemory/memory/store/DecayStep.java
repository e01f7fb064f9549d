package com.deepansh.learnermemory.memory.store;

import com.deepansh.learnermemory.memory.ConfidenceLevel;
import com.deepansh.learnermemory.memory.MemoryStatus;

import java.time.Instant;

/**
 * One rung down the decay ladder for a single suspected hypothesis.
 * Applies only if the record still holds {@code expectedConfidence} and has not
 * been touched since {@code staleCutoff}.
 */
public record DecayStep(
        String memoryId,
        ConfidenceLevel expectedConfidence,
        Instant staleCutoff,
        ConfidenceLevel newConfidence,
        MemoryStatus newStatus,
        Instant at
) {}
