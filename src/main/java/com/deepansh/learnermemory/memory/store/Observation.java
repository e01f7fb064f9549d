package com.deepansh.learnermemory.memory.store;

import com.deepansh.learnermemory.memory.ConfidenceLevel;
import com.deepansh.learnermemory.memory.MemoryLayer;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * One observation to create-or-merge under (subjectId, layer, key).
 *
 * @param expiresAt  new expiry, non-null only for ephemeral observations
 * @param reactivate reset a terminal record to the layer's initial status
 */
public record Observation(
        String subjectId,
        MemoryLayer layer,
        String key,
        Map<String, Object> content,
        ConfidenceLevel confidence,
        Instant expiresAt,
        Instant observedAt,
        LocalDate observedOn,
        boolean reactivate
) {}
