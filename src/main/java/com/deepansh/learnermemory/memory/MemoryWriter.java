package com.deepansh.learnermemory.memory;

import com.deepansh.learnermemory.config.MemoryProperties;
import com.deepansh.learnermemory.exception.MemoryValidationException;
import com.deepansh.learnermemory.memory.store.MemoryStore;
import com.deepansh.learnermemory.memory.store.Observation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.deepansh.learnermemory.memory.MemoryInputs.require;
import static com.deepansh.learnermemory.memory.MemoryInputs.requireText;

/**
 * Entry point for producers: records one observation about a learner.
 *
 * The first observation of a (subjectId, layer, key) creates the record;
 * every later one merges into it and adds exactly one to evidenceCount.
 * Create-or-merge is a single atomic store operation, so concurrent producers
 * writing the same fact never lose an increment.
 *
 * Ephemeral records get a sliding expiry: each write pushes expiresAt to
 * now + ttlDays, so a fact that keeps being observed keeps living.
 *
 * A merge into a RESOLVED or EXPIRED record keeps its status unless the caller
 * asks for reactivation explicitly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MemoryWriter {

    private final MemoryStore store;
    private final MemoryProperties properties;
    private final Clock clock;

    public MemoryRecord write(String subjectId, MemoryLayer layer, String key, Map<String, Object> content) {
        return write(subjectId, layer, key, content, null, null, false);
    }

    public MemoryRecord write(String subjectId, MemoryLayer layer, String key, Map<String, Object> content,
                              ConfidenceLevel confidence, Integer ttlDays) {
        return write(subjectId, layer, key, content, confidence, ttlDays, false);
    }

    /**
     * @param confidence defaults to LOW
     * @param ttlDays    defaults to memory.default-ttl-days; ignored outside the ephemeral layer
     * @param reactivate reset a terminal record to the layer's initial status
     */
    public MemoryRecord write(String subjectId, MemoryLayer layer, String key, Map<String, Object> content,
                              ConfidenceLevel confidence, Integer ttlDays, boolean reactivate) {
        requireText(subjectId, "subjectId");
        require(layer, "layer");
        requireText(key, "key");
        require(content, "content");
        if (ttlDays != null && ttlDays < 1) {
            throw new MemoryValidationException("ttlDays must be at least 1, got " + ttlDays);
        }

        Instant now = clock.instant();
        int ttl = ttlDays != null ? ttlDays : properties.getDefaultTtlDays();
        Instant expiresAt = layer.expires() ? now.plus(Duration.ofDays(ttl)) : null;

        Observation observation = new Observation(
                subjectId,
                layer,
                key,
                new LinkedHashMap<>(content),
                confidence != null ? confidence : ConfidenceLevel.LOW,
                expiresAt,
                now,
                LocalDate.ofInstant(now, clock.getZone()),
                reactivate);

        MemoryRecord record = store.upsertObservation(observation);

        if (record.getEvidenceCount() == 1) {
            log.info("Created {} memory [id={}, key={}] for subject: {}",
                    layer.wireName(), record.getId(), key, subjectId);
        } else {
            log.debug("Merged observation into memory [id={}, key={}, evidence={}]",
                    record.getId(), key, record.getEvidenceCount());
        }
        if (record.getStatus().isTerminal()) {
            log.info("Memory [id={}, key={}] received new evidence but stays {}",
                    record.getId(), key, record.getStatus().wireName());
        }
        return record;
    }
}
