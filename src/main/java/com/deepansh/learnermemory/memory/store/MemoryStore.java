package com.deepansh.learnermemory.memory.store;

import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryQuery;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for memory records.
 *
 * Every mutating method is a single atomic store operation. Implementations must
 * never emulate one with a read followed by a write: concurrent producers merge
 * into the same record and a lost increment silently undercounts evidence.
 *
 * Infrastructure failures surface as StoreUnavailableException.
 */
public interface MemoryStore {

    /**
     * Create the record for the observation's natural key with evidenceCount = 1,
     * or merge into the existing one: overwrite content and confidence, add one to
     * evidenceCount, bump lastUpdated and (ephemeral only) expiresAt.
     */
    MemoryRecord upsertObservation(Observation observation);

    Optional<MemoryRecord> findById(String id);

    /** Natural-key lookup ignoring status; without a layer the most recently updated tier wins. */
    Optional<MemoryRecord> findByKey(String subjectId, String key, MemoryLayer layer);

    List<MemoryRecord> find(MemoryQuery query);

    /**
     * Move a record to {@code change.target()} only if it is still in {@code expected}.
     *
     * @return the updated record, or empty if the record no longer matches
     * @throws com.deepansh.learnermemory.exception.PromotionConflictException
     *         if the target layer already holds the same (subjectId, key)
     */
    Optional<MemoryRecord> transition(String id, MemoryState expected, StateChange change);

    /** @return true if the step applied, false if the record changed in between */
    boolean applyDecayStep(DecayStep step);

    /** Soft-expire every active ephemeral record whose expiresAt is before {@code now}. */
    long expireDue(Instant now);

    /** Subjects that currently hold at least one suspected hypothesis. */
    List<String> subjectsWithOpenHypotheses();
}
