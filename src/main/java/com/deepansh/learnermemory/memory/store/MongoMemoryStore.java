package com.deepansh.learnermemory.memory.store;

import com.deepansh.learnermemory.exception.PromotionConflictException;
import com.deepansh.learnermemory.exception.StoreUnavailableException;
import com.deepansh.learnermemory.memory.MemoryLayer;
import com.deepansh.learnermemory.memory.MemoryQuery;
import com.deepansh.learnermemory.memory.MemoryRecord;
import com.deepansh.learnermemory.memory.MemoryRecordRepository;
import com.deepansh.learnermemory.memory.MemoryState;
import com.deepansh.learnermemory.memory.MemoryStatus;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * MongoDB-backed record store.
 *
 * The merge path is one findAndModify with upsert:
 *   - $inc: {evidenceCount: 1}     0→1 on insert, n→n+1 on update
 *   - $setOnInsert: creation-only fields (firstObserved, and status unless reactivating)
 *   - $set: fields every observation overwrites
 * No field is touched by two operators in the same update (MongoDB error code 40).
 *
 * Two upserts racing to create the same natural key can both miss the match and
 * try to insert; the unique index rejects the loser with a duplicate key error.
 * Re-running the same findAndModify then matches the winner's document and
 * increments it, so no observation is lost.
 *
 * Every state change is a conditional update: the filter carries the state the
 * caller read, so a concurrent change makes the update miss instead of clobbering.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoMemoryStore implements MemoryStore {

    private final MongoTemplate mongoTemplate;
    private final MemoryRecordRepository repository;

    @Override
    public MemoryRecord upsertObservation(Observation observation) {
        Query query = new Query(Criteria.where("subjectId").is(observation.subjectId())
                .and("layer").is(observation.layer())
                .and("key").is(observation.key()));

        Update update = new Update()
                .set("content", observation.content())
                .set("confidence", observation.confidence())
                .set("lastUpdated", observation.observedAt())
                .inc("evidenceCount", 1)
                .setOnInsert("firstObserved", observation.observedOn());

        MemoryStatus initialStatus = observation.layer().initialStatus();
        if (observation.reactivate()) {
            update.set("status", initialStatus);
        } else {
            update.setOnInsert("status", initialStatus);
        }
        if (observation.expiresAt() != null) {
            update.set("expiresAt", observation.expiresAt());
        }

        FindAndModifyOptions options = FindAndModifyOptions.options()
                .upsert(true)
                .returnNew(true);

        MemoryRecord merged;
        try {
            merged = execute("upsert", () ->
                    mongoTemplate.findAndModify(query, update, options, MemoryRecord.class));
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for [subject={}, layer={}, key={}], merging into winner",
                    observation.subjectId(), observation.layer(), observation.key());
            merged = execute("upsert", () ->
                    mongoTemplate.findAndModify(query, update, options, MemoryRecord.class));
        }

        if (merged == null) {
            throw new StoreUnavailableException("Memory store returned no document for upsert of key "
                    + observation.key(), null);
        }
        return merged;
    }

    @Override
    public Optional<MemoryRecord> findById(String id) {
        return execute("findById", () -> repository.findById(id));
    }

    @Override
    public Optional<MemoryRecord> findByKey(String subjectId, String key, MemoryLayer layer) {
        if (layer != null) {
            return execute("findByKey", () -> repository.findBySubjectIdAndLayerAndKey(subjectId, layer, key));
        }
        return execute("findByKey", () -> repository.findFirstBySubjectIdAndKeyOrderByLastUpdatedDesc(subjectId, key));
    }

    @Override
    public List<MemoryRecord> find(MemoryQuery filter) {
        Criteria criteria = Criteria.where("subjectId").is(filter.getSubjectId());
        if (filter.getLayer() != null) {
            criteria.and("layer").is(filter.getLayer());
        }
        if (filter.getStatus() != null) {
            criteria.and("status").is(filter.getStatus());
        }
        if (filter.getKeyPattern() != null) {
            criteria.and("key").regex(Pattern.quote(filter.getKeyPattern()));
        }
        if (filter.getMinConfidence() != null) {
            criteria.and("confidence").in(filter.getMinConfidence().andAbove());
        }
        if (filter.getUpdatedAtOrBefore() != null) {
            criteria.and("lastUpdated").lte(filter.getUpdatedAtOrBefore());
        }

        Query query = new Query(criteria).with(Sort.by(Sort.Direction.DESC, "lastUpdated"));
        return execute("find", () -> mongoTemplate.find(query, MemoryRecord.class));
    }

    @Override
    public Optional<MemoryRecord> transition(String id, MemoryState expected, StateChange change) {
        Query query = new Query(Criteria.where("id").is(id)
                .and("layer").is(expected.layer())
                .and("status").is(expected.status()));

        Update update = new Update()
                .set("layer", change.target().layer())
                .set("status", change.target().status())
                .set("lastUpdated", change.at());
        if (change.confirmedOn() != null) {
            update.set("lastConfirmed", change.confirmedOn());
        }
        if (change.clearExpiry()) {
            update.unset("expiresAt");
        }

        try {
            return Optional.ofNullable(execute("transition", () -> mongoTemplate.findAndModify(
                    query, update, FindAndModifyOptions.options().returnNew(true), MemoryRecord.class)));
        } catch (DuplicateKeyException e) {
            throw new PromotionConflictException(id, change.target().layer(), e);
        }
    }

    @Override
    public boolean applyDecayStep(DecayStep step) {
        Query query = new Query(Criteria.where("id").is(step.memoryId())
                .and("layer").is(MemoryLayer.HYPOTHESIS)
                .and("status").is(MemoryStatus.SUSPECTED)
                .and("confidence").is(step.expectedConfidence())
                .and("lastUpdated").lte(step.staleCutoff()));

        Update update = new Update()
                .set("confidence", step.newConfidence())
                .set("status", step.newStatus())
                .set("lastUpdated", step.at());

        UpdateResult result = execute("decay", () -> mongoTemplate.updateFirst(query, update, MemoryRecord.class));
        return result.getModifiedCount() == 1;
    }

    @Override
    public long expireDue(Instant now) {
        Query query = new Query(Criteria.where("layer").is(MemoryLayer.EPHEMERAL)
                .and("status").is(MemoryStatus.ACTIVE)
                .and("expiresAt").lt(now));

        Update update = new Update()
                .set("status", MemoryStatus.EXPIRED)
                .set("lastUpdated", now);

        UpdateResult result = execute("expire", () -> mongoTemplate.updateMulti(query, update, MemoryRecord.class));
        return result.getModifiedCount();
    }

    @Override
    public List<String> subjectsWithOpenHypotheses() {
        Query query = new Query(Criteria.where("layer").is(MemoryLayer.HYPOTHESIS)
                .and("status").is(MemoryStatus.SUSPECTED));
        return execute("distinctSubjects", () ->
                mongoTemplate.findDistinct(query, "subjectId", MemoryRecord.class, String.class));
    }

    // ─── Error translation ──────────────────────────────────────────────────

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new StoreUnavailableException("Memory store unavailable during " + operation, e);
        }
    }
}
